package com.example.anttrack.service.impl;

import com.example.anttrack.dto.TrackingCheckpoint;
import com.example.anttrack.service.CheckpointService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JsonCheckpointServiceImpl implements CheckpointService {

    private final ObjectMapper objectMapper;

    @Override
    public void save(Path path, TrackingCheckpoint checkpoint) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }

        Path temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), checkpoint);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("断点已保存: {} (帧 {}, 存活轨迹 {})", path, checkpoint.getLastProcessedFrame(),
                checkpoint.getLiveTracks().size());
    }

    @Override
    public Optional<TrackingCheckpoint> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(path.toFile(), TrackingCheckpoint.class));
    }

    @Override
    public void delete(Path path) throws IOException {
        Files.deleteIfExists(path);
    }
}
