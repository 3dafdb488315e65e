package com.example.anttrack.service.impl;

import com.example.anttrack.dto.Position;
import com.example.anttrack.dto.Track;
import com.example.anttrack.dto.TrackPoint;
import com.example.anttrack.dto.TrackState;
import com.example.anttrack.dto.TrackingCheckpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.Assert.*;

public class JsonCheckpointServiceImplTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final JsonCheckpointServiceImpl service = new JsonCheckpointServiceImpl(new ObjectMapper());

    private static TrackingCheckpoint sample() {
        Track live = Track.builder().id(3).state(TrackState.LOST).bornFrame(2).lastSeenFrame(9).missCount(2)
                .colorTag("red").parentId(1).build();
        live.getHistory().add(TrackPoint.builder().frameIndex(9).position(new Position(12.5, 40.25))
                .orientation(-33.7).colorTag("red").area(311).build());
        live.getTagVotes().put("red", 4);
        live.getTagVotes().put("blue", 1);

        Track merged = Track.builder().id(2).state(TrackState.MERGED).absorbedInto(1).build();

        return TrackingCheckpoint.builder()
                .videoPath("videos/colony.mp4")
                .lastProcessedFrame(10)
                .nextTrackId(4)
                .liveTracks(Arrays.asList(live))
                .retiredTracks(Arrays.asList(merged))
                .areaSamples(Arrays.asList(300.0, 310.5))
                .savedAtMs(1700000000000L)
                .build();
    }

    @Test
    public void testSaveAndLoad() throws Exception {
        Path file = tmp.getRoot().toPath().resolve("checkpoints/colony.checkpoint.json");
        TrackingCheckpoint checkpoint = sample();

        service.save(file, checkpoint);
        Optional<TrackingCheckpoint> loaded = service.load(file);

        assertTrue("断点文件应存在", Files.exists(file));
        assertTrue(loaded.isPresent());
        assertEquals("读回的断点应与保存的一致", checkpoint, loaded.get());
    }

    @Test
    public void testSaveReplacesPreviousCheckpoint() throws Exception {
        Path file = tmp.getRoot().toPath().resolve("colony.checkpoint.json");
        service.save(file, sample());

        TrackingCheckpoint newer = sample();
        newer.setLastProcessedFrame(99);
        service.save(file, newer);

        assertEquals(99, service.load(file).get().getLastProcessedFrame());
        try (Stream<Path> files = Files.list(tmp.getRoot().toPath())) {
            assertEquals("不应残留临时文件", 1, files.count());
        }
    }

    @Test
    public void testLoadMissingIsEmpty() throws Exception {
        assertFalse(service.load(tmp.getRoot().toPath().resolve("none.json")).isPresent());
    }

    @Test
    public void testDelete() throws Exception {
        Path file = tmp.getRoot().toPath().resolve("colony.checkpoint.json");
        service.save(file, sample());

        service.delete(file);
        service.delete(file);

        assertFalse(Files.exists(file));
    }
}
