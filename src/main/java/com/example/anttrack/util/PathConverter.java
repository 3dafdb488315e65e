package com.example.anttrack.util;

import com.example.anttrack.config.FileStorageConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Component
@RequiredArgsConstructor
public class PathConverter {

    private final FileStorageConfig storageConfig;

    /**
     * 将本地文件路径转换为Web可访问路径，不在输出目录下时返回 null
     */
    public String convertToWebPath(String localPath) {
        if (localPath == null || localPath.isEmpty()) {
            return null;
        }

        Path output = storageConfig.getOutputPath().toAbsolutePath().normalize();
        Path file = Paths.get(localPath).toAbsolutePath().normalize();
        if (!file.startsWith(output)) {
            log.debug("路径不在输出目录下: {}", localPath);
            return null;
        }
        String relative = output.relativize(file).toString().replace("\\", "/");
        return "/outputs/" + relative;
    }

    /**
     * 获取文件名（不含路径和扩展名）
     */
    public String getBaseName(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        String normalizedPath = path.replace("\\", "/");
        String name = normalizedPath.substring(normalizedPath.lastIndexOf("/") + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * 单个视频的输出名：文件名去掉扩展名
     */
    public String outputName(String videoPath) {
        return getBaseName(videoPath);
    }

    /**
     * 批处理中每个视频的输出名，在同一批内互不相同。
     * 取相对文件夹的路径去掉扩展名、目录分隔符换成 "__"；仍重名的附加扩展名，再重名的附加路径散列。
     */
    public Map<Path, String> outputNames(Path folder, List<Path> videos) {
        Map<Path, String> names = new LinkedHashMap<>();
        for (Path video : videos) {
            String relative = relativeName(folder, video);
            int dot = relative.lastIndexOf('.');
            names.put(video, (dot > 0 ? relative.substring(0, dot) : relative).replace("/", "__"));
        }
        for (Path video : duplicated(names)) {
            String extension = extension(video.getFileName().toString());
            if (!extension.isEmpty()) {
                names.put(video, names.get(video) + "_" + extension);
            }
        }
        for (Path video : duplicated(names)) {
            names.put(video, names.get(video) + "_" + String.format("%08x", relativeName(folder, video).hashCode()));
        }
        return names;
    }

    private static String relativeName(Path folder, Path video) {
        Path base = folder.toAbsolutePath().normalize();
        Path file = video.toAbsolutePath().normalize();
        Path relative = file.startsWith(base) ? base.relativize(file) : file.getFileName();
        return relative.toString().replace("\\", "/");
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    private static List<Path> duplicated(Map<Path, String> names) {
        Map<String, Long> counts = names.values().stream()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        return names.entrySet().stream()
                .filter(e -> counts.get(e.getValue()) > 1)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /**
     * CSV 输出路径：请求指定时使用指定路径，否则为输出目录下的 &lt;输出名&gt;.csv
     */
    public Path csvPath(String outputName, String requestedPath) {
        if (requestedPath != null && !requestedPath.isEmpty()) {
            return Paths.get(requestedPath);
        }
        return storageConfig.getOutputPath().resolve(outputName + ".csv");
    }

    public Path motionCsvPath(String outputName) {
        return storageConfig.getOutputPath().resolve(outputName + "_motion.csv");
    }

    public Path checkpointPath(String outputName) {
        return storageConfig.getCheckpointPath().resolve(outputName + ".checkpoint.json");
    }

    public Path backgroundPath(String outputName) {
        return storageConfig.getOutputPath().resolve(outputName + "_bg.png");
    }

    /**
     * 检查文件是否为视频
     */
    public boolean isVideoFile(String fileName) {
        if (fileName == null) return false;
        String extension = fileName.toLowerCase();
        return extension.endsWith(".mp4") || extension.endsWith(".avi") ||
                extension.endsWith(".mov") || extension.endsWith(".mkv") ||
                extension.endsWith(".webm") || extension.endsWith(".flv") ||
                extension.endsWith(".h264");
    }

    /**
     * 列出文件夹中的视频文件，按路径排序
     */
    public List<Path> listVideos(Path folder, boolean recursive) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("文件夹不存在: " + folder);
        }
        try (Stream<Path> files = recursive ? Files.walk(folder) : Files.list(folder)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> isVideoFile(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
