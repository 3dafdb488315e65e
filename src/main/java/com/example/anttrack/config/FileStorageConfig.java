package com.example.anttrack.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Data
@Configuration
@ConfigurationProperties(prefix = "anttrack.storage")
public class FileStorageConfig {

    /** CSV 与背景模型输出目录，通过 /outputs/** 访问 */
    private String outputDir = "outputs";

    private String checkpointDir = "outputs/checkpoints";

    @PostConstruct
    public void init() {
        createDirectoryIfNotExists(outputDir);
        createDirectoryIfNotExists(checkpointDir);
    }

    private void createDirectoryIfNotExists(String directory) {
        try {
            Path path = Paths.get(directory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
        } catch (IOException e) {
            throw new IllegalStateException("无法创建目录: " + directory, e);
        }
    }

    public Path getOutputPath() {
        return Paths.get(outputDir);
    }

    public Path getCheckpointPath() {
        return Paths.get(checkpointDir);
    }
}
