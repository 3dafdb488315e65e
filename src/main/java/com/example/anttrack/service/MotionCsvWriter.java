package com.example.anttrack.service;

import com.example.anttrack.dto.MotionPoint;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * 运动点CSV输出，每个运动点一行。续跑时追加且不重复表头。
 */
public class MotionCsvWriter implements Closeable {

    public static final String HEADER = "frame-index,region,x,y";

    private final BufferedWriter writer;

    public MotionCsvWriter(Path path, boolean append) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        boolean writeHeader = !append || !Files.exists(path) || Files.size(path) == 0;
        this.writer = append
                ? Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
                : Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        if (writeHeader) {
            writer.write(HEADER);
            writer.newLine();
        }
    }

    public void write(long frameIndex, List<MotionPoint> points) throws IOException {
        for (MotionPoint p : points) {
            writer.write(frameIndex + "," + (p.getRegion() == null ? "" : p.getRegion()) + "," + p.getX() + "," + p.getY());
            writer.newLine();
        }
    }

    public void flush() throws IOException {
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
