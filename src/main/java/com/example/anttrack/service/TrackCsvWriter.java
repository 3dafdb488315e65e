package com.example.anttrack.service;

import com.example.anttrack.dto.TrackRecord;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;

/**
 * 轨迹记录CSV输出：表头一行，每条记录一行，未配置区域时 region 列为空。续跑时追加且不重复表头。
 */
public class TrackCsvWriter implements Closeable {

    public static final String HEADER = "frame-index,track-id,x,y,area,orientation,color-tag,state,region";

    private final BufferedWriter writer;

    public TrackCsvWriter(Path path, boolean append) throws IOException {
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

    public void write(List<TrackRecord> records) throws IOException {
        for (TrackRecord r : records) {
            writer.write(format(r));
            writer.newLine();
        }
    }

    public void flush() throws IOException {
        writer.flush();
    }

    static String format(TrackRecord r) {
        return String.format(Locale.ROOT, "%d,%d,%.2f,%.2f,%.1f,%.2f,%s,%s,%s",
                r.getFrameIndex(), r.getTrackId(), r.getX(), r.getY(), r.getArea(), r.getOrientation(),
                r.getColorTag(), r.getState(), r.getRegion() == null ? "" : r.getRegion());
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
