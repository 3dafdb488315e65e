package com.example.anttrack.service.source;

import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * 一帧图像（BGR）及其帧号与时间戳。由驱动方持有，检测组件只读。
 */
@Getter
public class VideoFrame implements AutoCloseable {

    private final long index;
    private final long timestampMs;
    private final Mat image;

    public VideoFrame(long index, long timestampMs, Mat image) {
        this.index = index;
        this.timestampMs = timestampMs;
        this.image = image;
    }

    public boolean isEmpty() {
        return image == null || image.isNull() || image.empty();
    }

    @Override
    public void close() {
        if (image != null && !image.isNull()) {
            image.close();
        }
    }
}
