package com.example.anttrack.support;

import org.bytedeco.ffmpeg.global.avcodec;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.OpenCVFrameConverter;
import org.bytedeco.opencv.opencv_core.Mat;

import java.nio.file.Path;
import java.util.function.LongFunction;

/**
 * 用无损 FFV1 编码写出测试视频，解码后的像素与绘制的一致
 */
public final class TestVideos {

    private TestVideos() {
    }

    public static Path record(Path file, int width, int height, int frames, LongFunction<Mat> painter) throws Exception {
        OpenCVFrameConverter.ToMat converter = new OpenCVFrameConverter.ToMat();
        FFmpegFrameRecorder recorder = new FFmpegFrameRecorder(file.toString(), width, height);
        recorder.setFormat("matroska");
        recorder.setVideoCodec(avcodec.AV_CODEC_ID_FFV1);
        recorder.setPixelFormat(avutil.AV_PIX_FMT_BGR0);
        recorder.setFrameRate(25);
        recorder.start();
        try {
            for (long i = 0; i < frames; i++) {
                try (Mat image = painter.apply(i)) {
                    recorder.record(converter.convert(image));
                }
            }
        } finally {
            recorder.stop();
            recorder.release();
        }
        return file;
    }
}
