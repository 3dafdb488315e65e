package com.example.anttrack.service.source;

import com.example.anttrack.exception.AnalysisException;
import com.example.anttrack.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.OpenCVFrameConverter;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * 基于 FFmpegFrameGrabber 的视频帧源，帧号从 0 开始
 */
@Slf4j
public class FFmpegFrameSource implements FrameSource {

    private final String videoPath;
    private final FFmpegFrameGrabber grabber;
    private final OpenCVFrameConverter.ToMat converter = new OpenCVFrameConverter.ToMat();
    private long position = 0;

    public FFmpegFrameSource(String videoPath) {
        this.videoPath = videoPath;
        this.grabber = new FFmpegFrameGrabber(videoPath);
        try {
            grabber.start();
        } catch (FrameGrabber.Exception e) {
            releaseQuietly();
            throw new AnalysisException(ErrorKind.CORRUPT_SOURCE, "无法打开视频: " + videoPath, e);
        }
        log.info("打开视频: {} ({}x{}, {} fps, 约 {} 帧)", videoPath, grabber.getImageWidth(),
                grabber.getImageHeight(), String.format("%.2f", grabber.getFrameRate()),
                grabber.getLengthInVideoFrames());
    }

    @Override
    public VideoFrame next() {
        Frame frame;
        try {
            frame = grabber.grabImage();
        } catch (FrameGrabber.Exception e) {
            throw new AnalysisException(ErrorKind.CORRUPT_SOURCE,
                    String.format("视频 %s 在第 %d 帧读取失败", videoPath, position), e);
        }
        if (frame == null) {
            return null;
        }

        long index = position++;
        long timestampMs = grabber.getTimestamp() / 1000;
        Mat converted = converter.convert(frame);
        // 转换结果引用 grabber 内部缓冲区，下一次 grab 会被覆盖
        Mat image = converted == null ? new Mat() : converted.clone();
        return new VideoFrame(index, timestampMs, image);
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public long getFrameCount() {
        int length = grabber.getLengthInVideoFrames();
        return length > 0 ? length : -1;
    }

    @Override
    public double getFrameRate() {
        return grabber.getFrameRate();
    }

    public int getWidth() {
        return grabber.getImageWidth();
    }

    public int getHeight() {
        return grabber.getImageHeight();
    }

    public String getFormat() {
        return grabber.getFormat();
    }

    @Override
    public boolean isSeekable() {
        return true;
    }

    @Override
    public void seek(long frameIndex) {
        try {
            grabber.setVideoFrameNumber((int) frameIndex);
            position = frameIndex;
        } catch (FrameGrabber.Exception e) {
            throw new AnalysisException(ErrorKind.CORRUPT_SOURCE,
                    String.format("视频 %s 无法定位到第 %d 帧", videoPath, frameIndex), e);
        }
    }

    @Override
    public void close() {
        try {
            grabber.stop();
            grabber.release();
        } catch (FrameGrabber.Exception e) {
            log.warn("关闭视频失败: {} - {}", videoPath, e.getMessage());
        }
    }

    private void releaseQuietly() {
        try {
            grabber.release();
        } catch (FrameGrabber.Exception e) {
            log.debug("释放 grabber 失败: {}", e.getMessage());
        }
    }
}
