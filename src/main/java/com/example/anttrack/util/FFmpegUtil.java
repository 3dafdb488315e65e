package com.example.anttrack.util;

import com.example.anttrack.dto.AnalysisResult;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FFmpegLogCallback;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Slf4j
public class FFmpegUtil {

    static {
        // 只输出 FFmpeg 错误日志
        avutil.av_log_set_level(avutil.AV_LOG_ERROR);
        FFmpegLogCallback.set();
    }

    private FFmpegUtil() {
    }

    /**
     * 读取视频元数据，失败时返回 null（元数据只用于报告，不影响分析）
     */
    public static AnalysisResult.VideoMetadata getVideoInfo(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.isReadable(path)) {
            log.warn("视频文件无法读取: {}", filePath);
            return null;
        }

        FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(filePath);
        try {
            grabber.start();
            return AnalysisResult.VideoMetadata.builder()
                    .width(grabber.getImageWidth())
                    .height(grabber.getImageHeight())
                    .fps(grabber.getFrameRate())
                    .totalFrames(grabber.getLengthInVideoFrames())
                    .duration(grabber.getLengthInTime() / 1000000.0)
                    .format(grabber.getFormat())
                    .fileSize(Files.size(path))
                    .build();
        } catch (Exception e) {
            log.warn("获取视频信息失败 [文件: {}]: {}", filePath, e.getMessage());
            return null;
        } finally {
            try {
                grabber.release();
            } catch (Exception e) {
                log.warn("关闭媒体流失败", e);
            }
        }
    }
}
