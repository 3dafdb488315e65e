package com.example.anttrack.config;

import com.example.anttrack.service.source.FFmpegFrameSource;
import com.example.anttrack.service.source.FrameSourceFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.global.opencv_core;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 跟踪参数与帧源配置
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(TrackingProperties.class)
public class AnalysisConfiguration {

    private final TrackingProperties trackingProperties;

    /**
     * 启动时校验并冻结跟踪参数，非法配置直接阻止启动
     */
    @Bean
    public TrackerConfig trackerConfig() {
        return trackingProperties.toConfig();
    }

    @Bean
    public FrameSourceFactory frameSourceFactory() {
        return FFmpegFrameSource::new;
    }

    /**
     * 启动时检查 OpenCV 是否可用并打印调色板
     */
    @Bean
    public CommandLineRunner analysisSetup(TrackerConfig trackerConfig) {
        return args -> {
            log.info("初始化蚂蚁跟踪服务...");
            try {
                log.info("OpenCV 版本: {}", opencv_core.getVersionString());
            } catch (UnsatisfiedLinkError e) {
                log.error("OpenCV 本地库加载失败: {}", e.getMessage(), e);
                throw e;
            }
            log.info("分割模式: {}，门限距离: {}，最大丢失帧数: {}", trackerConfig.getSegmentationMode(),
                    trackerConfig.getTrackMaxGateDistance(), trackerConfig.getTrackMaxMissFrames());
            trackerConfig.getColorPalette().forEach((tag, range) ->
                    log.info("颜色标签 {}: H[{}, {}] S[{}, {}] V[{}, {}]{}", tag, range.getHueMin(), range.getHueMax(),
                            range.getSatMin(), range.getSatMax(), range.getValMin(), range.getValMax(),
                            range.isHueWrapping() ? " (跨零)" : ""));
            trackerConfig.getRegions().forEach((name, r) ->
                    log.info("区域 {}: ({}, {}) {}x{}", name, r.getX(), r.getY(), r.getWidth(), r.getHeight()));
            if (trackerConfig.isMotionEnabled()) {
                log.info("运动检测已开启，阈值 {}", trackerConfig.getMotionThreshold());
            }
            log.info("✅ 跟踪服务初始化完成");
        };
    }
}
