package com.example.anttrack.service.source;

/**
 * 帧源工厂，测试中可替换为合成帧源
 */
@FunctionalInterface
public interface FrameSourceFactory {

    /**
     * @throws com.example.anttrack.exception.AnalysisException CORRUPT_SOURCE：视频无法打开
     */
    FrameSource open(String videoPath);
}
