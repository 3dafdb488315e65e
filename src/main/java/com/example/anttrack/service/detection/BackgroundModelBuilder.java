package com.example.anttrack.service.detection;

import com.example.anttrack.service.source.FrameSource;
import com.example.anttrack.service.source.VideoFrame;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

import static org.bytedeco.opencv.global.opencv_core.CV_32FC3;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;
import static org.bytedeco.opencv.global.opencv_imgproc.accumulateWeighted;

/**
 * 前景分割用的背景模型：对均匀抽取的若干帧求平均，结果缓存为图片以便复用
 */
@Slf4j
public class BackgroundModelBuilder {

    private final int sampleFrames;

    public BackgroundModelBuilder(int sampleFrames) {
        this.sampleFrames = sampleFrames;
    }

    /**
     * 缓存存在时直接读取，否则打开一个新帧源计算并写入缓存
     */
    public Mat loadOrBuild(Path cache, Supplier<FrameSource> sourceSupplier) {
        if (cache != null && Files.exists(cache)) {
            Mat cached = imread(cache.toString());
            if (cached != null && !cached.empty()) {
                log.info("使用缓存的背景模型: {}", cache);
                return cached;
            }
            log.warn("背景缓存无法读取，重新计算: {}", cache);
        }

        Mat background;
        try (FrameSource source = sourceSupplier.get()) {
            background = build(source);
        }
        if (cache != null && !imwrite(cache.toString(), background)) {
            log.warn("背景模型写入失败: {}", cache);
        }
        return background;
    }

    /**
     * 逐帧读取，取均匀间隔的 sampleFrames 帧的平均值
     */
    public Mat build(FrameSource source) {
        long total = source.getFrameCount();
        long step = total > 0 ? Math.max(1, total / sampleFrames) : 1;

        int used = 0;
        try (Mat acc = new Mat(); Mat floatFrame = new Mat()) {
            VideoFrame frame;
            while (used < sampleFrames && (frame = source.next()) != null) {
                try (VideoFrame f = frame) {
                    if (f.getIndex() % step != 0 || f.isEmpty()) {
                        continue;
                    }
                    f.getImage().convertTo(floatFrame, CV_32FC3);
                    if (used == 0) {
                        floatFrame.copyTo(acc);
                    } else {
                        // alpha = 1/(k+1) 时累加结果等于前 k+1 帧的平均
                        accumulateWeighted(f.getImage(), acc, 1.0 / (used + 1));
                    }
                    used++;
                }
            }
            if (used == 0) {
                throw new IllegalStateException("没有可用于背景模型的帧");
            }
            Mat background = new Mat();
            acc.convertTo(background, CV_8UC3);
            log.info("背景模型由 {} 帧计算完成", used);
            return background;
        }
    }
}
