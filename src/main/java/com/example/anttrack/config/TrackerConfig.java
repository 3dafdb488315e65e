package com.example.anttrack.config;

import com.example.anttrack.dto.ClusterLinkage;
import com.example.anttrack.dto.ColorRange;
import com.example.anttrack.dto.RegionOfInterest;
import com.example.anttrack.dto.SegmentationMode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 不可变的跟踪参数，构造时传入每个检测/跟踪组件。
 * 通过 {@link #validate()} 校验后才可使用。
 */
@Value
@Builder(toBuilder = true)
public class TrackerConfig {

    /** 颜色标签 -> HSV范围，保持配置顺序；分类时按标签名排序 */
    @Singular("color")
    Map<String, ColorRange> colorPalette;

    @Builder.Default
    SegmentationMode segmentationMode = SegmentationMode.COLOR_TAG;

    @Builder.Default
    double minBlobArea = 50;

    @Builder.Default
    double maxBlobArea = 5000;

    @Builder.Default
    int morphDilationIters = 1;

    @Builder.Default
    int morphErosionIters = 1;

    /** 前景模式下灰度差阈值 */
    @Builder.Default
    int foregroundThreshold = 40;

    /** 构建背景模型的采样帧数 */
    @Builder.Default
    int backgroundSampleFrames = 10;

    RegionOfInterest roi;

    /** 命名区域（如培养板上的各个孔），非空时只在这些区域内分割，检测与运动点标注所在区域 */
    @Singular("region")
    Map<String, RegionOfInterest> regions;

    @Builder.Default
    boolean skeletonEnabled = false;

    /** 每帧保留的最大区域数，0 表示不限 */
    @Builder.Default
    int maxSubjects = 0;

    @Builder.Default
    double hullDefectMinDepth = 4.0;

    /** 相邻帧灰度差阈值，0 表示不做运动检测 */
    @Builder.Default
    int motionThreshold = 0;

    /** 区域内运动像素数须在 (motionMinPixels, motionMaxPixels) 之间才输出运动点 */
    @Builder.Default
    int motionMinPixels = 20;

    @Builder.Default
    int motionMaxPixels = 20000;

    /** 运动轮廓外接矩形宽高之和的下限 */
    @Builder.Default
    int motionMinContourSize = 6;

    @Builder.Default
    int colorSampleMargin = 1;

    @Builder.Default
    double colorConfidenceMargin = 5.0;

    @Builder.Default
    double clusterDistanceThreshold = 15;

    @Builder.Default
    ClusterLinkage clusterLinkage = ClusterLinkage.SINGLE;

    @Builder.Default
    double trackMaxGateDistance = 40;

    /** K：超过该连续未匹配帧数后终止 */
    @Builder.Default
    int trackMaxMissFrames = 10;

    /** 颜色标签冲突时附加的代价 */
    @Builder.Default
    double colorMismatchPenalty = 20;

    /** 单只蚂蚁的典型面积，0 表示运行时估计 */
    @Builder.Default
    double singleAntArea = 0;

    /** 面积达到典型面积的该倍数视为多只蚂蚁重叠 */
    @Builder.Default
    double mergeAreaRatio = 1.6;

    @Builder.Default
    double splitMaxSeparation = 60;

    @Builder.Default
    int stickyTagMinObservations = 3;

    @Builder.Default
    int frameQueueCapacity = 16;

    @Builder.Default
    int checkpointInterval = 100;

    /**
     * 校验参数取值范围，非法时抛出 IllegalArgumentException
     */
    public TrackerConfig validate() {
        if (colorPalette != null) {
            colorPalette.forEach((tag, range) -> range.validate(tag));
        }
        if (segmentationMode == SegmentationMode.COLOR_TAG && (colorPalette == null || colorPalette.isEmpty())) {
            throw new IllegalArgumentException("颜色标签模式需要至少一个调色板条目");
        }
        require(minBlobArea > 0, "minBlobArea 必须为正");
        require(maxBlobArea >= minBlobArea, "maxBlobArea 不能小于 minBlobArea");
        require(morphDilationIters >= 0 && morphErosionIters >= 0, "形态学迭代次数不能为负");
        require(foregroundThreshold >= 0 && foregroundThreshold <= ColorRange.CHANNEL_MAX, "foregroundThreshold 超出范围");
        require(backgroundSampleFrames > 0, "backgroundSampleFrames 必须为正");
        require(maxSubjects >= 0, "maxSubjects 不能为负");
        require(hullDefectMinDepth >= 0, "hullDefectMinDepth 不能为负");
        if (regions != null) {
            regions.forEach((name, region) -> require(region != null && region.getWidth() > 0 && region.getHeight() > 0
                    && region.getX() >= 0 && region.getY() >= 0, "区域 " + name + " 非法"));
        }
        require(motionThreshold >= 0 && motionThreshold <= ColorRange.CHANNEL_MAX, "motionThreshold 超出范围");
        require(motionMinPixels >= 0, "motionMinPixels 不能为负");
        require(motionMaxPixels > motionMinPixels, "motionMaxPixels 必须大于 motionMinPixels");
        require(motionMinContourSize >= 0, "motionMinContourSize 不能为负");
        require(colorSampleMargin >= 0, "colorSampleMargin 不能为负");
        require(colorConfidenceMargin >= 0, "colorConfidenceMargin 不能为负");
        require(clusterDistanceThreshold >= 0, "clusterDistanceThreshold 不能为负");
        require(trackMaxGateDistance > 0, "trackMaxGateDistance 必须为正");
        require(trackMaxMissFrames >= 0, "trackMaxMissFrames 不能为负");
        require(colorMismatchPenalty >= 0, "colorMismatchPenalty 不能为负");
        require(singleAntArea >= 0, "singleAntArea 不能为负");
        require(mergeAreaRatio > 1.0, "mergeAreaRatio 必须大于1");
        require(splitMaxSeparation > 0, "splitMaxSeparation 必须为正");
        require(stickyTagMinObservations > 0, "stickyTagMinObservations 必须为正");
        require(frameQueueCapacity > 0, "frameQueueCapacity 必须为正");
        require(checkpointInterval > 0, "checkpointInterval 必须为正");
        return this;
    }

    public boolean isMotionEnabled() {
        return motionThreshold > 0;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
