package com.example.anttrack.config;

import com.example.anttrack.dto.ClusterLinkage;
import com.example.anttrack.dto.ColorRange;
import com.example.anttrack.dto.RegionOfInterest;
import com.example.anttrack.dto.SegmentationMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * anttrack.tracking.* 配置绑定，启动时转换为不可变的 {@link TrackerConfig}
 */
@Data
@Validated
@ConfigurationProperties(prefix = "anttrack.tracking")
public class TrackingProperties {

    @Valid
    private Map<String, ColorRange> colorPalette = new LinkedHashMap<>();

    @NotNull
    private SegmentationMode segmentationMode = SegmentationMode.COLOR_TAG;

    @DecimalMin("1")
    private double minBlobArea = 50;

    @DecimalMin("1")
    private double maxBlobArea = 5000;

    @Min(0)
    private int morphDilationIters = 1;

    @Min(0)
    private int morphErosionIters = 1;

    @Min(0) @Max(255)
    private int foregroundThreshold = 40;

    @Min(1)
    private int backgroundSampleFrames = 10;

    @Valid
    private RegionOfInterest roi;

    @Valid
    private Map<String, RegionOfInterest> regions = new LinkedHashMap<>();

    private boolean skeletonEnabled = false;

    @Min(0)
    private int maxSubjects = 0;

    @DecimalMin("0")
    private double hullDefectMinDepth = 4.0;

    @Min(0) @Max(255)
    private int motionThreshold = 0;

    @Min(0)
    private int motionMinPixels = 20;

    @Min(1)
    private int motionMaxPixels = 20000;

    @Min(0)
    private int motionMinContourSize = 6;

    @Min(0)
    private int colorSampleMargin = 1;

    @DecimalMin("0")
    private double colorConfidenceMargin = 5.0;

    @DecimalMin("0")
    private double clusterDistanceThreshold = 15;

    @NotNull
    private ClusterLinkage clusterLinkage = ClusterLinkage.SINGLE;

    @DecimalMin("0.1")
    private double trackMaxGateDistance = 40;

    @Min(0)
    private int trackMaxMissFrames = 10;

    @DecimalMin("0")
    private double colorMismatchPenalty = 20;

    @DecimalMin("0")
    private double singleAntArea = 0;

    @DecimalMin("1.01")
    private double mergeAreaRatio = 1.6;

    @DecimalMin("1")
    private double splitMaxSeparation = 60;

    @Min(1)
    private int stickyTagMinObservations = 3;

    @Min(1)
    private int frameQueueCapacity = 16;

    @Min(1)
    private int checkpointInterval = 100;

    public TrackerConfig toConfig() {
        return TrackerConfig.builder()
                .colorPalette(colorPalette)
                .segmentationMode(segmentationMode)
                .minBlobArea(minBlobArea)
                .maxBlobArea(maxBlobArea)
                .morphDilationIters(morphDilationIters)
                .morphErosionIters(morphErosionIters)
                .foregroundThreshold(foregroundThreshold)
                .backgroundSampleFrames(backgroundSampleFrames)
                .roi(roi)
                .regions(regions)
                .skeletonEnabled(skeletonEnabled)
                .maxSubjects(maxSubjects)
                .hullDefectMinDepth(hullDefectMinDepth)
                .motionThreshold(motionThreshold)
                .motionMinPixels(motionMinPixels)
                .motionMaxPixels(motionMaxPixels)
                .motionMinContourSize(motionMinContourSize)
                .colorSampleMargin(colorSampleMargin)
                .colorConfidenceMargin(colorConfidenceMargin)
                .clusterDistanceThreshold(clusterDistanceThreshold)
                .clusterLinkage(clusterLinkage)
                .trackMaxGateDistance(trackMaxGateDistance)
                .trackMaxMissFrames(trackMaxMissFrames)
                .colorMismatchPenalty(colorMismatchPenalty)
                .singleAntArea(singleAntArea)
                .mergeAreaRatio(mergeAreaRatio)
                .splitMaxSeparation(splitMaxSeparation)
                .stickyTagMinObservations(stickyTagMinObservations)
                .frameQueueCapacity(frameQueueCapacity)
                .checkpointInterval(checkpointInterval)
                .build()
                .validate();
    }
}
