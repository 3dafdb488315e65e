package com.example.anttrack.dto;

import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import java.util.Map;

/**
 * 单个任务可覆盖的跟踪参数，未填写的使用 anttrack.tracking 配置
 */
@Data
public class AnalysisOptions {

    /** 任务ID，用于取消；为空时自动生成 */
    private String jobId;

    /** 是否从断点续跑 */
    private Boolean resume = false;

    /** 分割模式 */
    private SegmentationMode segmentationMode;

    /** 颜色调色板 */
    @Valid
    private Map<String, ColorRange> colorPalette;

    @DecimalMin(value = "1", message = "最小面积不能小于1")
    private Double minBlobArea;

    @DecimalMin(value = "1", message = "最大面积不能小于1")
    private Double maxBlobArea;

    @DecimalMin(value = "0", message = "聚类距离不能为负")
    private Double clusterDistanceThreshold;

    @DecimalMin(value = "0.1", message = "门限距离必须为正")
    private Double trackMaxGateDistance;

    @Min(value = 0, message = "最大丢失帧数不能为负")
    private Integer trackMaxMissFrames;

    @Min(value = 0, message = "膨胀次数不能为负")
    private Integer morphDilationIters;

    @Min(value = 0, message = "腐蚀次数不能为负")
    private Integer morphErosionIters;

    @DecimalMin(value = "0", message = "单只蚂蚁面积不能为负")
    private Double singleAntArea;

    @Min(value = 0, message = "最大个体数不能为负")
    private Integer maxSubjects;

    @Valid
    private RegionOfInterest roi;

    /** 命名区域，替换配置中的区域 */
    @Valid
    private Map<String, RegionOfInterest> regions;

    @Min(value = 0, message = "运动阈值不能为负")
    @Max(value = 255, message = "运动阈值不能超过255")
    private Integer motionThreshold;
}
