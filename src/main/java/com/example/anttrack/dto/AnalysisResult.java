package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 视频分析结果DTO
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AnalysisResult {

    /** 是否成功 */
    private boolean success;

    /** 是否被取消 */
    private boolean cancelled;

    private String jobId;

    /** 错误信息 */
    private String error;

    /** 消息信息 */
    private String message;

    /** 视频路径 */
    private String videoPath;

    /** CSV输出路径 */
    private String csvPath;

    /** 运动点CSV路径，未开启运动检测时为 null */
    private String motionCsvPath;

    /** 断点文件路径 */
    private String checkpointPath;

    /** 处理开始时间 */
    private LocalDateTime startTime;

    /** 处理结束时间 */
    private LocalDateTime endTime;

    /** 总处理时间（毫秒） */
    private long processingTimeMs;

    /** 统计信息 */
    private AnalysisStats stats;

    /** 轨迹摘要 */
    private List<TrackSummary> tracks;

    /** 视频元数据 */
    private VideoMetadata videoMetadata;

    /**
     * 分析统计信息
     */
    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class AnalysisStats {

        /** 处理帧数 */
        private int processedFrames;

        /** 跳过帧数 */
        private int skippedFrames;

        /** 检测总数 */
        private long totalDetections;

        /** 轨迹总数 */
        private int totalTracks;

        /** 最大同时跟踪数 */
        private int maxConcurrentTracks;

        /** 合并事件数 */
        private int mergeCount;

        /** 分裂事件数 */
        private int splitCount;

        /** 终止轨迹数 */
        private int terminatedCount;

        /** 运动点总数 */
        private long totalMotionPoints;

        /** 续跑起始帧，-1 表示从头开始 */
        private long resumedFromFrame;
    }

    /**
     * 视频元数据
     */
    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class VideoMetadata {
        private int width;
        private int height;
        private double fps;
        private long totalFrames;
        private double duration;
        private String format;
        private long fileSize;
    }
}
