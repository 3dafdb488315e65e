package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 断点：跟踪器完整工作状态 + 最后完整处理的帧号
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackingCheckpoint {

    private String videoPath;

    private long lastProcessedFrame;

    private int nextTrackId;

    @Builder.Default
    private List<Track> liveTracks = new ArrayList<>();

    @Builder.Default
    private List<Track> retiredTracks = new ArrayList<>();

    /** 单只蚂蚁面积估计的样本窗口 */
    @Builder.Default
    private List<Double> areaSamples = new ArrayList<>();

    private long savedAtMs;
}
