package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 输出记录：每个 (帧号, 轨迹ID) 一条
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackRecord {

    private long frameIndex;
    private int trackId;
    private double x;
    private double y;
    private double area;
    private double orientation;
    private String colorTag;
    private TrackState state;
    private String region;
}
