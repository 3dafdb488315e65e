package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 轨迹历史中的一个观测
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackPoint {

    private long frameIndex;

    private Position position;

    private double orientation;

    private String colorTag;

    private double area;

    private String region;

    /** 观测时轮廓最深凹陷的深度，用于判断是否为接触的多只蚂蚁 */
    private double waistDepth;
}
