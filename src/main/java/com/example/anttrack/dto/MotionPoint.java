package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 相邻帧差分得到的一个运动区域中心
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MotionPoint {

    private int x;

    private int y;

    /** 所在命名区域，未配置区域时为 null */
    private String region;
}
