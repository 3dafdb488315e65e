package com.example.anttrack.dto;

/**
 * 驱动轨迹状态转换的事件
 */
public enum TrackEvent {
    MATCHED,
    MISSED,
    ABSORBED
}
