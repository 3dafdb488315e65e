package com.example.anttrack.dto;

/**
 * 轨迹生命周期状态
 */
public enum TrackState {
    /** 本帧新建，尚未确认 */
    NEW,
    /** 至少在一帧中被匹配 */
    ACTIVE,
    /** 连续 1..K 帧未匹配 */
    LOST,
    /** 身份被另一条轨迹吸收（遮挡） */
    MERGED,
    /** 超过 K 帧未匹配，移出工作集 */
    TERMINATED;

    public boolean isLive() {
        return this == NEW || this == ACTIVE || this == LOST;
    }
}
