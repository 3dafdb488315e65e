package com.example.anttrack.service.tracking;

import com.example.anttrack.dto.TrackEvent;
import com.example.anttrack.dto.TrackState;

/**
 * 轨迹状态转换函数，轨迹状态只能经由这里改变。
 *
 * <pre>
 * NEW / ACTIVE / LOST + MATCHED  -> ACTIVE
 * NEW / ACTIVE / LOST + MISSED   -> LOST，丢失计数超过 maxMiss 时 TERMINATED
 * ACTIVE / LOST       + ABSORBED -> MERGED
 * </pre>
 */
public final class TrackLifecycle {

    private TrackLifecycle() {
    }

    /**
     * @param missCount 事件发生后的连续丢失帧数（MISSED 时已加一）
     * @param maxMiss   K
     * @throws IllegalStateException 非法转换
     */
    public static TrackState next(TrackState state, TrackEvent event, int missCount, int maxMiss) {
        if (state == null || event == null) {
            throw new IllegalStateException("状态或事件为空: " + state + " / " + event);
        }
        if (!state.isLive()) {
            throw new IllegalStateException("已退出的轨迹不能再转换: " + state + " + " + event);
        }

        switch (event) {
            case MATCHED:
                return TrackState.ACTIVE;
            case MISSED:
                if (missCount <= 0) {
                    throw new IllegalStateException("MISSED 事件的丢失计数必须为正: " + missCount);
                }
                return missCount > maxMiss ? TrackState.TERMINATED : TrackState.LOST;
            case ABSORBED:
                if (state == TrackState.NEW) {
                    throw new IllegalStateException("新建轨迹不能被吸收");
                }
                return TrackState.MERGED;
            default:
                throw new IllegalStateException("未知事件: " + event);
        }
    }
}
