package com.example.anttrack.dto;

import com.example.anttrack.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单帧处理结果，输出端每帧取一批
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FrameResult {

    private long frameIndex;

    private long timestampMs;

    private int detectionCount;

    @Builder.Default
    private List<TrackRecord> records = new ArrayList<>();

    /** 运动检测开启时本帧的运动点 */
    @Builder.Default
    private List<MotionPoint> motionPoints = new ArrayList<>();

    /** 本帧未更新跟踪器 */
    private boolean skipped;

    private ErrorKind errorKind;

    private String message;

    public static FrameResult skipped(long frameIndex, long timestampMs, ErrorKind kind, String message) {
        return FrameResult.builder()
                .frameIndex(frameIndex)
                .timestampMs(timestampMs)
                .skipped(true)
                .errorKind(kind)
                .message(message)
                .build();
    }
}
