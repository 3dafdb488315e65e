package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 轨迹摘要
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackSummary {
    private int id;
    private TrackState state;
    private long firstFrame;
    private long lastFrame;
    private int historyLength;
    private String colorTag;
    private int missCount;
    private Integer absorbedInto;
    private Integer parentId;

    public static TrackSummary of(Track track) {
        return TrackSummary.builder()
                .id(track.getId())
                .state(track.getState())
                .firstFrame(track.getBornFrame())
                .lastFrame(track.getLastSeenFrame())
                .historyLength(track.getHistory().size())
                .colorTag(track.getColorTag())
                .missCount(track.getMissCount())
                .absorbedInto(track.getAbsorbedInto())
                .parentId(track.getParentId())
                .build();
    }
}
