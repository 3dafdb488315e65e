package com.example.anttrack.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * 跨帧的持久身份。只有跟踪器的逐帧更新可以修改它，其它组件只读快照。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Track {

    private int id;

    private TrackState state;

    /** 历史观测，帧号严格递增，只追加 */
    @Builder.Default
    private List<TrackPoint> history = new ArrayList<>();

    private long bornFrame;

    private long lastSeenFrame;

    /** 连续未匹配帧数 */
    private int missCount;

    /** 稳定颜色标签，确立后不再改变 */
    private String colorTag;

    /** 颜色标签投票 */
    @Builder.Default
    private TreeMap<String, Integer> tagVotes = new TreeMap<>();

    /** 被吸收时所并入的轨迹ID */
    private Integer absorbedInto;

    /** 被本轨迹吸收的轨迹ID */
    @Builder.Default
    private List<Integer> absorbedIds = new ArrayList<>();

    /** 分裂产生时的父轨迹ID */
    private Integer parentId;

    @JsonIgnore
    public TrackPoint getLastPoint() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    @JsonIgnore
    public Position getLastPosition() {
        TrackPoint last = getLastPoint();
        return last == null ? Position.none() : last.getPosition();
    }

    @JsonIgnore
    public double getLastArea() {
        TrackPoint last = getLastPoint();
        return last == null ? 0.0 : last.getArea();
    }

    /**
     * 用于代价计算的标签：优先稳定标签，否则用最近一次观测的标签
     */
    @JsonIgnore
    public String getEffectiveTag() {
        if (colorTag != null) {
            return colorTag;
        }
        TrackPoint last = getLastPoint();
        return last == null ? null : last.getColorTag();
    }

    /**
     * 深拷贝，供只读快照和断点使用
     */
    public Track copy() {
        List<TrackPoint> points = new ArrayList<>(history.size());
        for (TrackPoint p : history) {
            points.add(p.toBuilder()
                    .position(new Position(p.getPosition().getX(), p.getPosition().getY()))
                    .build());
        }
        return toBuilder()
                .history(points)
                .tagVotes(new TreeMap<>(tagVotes))
                .absorbedIds(new ArrayList<>(absorbedIds))
                .build();
    }

    /**
     * 最近 window 个观测中出现过的已识别标签
     */
    public Set<String> recentTags(int window) {
        Set<String> tags = new LinkedHashSet<>();
        if (colorTag != null) {
            tags.add(colorTag);
        }
        for (int i = Math.max(0, history.size() - window); i < history.size(); i++) {
            String tag = history.get(i).getColorTag();
            if (tag != null && !Detection.UNCLASSIFIED.equals(tag)) {
                tags.add(tag);
            }
        }
        return tags;
    }
}
