package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * 帧内距离聚类得到的检测分组，只在单帧处理中存在
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Cluster {

    private List<Detection> members;

    /** 合并后的合成检测；为 null 时成员按独立候选交给跟踪器 */
    private Detection merged;

    public static Cluster singleton(Detection detection) {
        return new Cluster(Collections.singletonList(detection), null);
    }

    public boolean isMerged() {
        return merged != null;
    }

    /**
     * 交给跟踪器的候选检测
     */
    public List<Detection> candidates() {
        return isMerged() ? Collections.singletonList(merged) : members;
    }
}
