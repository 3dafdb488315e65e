package com.example.anttrack.service.tracking;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.Detection;
import com.example.anttrack.dto.Position;
import com.example.anttrack.dto.Track;
import com.example.anttrack.dto.TrackEvent;
import com.example.anttrack.dto.TrackPoint;
import com.example.anttrack.dto.TrackRecord;
import com.example.anttrack.dto.TrackState;
import com.example.anttrack.dto.TrackingCheckpoint;
import com.example.anttrack.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 蚂蚁身份跟踪器：维护跨帧的轨迹集合，逐帧完成检测与轨迹的关联。
 * <p>
 * 每帧先在未修改的状态上生成完整计划，再一次性提交，计划阶段抛出的异常不会改变跟踪器状态。
 * 匹配采用贪心最近邻（非最优二分图匹配），同代价冲突按最小轨迹ID解决。
 */
@Slf4j
public class AntTracker {

    private static final double COST_EPSILON = 1e-9;

    /** 判断分裂时参考的最近观测数 */
    private static final int RECENT_TAG_WINDOW = 10;

    /** 带腰部凹陷的区域达到典型面积的该倍数即视为多只蚂蚁 */
    static final double WAIST_AREA_RATIO = 1.25;

    private final TrackerConfig config;
    private final AreaEstimator areaEstimator;

    private final TreeMap<Integer, Track> live = new TreeMap<>();
    private final TreeMap<Integer, Track> retired = new TreeMap<>();

    private int nextTrackId = 1;
    private long lastFrameIndex = -1;
    private long ambiguityCount = 0;
    private Map<Integer, Integer> lastAssignment = Collections.emptyMap();

    public AntTracker(TrackerConfig config) {
        this.config = config.validate();
        this.areaEstimator = new AreaEstimator(config.getSingleAntArea());
    }

    /**
     * 用一帧的检测结果更新轨迹集合
     *
     * @param frameIndex 帧号，必须严格递增
     * @param detections 本帧候选检测（可为空列表）
     * @return 本帧所有存活轨迹及本帧退出轨迹的输出记录，按轨迹ID排序
     */
    public List<TrackRecord> update(long frameIndex, List<Detection> detections) {
        if (frameIndex <= lastFrameIndex) {
            throw new IllegalArgumentException("帧号必须递增: " + frameIndex + " <= " + lastFrameIndex);
        }
        List<Detection> dets = detections == null ? Collections.emptyList() : detections;

        FramePlan plan = plan(frameIndex, dets);
        List<Track> retiredNow = commit(frameIndex, dets, plan);
        lastFrameIndex = frameIndex;
        lastAssignment = Collections.unmodifiableMap(plan.matches);

        return records(frameIndex, retiredNow);
    }

    // ------------------------------------------------------------------ 计划

    private FramePlan plan(long frameIndex, List<Detection> dets) {
        FramePlan plan = new FramePlan();
        double typical = areaEstimator.typicalArea();

        // 1. 门限内的候选对，按 (代价, 轨迹ID, 检测下标) 排序
        List<Pair> pairs = new ArrayList<>();
        for (Track track : live.values()) {
            for (int j = 0; j < dets.size(); j++) {
                double cost = cost(track, dets.get(j));
                if (cost <= config.getTrackMaxGateDistance()) {
                    pairs.add(new Pair(track.getId(), j, cost));
                }
            }
        }
        pairs.sort(Comparator.comparingDouble((Pair p) -> p.cost)
                .thenComparingInt(p -> p.trackId)
                .thenComparingInt(p -> p.detIndex));

        // 2. 贪心匹配
        Map<Integer, Pair> detOwner = new TreeMap<>();
        for (Pair p : pairs) {
            Pair owner = detOwner.get(p.detIndex);
            if (plan.matches.containsKey(p.trackId) || owner != null) {
                if (owner != null && owner.trackId != p.trackId && Math.abs(owner.cost - p.cost) < COST_EPSILON
                        && !plan.matches.containsKey(p.trackId)) {
                    ambiguityCount++;
                    log.info("[{}] 帧 {}: 轨迹 {} 与 {} 以相同代价 {} 竞争检测 {}，由轨迹 {} 获得",
                            ErrorKind.ASSIGNMENT_AMBIGUITY, frameIndex, owner.trackId, p.trackId,
                            String.format("%.2f", p.cost), p.detIndex, owner.trackId);
                }
                continue;
            }
            plan.matches.put(p.trackId, p.detIndex);
            detOwner.put(p.detIndex, p);
        }

        // 3. 合并：未匹配轨迹与已分配的多体检测重合
        for (Track track : live.values()) {
            if (plan.matches.containsKey(track.getId())) {
                continue;
            }
            if (track.getState() != TrackState.ACTIVE && track.getState() != TrackState.LOST) {
                continue;
            }
            Integer winner = null;
            double bestCost = Double.MAX_VALUE;
            for (Map.Entry<Integer, Integer> m : plan.matches.entrySet()) {
                Track candidate = live.get(m.getKey());
                Detection det = dets.get(m.getValue());
                double c = cost(track, det);
                if (c <= config.getTrackMaxGateDistance() && c < bestCost - COST_EPSILON
                        && isMultiBody(det, typical, track, candidate)) {
                    bestCost = c;
                    winner = candidate.getId();
                }
            }
            if (winner != null) {
                plan.absorbed.put(track.getId(), winner);
            }
        }

        // 4. 状态转换
        for (Track track : live.values()) {
            int id = track.getId();
            if (plan.matches.containsKey(id)) {
                plan.nextStates.put(id, TrackLifecycle.next(track.getState(), TrackEvent.MATCHED, 0,
                        config.getTrackMaxMissFrames()));
            } else if (plan.absorbed.containsKey(id)) {
                plan.nextStates.put(id, TrackLifecycle.next(track.getState(), TrackEvent.ABSORBED,
                        track.getMissCount(), config.getTrackMaxMissFrames()));
            } else {
                plan.nextStates.put(id, TrackLifecycle.next(track.getState(), TrackEvent.MISSED,
                        track.getMissCount() + 1, config.getTrackMaxMissFrames()));
            }
        }

        // 5. 分裂与新建
        Set<Integer> assignedDets = new HashSet<>(plan.matches.values());
        Set<Integer> usedParents = new HashSet<>();
        for (int j = 0; j < dets.size(); j++) {
            if (assignedDets.contains(j)) {
                continue;
            }
            Integer parent = findSplitParent(dets, j, plan, typical, usedParents);
            if (parent != null) {
                usedParents.add(parent);
            }
            plan.newborn.put(j, parent);
        }
        return plan;
    }

    /**
     * 与检测 j 构成分裂的父轨迹：上一帧为多体区域、本帧已匹配、j 在其门限与分离距离内且颜色兼容
     */
    private Integer findSplitParent(List<Detection> dets, int j, FramePlan plan, double typical,
                                    Set<Integer> usedParents) {
        if (typical <= 0) {
            return null;
        }
        Detection u = dets.get(j);
        Integer best = null;
        double bestDistance = Double.MAX_VALUE;
        for (Map.Entry<Integer, Integer> m : plan.matches.entrySet()) {
            Track w = live.get(m.getKey());
            TrackPoint previous = w.getLastPoint();
            if (usedParents.contains(w.getId())
                    || !isMultiBodyArea(previous.getArea(), previous.getWaistDepth(), typical)) {
                continue;
            }
            double d = w.getLastPosition().distanceTo(u.getCentroid());
            if (d > config.getTrackMaxGateDistance()) {
                continue;
            }
            Detection continued = dets.get(m.getValue());
            if (continued.getCentroid().distanceTo(u.getCentroid()) > config.getSplitMaxSeparation()) {
                continue;
            }
            if (!isTagCompatible(u, w)) {
                continue;
            }
            if (d < bestDistance - COST_EPSILON) {
                bestDistance = d;
                best = w.getId();
            }
        }
        return best;
    }

    private boolean isTagCompatible(Detection u, Track parent) {
        if (!u.isClassified()) {
            return true;
        }
        if (parent.recentTags(RECENT_TAG_WINDOW).contains(u.getColorTag())) {
            return true;
        }
        for (Integer absorbedId : parent.getAbsorbedIds()) {
            Track absorbed = retired.get(absorbedId);
            if (absorbed != null && u.getColorTag().equals(absorbed.getEffectiveTag())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 帧内聚类合成的检测只代表一只蚂蚁；其余按面积判断，尚无典型面积时以两条轨迹最近面积的均值代替。
     */
    private boolean isMultiBody(Detection det, double typical, Track loser, Track winner) {
        if (det.getMemberCount() > 1) {
            return false;
        }
        double reference = typical > 0 ? typical : (loser.getLastArea() + winner.getLastArea()) / 2.0;
        return isMultiBodyArea(det.getArea(), det.getWaistDepth(), reference);
    }

    /**
     * 面积达到 mergeAreaRatio 倍参考面积；轮廓有腰部凹陷时阈值降为 {@link #WAIST_AREA_RATIO} 倍
     */
    private boolean isMultiBodyArea(double area, double waistDepth, double reference) {
        if (reference <= 0) {
            return false;
        }
        double ratio = waistDepth > 0
                ? Math.min(WAIST_AREA_RATIO, config.getMergeAreaRatio())
                : config.getMergeAreaRatio();
        return area >= ratio * reference;
    }

    private double cost(Track track, Detection det) {
        Position last = track.getLastPosition();
        if (!last.isValid() || det.getCentroid() == null || !det.getCentroid().isValid()) {
            return Double.MAX_VALUE;
        }
        double cost = last.distanceTo(det.getCentroid());
        String trackTag = track.getEffectiveTag();
        if (det.isClassified() && trackTag != null && !Detection.UNCLASSIFIED.equals(trackTag)
                && !trackTag.equals(det.getColorTag())) {
            cost += config.getColorMismatchPenalty();
        }
        return cost;
    }

    // ------------------------------------------------------------------ 提交

    private List<Track> commit(long frameIndex, List<Detection> dets, FramePlan plan) {
        double typical = areaEstimator.typicalArea();
        List<Double> samples = new ArrayList<>();
        List<Track> retiredNow = new ArrayList<>();

        for (Map.Entry<Integer, TrackState> e : plan.nextStates.entrySet()) {
            Track track = live.get(e.getKey());
            TrackState next = e.getValue();
            Integer detIndex = plan.matches.get(track.getId());

            if (detIndex != null) {
                Detection det = dets.get(detIndex);
                observe(track, frameIndex, det);
                track.setMissCount(0);
                if (isSingleBody(det, typical)) {
                    samples.add(det.getArea());
                }
            } else if (next == TrackState.MERGED) {
                Integer winnerId = plan.absorbed.get(track.getId());
                track.setAbsorbedInto(winnerId);
                live.get(winnerId).getAbsorbedIds().add(track.getId());
                log.debug("帧 {}: 轨迹 {} 并入轨迹 {}", frameIndex, track.getId(), winnerId);
            } else {
                track.setMissCount(track.getMissCount() + 1);
            }
            track.setState(next);

            if (!next.isLive()) {
                if (next == TrackState.TERMINATED) {
                    log.debug("帧 {}: 轨迹 {} 连续 {} 帧未匹配，终止", frameIndex, track.getId(), track.getMissCount());
                }
                retiredNow.add(track);
            }
        }
        for (Track track : retiredNow) {
            live.remove(track.getId());
            retired.put(track.getId(), track);
        }

        for (Map.Entry<Integer, Integer> e : plan.newborn.entrySet()) {
            Detection det = dets.get(e.getKey());
            Integer parentId = e.getValue();
            Track track = Track.builder()
                    .id(nextTrackId++)
                    .state(TrackState.NEW)
                    .bornFrame(frameIndex)
                    .parentId(parentId)
                    .build();
            if (parentId != null) {
                Track parent = live.get(parentId);
                String tag = parent.getEffectiveTag();
                if (tag != null && !Detection.UNCLASSIFIED.equals(tag)) {
                    track.setColorTag(tag);
                }
                log.debug("帧 {}: 轨迹 {} 分裂出新轨迹 {}", frameIndex, parentId, track.getId());
            } else {
                log.debug("帧 {}: 新建轨迹 {} @ ({}, {})", frameIndex, track.getId(),
                        det.getCentroid().getX(), det.getCentroid().getY());
            }
            observe(track, frameIndex, det);
            if (isSingleBody(det, typical)) {
                samples.add(det.getArea());
            }
            live.put(track.getId(), track);
        }

        samples.forEach(areaEstimator::addSample);
        return retiredNow;
    }

    private boolean isSingleBody(Detection det, double typical) {
        return det.getMemberCount() == 1 && !isMultiBodyArea(det.getArea(), det.getWaistDepth(), typical);
    }

    /**
     * 追加观测并更新颜色投票，稳定标签一旦确立不再改变
     */
    private void observe(Track track, long frameIndex, Detection det) {
        track.getHistory().add(TrackPoint.builder()
                .frameIndex(frameIndex)
                .position(new Position(det.getCentroid().getX(), det.getCentroid().getY()))
                .orientation(det.getOrientation())
                .colorTag(det.getColorTag() == null ? Detection.UNCLASSIFIED : det.getColorTag())
                .area(det.getArea())
                .waistDepth(det.getWaistDepth())
                .region(det.getRegion())
                .build());
        track.setLastSeenFrame(frameIndex);

        if (!det.isClassified()) {
            return;
        }
        int votes = track.getTagVotes().merge(det.getColorTag(), 1, Integer::sum);
        if (track.getColorTag() == null) {
            int total = track.getTagVotes().values().stream().mapToInt(Integer::intValue).sum();
            if (votes >= config.getStickyTagMinObservations() && votes * 2 > total) {
                track.setColorTag(det.getColorTag());
            }
        }
    }

    private List<TrackRecord> records(long frameIndex, List<Track> retiredNow) {
        TreeMap<Integer, Track> visible = new TreeMap<>(live);
        retiredNow.forEach(t -> visible.put(t.getId(), t));

        List<TrackRecord> records = new ArrayList<>(visible.size());
        for (Track track : visible.values()) {
            TrackPoint last = track.getLastPoint();
            String tag = track.getEffectiveTag();
            records.add(TrackRecord.builder()
                    .frameIndex(frameIndex)
                    .trackId(track.getId())
                    .x(last.getPosition().getX())
                    .y(last.getPosition().getY())
                    .area(last.getArea())
                    .orientation(last.getOrientation())
                    .colorTag(tag == null ? Detection.UNCLASSIFIED : tag)
                    .state(track.getState())
                    .region(last.getRegion())
                    .build());
        }
        return records;
    }

    // ------------------------------------------------------------------ 状态与断点

    /**
     * 存活轨迹每种颜色标签的数量，供帧内聚类判断"同一轨迹的颜色"
     */
    public Map<String, Integer> liveTagCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        for (Track track : live.values()) {
            String tag = track.getEffectiveTag();
            if (tag != null && !Detection.UNCLASSIFIED.equals(tag)) {
                counts.merge(tag, 1, Integer::sum);
            }
        }
        return counts;
    }

    public List<Track> getLiveTracks() {
        List<Track> copies = new ArrayList<>(live.size());
        live.values().forEach(t -> copies.add(t.copy()));
        return copies;
    }

    public List<Track> getRetiredTracks() {
        List<Track> copies = new ArrayList<>(retired.size());
        retired.values().forEach(t -> copies.add(t.copy()));
        return copies;
    }

    /**
     * 所有轨迹（存活 + 退出）按ID排序的快照
     */
    public List<Track> getAllTracks() {
        TreeMap<Integer, Track> all = new TreeMap<>(retired);
        all.putAll(live);
        List<Track> copies = new ArrayList<>(all.size());
        all.values().forEach(t -> copies.add(t.copy()));
        return copies;
    }

    /**
     * 最近一帧的匹配结果：轨迹ID -> 检测下标
     */
    public Map<Integer, Integer> getLastAssignment() {
        return lastAssignment;
    }

    public int getLiveCount() {
        return live.size();
    }

    public long getLastFrameIndex() {
        return lastFrameIndex;
    }

    public long getAmbiguityCount() {
        return ambiguityCount;
    }

    public int getNextTrackId() {
        return nextTrackId;
    }

    public double getTypicalArea() {
        return areaEstimator.typicalArea();
    }

    /**
     * 导出完整工作状态，帧号与视频路径由调用方填写
     */
    public TrackingCheckpoint exportState() {
        return TrackingCheckpoint.builder()
                .lastProcessedFrame(lastFrameIndex)
                .nextTrackId(nextTrackId)
                .liveTracks(getLiveTracks())
                .retiredTracks(getRetiredTracks())
                .areaSamples(areaEstimator.getSamples())
                .build();
    }

    /**
     * 从断点恢复，替换当前全部状态
     *
     * @throws IllegalArgumentException 断点中轨迹ID重复、状态不一致、历史为空或ID分配器落后
     */
    public void restore(TrackingCheckpoint checkpoint) {
        TreeMap<Integer, Track> restoredLive = new TreeMap<>();
        TreeMap<Integer, Track> restoredRetired = new TreeMap<>();
        int maxId = 0;
        for (Track t : checkpoint.getLiveTracks()) {
            requireHistory(t);
            if (t.getState() == null || !t.getState().isLive()) {
                throw new IllegalArgumentException("断点中存活轨迹 " + t.getId() + " 状态非法: " + t.getState());
            }
            if (restoredLive.put(t.getId(), t.copy()) != null) {
                throw new IllegalArgumentException("断点中轨迹ID重复: " + t.getId());
            }
            maxId = Math.max(maxId, t.getId());
        }
        for (Track t : checkpoint.getRetiredTracks()) {
            requireHistory(t);
            if (restoredLive.containsKey(t.getId()) || restoredRetired.put(t.getId(), t.copy()) != null) {
                throw new IllegalArgumentException("断点中轨迹ID重复: " + t.getId());
            }
            maxId = Math.max(maxId, t.getId());
        }
        if (checkpoint.getNextTrackId() <= maxId) {
            throw new IllegalArgumentException("断点中下一个轨迹ID " + checkpoint.getNextTrackId()
                    + " 不大于已用最大ID " + maxId);
        }

        live.clear();
        live.putAll(restoredLive);
        retired.clear();
        retired.putAll(restoredRetired);
        nextTrackId = checkpoint.getNextTrackId();
        lastFrameIndex = checkpoint.getLastProcessedFrame();
        areaEstimator.restore(checkpoint.getAreaSamples());
        lastAssignment = Collections.emptyMap();
    }

    private static void requireHistory(Track t) {
        if (t.getHistory() == null || t.getHistory().isEmpty()) {
            throw new IllegalArgumentException("断点中轨迹 " + t.getId() + " 没有任何观测");
        }
    }

    // ------------------------------------------------------------------ 内部类型

    private static final class Pair {
        private final int trackId;
        private final int detIndex;
        private final double cost;

        private Pair(int trackId, int detIndex, double cost) {
            this.trackId = trackId;
            this.detIndex = detIndex;
            this.cost = cost;
        }
    }

    private static final class FramePlan {
        /** 轨迹ID -> 检测下标 */
        private final Map<Integer, Integer> matches = new TreeMap<>();
        /** 被吸收轨迹ID -> 吸收者ID */
        private final Map<Integer, Integer> absorbed = new TreeMap<>();
        private final Map<Integer, TrackState> nextStates = new TreeMap<>();
        /** 未匹配检测下标 -> 分裂父轨迹ID（普通新建为 null） */
        private final Map<Integer, Integer> newborn = new TreeMap<>();
    }
}
