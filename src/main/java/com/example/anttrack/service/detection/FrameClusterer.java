package com.example.anttrack.service.detection;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.BoundingBox;
import com.example.anttrack.dto.Cluster;
import com.example.anttrack.dto.Detection;
import com.example.anttrack.dto.Position;
import com.example.anttrack.exception.ErrorKind;
import com.example.anttrack.util.GeometryUtil;
import com.example.anttrack.util.GeometryUtil.ClusterPartition;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.bytedeco.opencv.global.opencv_imgproc.convexHull;

/**
 * 帧内聚类：把可能属于同一只蚂蚁的多个检测合成为一个候选。
 * <p>
 * 只有当组内已识别成员颜色一致、且该颜色恰好属于一条存活轨迹时才合并；其余情况原样交给跟踪器，由轨迹历史消歧。
 */
@Slf4j
public class FrameClusterer {

    private final TrackerConfig config;

    public FrameClusterer(TrackerConfig config) {
        this.config = config;
    }

    /**
     * @param detections    本帧检测
     * @param liveTagCounts 存活轨迹的颜色标签计数
     */
    public List<Cluster> cluster(List<Detection> detections, Map<String, Integer> liveTagCounts) {
        List<Cluster> clusters = new ArrayList<>();
        if (detections.isEmpty()) {
            return clusters;
        }
        if (detections.size() == 1) {
            clusters.add(Cluster.singleton(detections.get(0)));
            return clusters;
        }

        List<Position> centroids = new ArrayList<>(detections.size());
        detections.forEach(d -> centroids.add(d.getCentroid()));
        ClusterPartition partition = GeometryUtil.cluster(centroids,
                config.getClusterDistanceThreshold(), config.getClusterLinkage());

        if (partition.isEmpty()) {
            log.warn("[{}] {} 个检测无法分组，按单元素处理", ErrorKind.CLUSTERING_FAILURE, detections.size());
            detections.forEach(d -> clusters.add(Cluster.singleton(d)));
            return clusters;
        }

        for (List<Integer> group : partition.getGroups()) {
            List<Detection> members = new ArrayList<>(group.size());
            group.forEach(i -> members.add(detections.get(i)));
            if (members.size() > 1 && isSameBody(members, liveTagCounts)) {
                clusters.add(new Cluster(members, merge(members)));
            } else if (members.size() > 1) {
                clusters.add(new Cluster(members, null));
            } else {
                clusters.add(Cluster.singleton(members.get(0)));
            }
        }
        return clusters;
    }

    /**
     * 展开为跟踪器候选
     */
    public static List<Detection> candidates(List<Cluster> clusters) {
        List<Detection> result = new ArrayList<>();
        clusters.forEach(c -> result.addAll(c.candidates()));
        return result;
    }

    /**
     * 组内已识别成员只有一种颜色，且该颜色只属于一条存活轨迹
     */
    boolean isSameBody(List<Detection> members, Map<String, Integer> liveTagCounts) {
        Set<String> tags = new TreeSet<>();
        for (Detection d : members) {
            if (d.isClassified()) {
                tags.add(d.getColorTag());
            }
        }
        if (tags.size() != 1) {
            return false;
        }
        return liveTagCounts.getOrDefault(tags.iterator().next(), 0) == 1;
    }

    /**
     * 合成检测：面积求和、轮廓取凸包、质心按面积加权、边界框取并集、方向与颜色特征取最大成员
     */
    Detection merge(List<Detection> members) {
        double totalArea = 0;
        double cx = 0;
        double cy = 0;
        int memberCount = 0;
        BoundingBox box = null;
        Detection largest = members.get(0);
        List<Position> allPoints = new ArrayList<>();
        String tag = Detection.UNCLASSIFIED;

        for (Detection d : members) {
            totalArea += d.getArea();
            cx += d.getCentroid().getX() * d.getArea();
            cy += d.getCentroid().getY() * d.getArea();
            memberCount += d.getMemberCount();
            box = box == null ? d.getBoundingBox() : box.union(d.getBoundingBox());
            if (d.getArea() > largest.getArea()) {
                largest = d;
            }
            if (d.getContour() != null) {
                allPoints.addAll(d.getContour());
            }
            if (d.isClassified()) {
                tag = d.getColorTag();
            }
        }

        return largest.toBuilder()
                .contour(hull(allPoints))
                .centroid(new Position(cx / totalArea, cy / totalArea))
                .area(totalArea)
                .boundingBox(box)
                .colorTag(tag)
                .skeleton(null)
                .waist(null)
                .waistDepth(0.0)
                .memberCount(memberCount)
                .build();
    }

    private static List<Position> hull(List<Position> points) {
        if (points.size() < 3) {
            return new ArrayList<>(points);
        }
        try (Mat pointMat = GeometryUtil.toPointMat(points); Mat hull = new Mat()) {
            convexHull(pointMat, hull, false, true);
            return GeometryUtil.toPositions(hull);
        } catch (RuntimeException e) {
            log.debug("合并轮廓凸包失败: {}", e.getMessage());
            return new ArrayList<>(points);
        }
    }
}
