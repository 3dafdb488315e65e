package com.example.anttrack.util;

import com.example.anttrack.dto.ClusterLinkage;
import com.example.anttrack.dto.Position;
import com.example.anttrack.dto.RegionOfInterest;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.bytedeco.javacpp.indexer.IntIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Moments;
import org.bytedeco.opencv.opencv_core.Rect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_32SC2;
import static org.bytedeco.opencv.global.opencv_imgproc.convexHull;
import static org.bytedeco.opencv.global.opencv_imgproc.convexityDefects;
import static org.bytedeco.opencv.global.opencv_imgproc.moments;

/**
 * 空间几何工具：距离聚类、质心、凸包缺陷、距离矩阵。全部为无状态函数。
 */
@Slf4j
public final class GeometryUtil {

    private static final EuclideanDistance EUCLIDEAN = new EuclideanDistance();

    private GeometryUtil() {
    }

    /**
     * 聚类结果：分组数量 + 每组成员（输入下标）
     */
    @Value
    public static class ClusterPartition {
        int groupCount;
        List<List<Integer>> groups;

        public static ClusterPartition empty() {
            return new ClusterPartition(0, Collections.emptyList());
        }

        public boolean isEmpty() {
            return groupCount == 0;
        }
    }

    /**
     * 凸包缺陷：起点、终点、最深点与深度（像素）
     */
    @Value
    public static class HullDefect {
        Position start;
        Position end;
        Position far;
        double depth;
    }

    /**
     * 按距离阈值对点聚类。同组成员在给定连接准则下传递地相距不超过阈值。
     * 少于两个点或数值计算失败时返回空分组，调用方应视为"无法分组"。
     */
    public static ClusterPartition cluster(List<Position> points, double distanceThreshold, ClusterLinkage linkage) {
        if (points == null || points.size() < 2) {
            return ClusterPartition.empty();
        }
        for (Position p : points) {
            if (p == null || !Double.isFinite(p.getX()) || !Double.isFinite(p.getY())) {
                log.debug("聚类输入包含非法坐标: {}", p);
                return ClusterPartition.empty();
            }
        }

        try {
            List<List<Integer>> groups = linkage == ClusterLinkage.AVERAGE
                    ? averageLinkage(points, distanceThreshold)
                    : singleLinkage(points, distanceThreshold);
            return new ClusterPartition(groups.size(), groups);
        } catch (RuntimeException e) {
            log.debug("聚类计算失败: {}", e.getMessage());
            return ClusterPartition.empty();
        }
    }

    /**
     * 最近成员连接：距离阈值图的连通分量，等价于 minPts=0 的 DBSCAN
     */
    private static List<List<Integer>> singleLinkage(List<Position> points, double threshold) {
        List<IndexedPoint> input = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            input.add(new IndexedPoint(i, points.get(i)));
        }

        DBSCANClusterer<IndexedPoint> clusterer = new DBSCANClusterer<>(threshold, 0, EUCLIDEAN);
        List<List<Integer>> groups = new ArrayList<>();
        for (Cluster<IndexedPoint> c : clusterer.cluster(input)) {
            List<Integer> members = new ArrayList<>();
            for (IndexedPoint p : c.getPoints()) {
                members.add(p.index);
            }
            Collections.sort(members);
            groups.add(members);
        }
        groups.sort((a, b) -> Integer.compare(a.get(0), b.get(0)));
        return groups;
    }

    /**
     * 平均连接的凝聚层次聚类，合并到最小平均距离超过阈值为止
     */
    private static List<List<Integer>> averageLinkage(List<Position> points, double threshold) {
        double[][] dist = distanceMatrix(points);
        List<List<Integer>> groups = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            groups.add(new ArrayList<>(Collections.singletonList(i)));
        }

        while (groups.size() > 1) {
            int bestA = -1;
            int bestB = -1;
            double best = Double.MAX_VALUE;
            for (int a = 0; a < groups.size(); a++) {
                for (int b = a + 1; b < groups.size(); b++) {
                    double d = averageDistance(groups.get(a), groups.get(b), dist);
                    if (d < best) {
                        best = d;
                        bestA = a;
                        bestB = b;
                    }
                }
            }
            if (Double.isNaN(best)) {
                throw new ArithmeticException("平均距离为NaN");
            }
            if (best > threshold) {
                break;
            }
            groups.get(bestA).addAll(groups.remove(bestB));
            Collections.sort(groups.get(bestA));
        }
        return groups;
    }

    private static double averageDistance(List<Integer> a, List<Integer> b, double[][] dist) {
        double sum = 0;
        for (int i : a) {
            for (int j : b) {
                sum += dist[i][j];
            }
        }
        return sum / (a.size() * (double) b.size());
    }

    /**
     * 成对欧氏距离矩阵
     */
    public static double[][] distanceMatrix(List<Position> points) {
        int n = points.size();
        double[][] dist = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = points.get(i).distanceTo(points.get(j));
                dist[i][j] = d;
                dist[j][i] = d;
            }
        }
        return dist;
    }

    /**
     * 二值区域的强度加权质心；区域为空时返回哨兵 (-1,-1)
     */
    public static Position centroid(Mat binaryMask) {
        if (binaryMask == null || binaryMask.empty()) {
            return Position.none();
        }
        Moments m = moments(binaryMask, false);
        if (m.m00() <= 0) {
            return Position.none();
        }
        return new Position(m.m10() / m.m00(), m.m01() / m.m00());
    }

    /**
     * 由中心矩计算主轴方向（度）
     */
    public static double orientation(Moments m) {
        double angle = 0.5 * Math.atan2(2 * m.mu11(), m.mu20() - m.mu02());
        return Math.toDegrees(angle);
    }

    /**
     * 轮廓相对凸包的凹陷点，深度不小于 minDepth。用于定位两只接触蚂蚁之间的"腰部"。
     */
    public static List<HullDefect> convexHullDefects(List<Position> contour, double minDepth) {
        if (contour == null || contour.size() < 4) {
            return Collections.emptyList();
        }

        List<HullDefect> result = new ArrayList<>();
        try (Mat points = toPointMat(contour);
             Mat hull = new Mat();
             Mat defects = new Mat()) {
            convexHull(points, hull, false, false);
            if (hull.rows() < 3) {
                return Collections.emptyList();
            }
            convexityDefects(points, hull, defects);
            if (defects.empty()) {
                return Collections.emptyList();
            }
            try (IntIndexer idx = defects.createIndexer()) {
                for (int i = 0; i < defects.rows(); i++) {
                    double depth = idx.get(i, 0, 3) / 256.0;
                    if (depth < minDepth) {
                        continue;
                    }
                    result.add(new HullDefect(
                            contour.get(idx.get(i, 0, 0)),
                            contour.get(idx.get(i, 0, 1)),
                            contour.get(idx.get(i, 0, 2)),
                            depth));
                }
            }
        } catch (RuntimeException e) {
            // 自相交轮廓的凸包下标可能不单调
            log.debug("凸包缺陷计算失败: {}", e.getMessage());
            return Collections.emptyList();
        }
        result.sort((a, b) -> Double.compare(b.getDepth(), a.getDepth()));
        return result;
    }

    /**
     * 区域裁剪到图像范围内，与图像不相交时返回 null
     */
    public static Rect clip(RegionOfInterest region, int cols, int rows) {
        int x = Math.min(region.getX(), cols);
        int y = Math.min(region.getY(), rows);
        int w = Math.min(region.getWidth(), cols - x);
        int h = Math.min(region.getHeight(), rows - y);
        return w > 0 && h > 0 ? new Rect(x, y, w, h) : null;
    }

    /**
     * 点列表转为 CV_32SC2 的 Nx1 Mat
     */
    public static Mat toPointMat(List<Position> points) {
        Mat mat = new Mat(points.size(), 1, CV_32SC2);
        try (IntIndexer idx = mat.createIndexer()) {
            for (int i = 0; i < points.size(); i++) {
                idx.put(i, 0, 0, (int) Math.round(points.get(i).getX()));
                idx.put(i, 0, 1, (int) Math.round(points.get(i).getY()));
            }
        }
        return mat;
    }

    /**
     * CV_32SC2 点集 Mat 转为点列表
     */
    public static List<Position> toPositions(Mat pointMat) {
        if (pointMat == null || pointMat.empty()) {
            return new ArrayList<>();
        }
        int n = (int) pointMat.total();
        List<Position> points = new ArrayList<>(n);
        try (IntIndexer idx = pointMat.createIndexer()) {
            for (int i = 0; i < n; i++) {
                points.add(new Position(idx.get(i, 0, 0), idx.get(i, 0, 1)));
            }
        }
        return points;
    }

    /**
     * 以身份相等的聚类点，避免坐标相同的检测被合并为同一个键
     */
    private static final class IndexedPoint implements Clusterable {
        private final int index;
        private final double[] point;

        private IndexedPoint(int index, Position position) {
            this.index = index;
            this.point = new double[]{position.getX(), position.getY()};
        }

        @Override
        public double[] getPoint() {
            return point;
        }

        @Override
        public String toString() {
            return index + Arrays.toString(point);
        }
    }
}
