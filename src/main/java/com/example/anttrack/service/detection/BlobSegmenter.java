package com.example.anttrack.service.detection;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.BoundingBox;
import com.example.anttrack.dto.ColorRange;
import com.example.anttrack.dto.Detection;
import com.example.anttrack.dto.Position;
import com.example.anttrack.dto.RegionOfInterest;
import com.example.anttrack.dto.SegmentationMode;
import com.example.anttrack.exception.AnalysisException;
import com.example.anttrack.exception.ErrorKind;
import com.example.anttrack.util.GeometryUtil;
import com.example.anttrack.util.GeometryUtil.HullDefect;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Moments;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.bytedeco.opencv.global.opencv_core.BORDER_CONSTANT;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.absdiff;
import static org.bytedeco.opencv.global.opencv_core.bitwise_and;
import static org.bytedeco.opencv.global.opencv_core.countNonZero;
import static org.bytedeco.opencv.global.opencv_core.findNonZero;
import static org.bytedeco.opencv.global.opencv_imgproc.CHAIN_APPROX_NONE;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2GRAY;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2HSV;
import static org.bytedeco.opencv.global.opencv_imgproc.FILLED;
import static org.bytedeco.opencv.global.opencv_imgproc.LINE_8;
import static org.bytedeco.opencv.global.opencv_imgproc.MORPH_RECT;
import static org.bytedeco.opencv.global.opencv_imgproc.RETR_EXTERNAL;
import static org.bytedeco.opencv.global.opencv_imgproc.THRESH_BINARY;
import static org.bytedeco.opencv.global.opencv_imgproc.boundingRect;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;
import static org.bytedeco.opencv.global.opencv_imgproc.dilate;
import static org.bytedeco.opencv.global.opencv_imgproc.drawContours;
import static org.bytedeco.opencv.global.opencv_imgproc.erode;
import static org.bytedeco.opencv.global.opencv_imgproc.findContours;
import static org.bytedeco.opencv.global.opencv_imgproc.getStructuringElement;
import static org.bytedeco.opencv.global.opencv_imgproc.morphologyDefaultBorderValue;
import static org.bytedeco.opencv.global.opencv_imgproc.moments;
import static org.bytedeco.opencv.global.opencv_imgproc.rectangle;
import static org.bytedeco.opencv.global.opencv_imgproc.threshold;
import static org.bytedeco.opencv.global.opencv_ximgproc.thinning;

/**
 * 单帧分割：阈值 -> 形态学闭运算 -> 外轮廓 -> 面积过滤 -> 几何与颜色特征、腰部凹陷
 */
@Slf4j
public class BlobSegmenter {

    /** 计算骨架的最小长宽比 */
    static final double SKELETON_MIN_ELONGATION = 1.5;

    private final TrackerConfig config;
    private final ColorClassifier classifier;
    private final Mat background;

    /**
     * @param background 前景模式下的背景模型（BGR，与帧同尺寸）；颜色模式可为 null
     */
    public BlobSegmenter(TrackerConfig config, ColorClassifier classifier, Mat background) {
        if (config.getSegmentationMode() == SegmentationMode.FOREGROUND && (background == null || background.empty())) {
            throw new IllegalArgumentException("前景分割模式需要背景模型");
        }
        this.config = config;
        this.classifier = classifier;
        this.background = background;
    }

    /**
     * 分割一帧
     *
     * @param frame BGR 图像，只读
     * @return 按轮廓提取顺序排列的检测；掩码为空时返回空列表
     * @throws AnalysisException EMPTY_FRAME：空帧或格式错误
     */
    public List<Detection> segment(Mat frame) {
        if (frame == null || frame.isNull() || frame.empty() || frame.channels() != 3) {
            throw new AnalysisException(ErrorKind.EMPTY_FRAME, "空帧或非三通道图像");
        }

        List<Detection> detections = new ArrayList<>();
        try (Mat hsv = new Mat()) {
            cvtColor(frame, hsv, COLOR_BGR2HSV);

            if (config.getSegmentationMode() == SegmentationMode.COLOR_TAG) {
                for (Map.Entry<String, ColorRange> e : classifier.getPalette().entrySet()) {
                    try (Mat mask = classifier.mask(hsv, e.getValue())) {
                        extract(mask, hsv, e.getKey(), detections);
                    }
                }
            } else {
                try (Mat mask = foregroundMask(frame)) {
                    extract(mask, hsv, null, detections);
                }
            }
        }

        return limitSubjects(detections);
    }

    private Mat foregroundMask(Mat frame) {
        if (frame.rows() != background.rows() || frame.cols() != background.cols()) {
            throw new AnalysisException(ErrorKind.EMPTY_FRAME, String.format("帧尺寸 %dx%d 与背景 %dx%d 不一致",
                    frame.cols(), frame.rows(), background.cols(), background.rows()));
        }
        Mat mask = new Mat();
        try (Mat diff = new Mat(); Mat gray = new Mat()) {
            absdiff(frame, background, diff);
            cvtColor(diff, gray, COLOR_BGR2GRAY);
            threshold(gray, mask, config.getForegroundThreshold(), 255, THRESH_BINARY);
        }
        return mask;
    }

    /**
     * 对一张掩码做区域限制与闭运算后提取检测
     *
     * @param tag 颜色模式下的调色板标签；前景模式为 null，在质心处分类
     */
    private void extract(Mat mask, Mat hsv, String tag, List<Detection> out) {
        applyRoi(mask);
        close(mask);
        if (countNonZero(mask) == 0) {
            return;
        }

        try (MatVector contours = new MatVector(); Mat hierarchy = new Mat()) {
            findContours(mask, contours, hierarchy, RETR_EXTERNAL, CHAIN_APPROX_NONE);
            for (int i = 0; i < contours.size(); i++) {
                Detection det = describe(contours, i, mask, hsv, tag);
                if (det != null) {
                    out.add(det);
                }
            }
        }
    }

    private Detection describe(MatVector contours, int i, Mat mask, Mat hsv, String tag) {
        Mat contour = contours.get(i);
        Rect r = boundingRect(contour);

        try (Mat filled = new Mat(r.height(), r.width(), CV_8UC1, new Scalar(0))) {
            drawContours(filled, contours, i, new Scalar(255), FILLED, LINE_8, new Mat(), Integer.MAX_VALUE,
                    new Point(-r.x(), -r.y()));
            double area = countNonZero(filled);
            if (area < config.getMinBlobArea() || area > config.getMaxBlobArea()) {
                return null;
            }

            Position local = GeometryUtil.centroid(filled);
            if (!local.isValid()) {
                return null;
            }
            Position centroid = new Position(local.getX() + r.x(), local.getY() + r.y());

            double orientation;
            try (Moments m = moments(filled, true)) {
                orientation = GeometryUtil.orientation(m);
            }

            BoundingBox box = new BoundingBox(r.x(), r.y(), r.width(), r.height());
            String colorTag = tag != null ? tag : classifier.classify(hsv, centroid);
            List<Position> outline = GeometryUtil.toPositions(contour);
            List<HullDefect> defects = GeometryUtil.convexHullDefects(outline, config.getHullDefectMinDepth());
            HullDefect waist = defects.isEmpty() ? null : defects.get(0);

            return Detection.builder()
                    .contour(outline)
                    .centroid(centroid)
                    .area(area)
                    .boundingBox(box)
                    .orientation(orientation)
                    .colorSignature(classifier.signature(hsv, centroid.getX(), centroid.getY()))
                    .colorTag(colorTag)
                    .skeleton(skeleton(filled, box))
                    .region(regionOf(centroid))
                    .waist(waist == null ? null : waist.getFar())
                    .waistDepth(waist == null ? 0.0 : waist.getDepth())
                    .build();
        }
    }

    /**
     * 细长区域的骨架中线（全局坐标），未启用或区域不够细长时返回 null
     */
    private List<Position> skeleton(Mat filled, BoundingBox box) {
        if (!config.isSkeletonEnabled() || box.getElongation() < SKELETON_MIN_ELONGATION) {
            return null;
        }
        try (Mat thin = new Mat(); Mat points = new Mat()) {
            thinning(filled, thin);
            findNonZero(thin, points);
            List<Position> local = GeometryUtil.toPositions(points);
            List<Position> global = new ArrayList<>(local.size());
            for (Position p : local) {
                global.add(new Position(p.getX() + box.getX(), p.getY() + box.getY()));
            }
            return global;
        }
    }

    private void applyRoi(Mat mask) {
        if (config.getRoi() != null) {
            keepOnly(mask, Collections.singletonList(config.getRoi()));
        }
        if (!config.getRegions().isEmpty()) {
            keepOnly(mask, config.getRegions().values());
        }
    }

    /**
     * 掩码只保留给定区域的并集
     */
    private static void keepOnly(Mat mask, Collection<RegionOfInterest> areas) {
        try (Mat keep = new Mat(mask.size(), CV_8UC1, new Scalar(0))) {
            for (RegionOfInterest area : areas) {
                Rect r = GeometryUtil.clip(area, mask.cols(), mask.rows());
                if (r != null) {
                    rectangle(keep, r, new Scalar(255), FILLED, LINE_8, 0);
                }
            }
            bitwise_and(mask, keep, mask);
        }
    }

    /**
     * 质心所在的命名区域（按名称顺序取第一个）；不在任何区域内时取中心最近的区域
     */
    String regionOf(Position p) {
        if (config.getRegions().isEmpty()) {
            return null;
        }
        String nearest = null;
        double best = Double.MAX_VALUE;
        for (Map.Entry<String, RegionOfInterest> e : new TreeMap<>(config.getRegions()).entrySet()) {
            if (e.getValue().contains(p.getX(), p.getY())) {
                return e.getKey();
            }
            double d = p.distanceTo(e.getValue().center());
            if (d < best) {
                best = d;
                nearest = e.getKey();
            }
        }
        return nearest;
    }

    /**
     * 3x3 矩形核，先膨胀后腐蚀
     */
    private void close(Mat mask) {
        try (Mat kernel = getStructuringElement(MORPH_RECT, new Size(3, 3))) {
            if (config.getMorphDilationIters() > 0) {
                dilate(mask, mask, kernel, new Point(-1, -1), config.getMorphDilationIters(),
                        BORDER_CONSTANT, morphologyDefaultBorderValue());
            }
            if (config.getMorphErosionIters() > 0) {
                erode(mask, mask, kernel, new Point(-1, -1), config.getMorphErosionIters(),
                        BORDER_CONSTANT, morphologyDefaultBorderValue());
            }
        }
    }

    /**
     * 只保留面积最大的 maxSubjects 个区域，保持原有顺序
     */
    private List<Detection> limitSubjects(List<Detection> detections) {
        int max = config.getMaxSubjects();
        if (max <= 0 || detections.size() <= max) {
            return detections;
        }
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < detections.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> -detections.get(i).getArea()).thenComparingInt(i -> i));
        List<Integer> keep = new ArrayList<>(order.subList(0, max));
        Collections.sort(keep);

        List<Detection> limited = new ArrayList<>(max);
        keep.forEach(i -> limited.add(detections.get(i)));
        log.debug("区域数 {} 超过上限 {}，丢弃较小的区域", detections.size(), max);
        return limited;
    }
}
