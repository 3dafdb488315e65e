package com.example.anttrack.service.detection;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.MotionPoint;
import com.example.anttrack.dto.RegionOfInterest;
import com.example.anttrack.exception.AnalysisException;
import com.example.anttrack.exception.ErrorKind;
import com.example.anttrack.util.GeometryUtil;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Size;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.bytedeco.opencv.global.opencv_core.absdiff;
import static org.bytedeco.opencv.global.opencv_core.countNonZero;
import static org.bytedeco.opencv.global.opencv_imgproc.CHAIN_APPROX_SIMPLE;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2GRAY;
import static org.bytedeco.opencv.global.opencv_imgproc.GaussianBlur;
import static org.bytedeco.opencv.global.opencv_imgproc.RETR_EXTERNAL;
import static org.bytedeco.opencv.global.opencv_imgproc.THRESH_BINARY;
import static org.bytedeco.opencv.global.opencv_imgproc.boundingRect;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;
import static org.bytedeco.opencv.global.opencv_imgproc.findContours;
import static org.bytedeco.opencv.global.opencv_imgproc.threshold;

/**
 * 帧间运动检测：与上一帧的模糊灰度图做差分、二值化，按区域统计运动像素并输出运动轮廓中心。
 * <p>
 * 第一帧（包括续跑后的第一帧）没有参照帧，不产生运动点。
 */
@Slf4j
public class MotionDetector implements AutoCloseable {

    private final TrackerConfig config;
    private Mat previous;

    public MotionDetector(TrackerConfig config) {
        this.config = config;
    }

    /**
     * @param frame BGR 图像，只读
     * @return 按区域名称、轮廓提取顺序排列的运动点
     */
    public List<MotionPoint> detect(Mat frame) {
        if (frame == null || frame.isNull() || frame.empty() || frame.channels() != 3) {
            throw new AnalysisException(ErrorKind.EMPTY_FRAME, "空帧或非三通道图像");
        }
        Mat gray = new Mat();
        cvtColor(frame, gray, COLOR_BGR2GRAY);
        GaussianBlur(gray, gray, new Size(5, 5), 0);

        Mat reference = previous;
        previous = gray;
        if (reference == null) {
            return Collections.emptyList();
        }
        try (Mat diff = new Mat()) {
            if (reference.rows() != gray.rows() || reference.cols() != gray.cols()) {
                log.debug("帧尺寸变化，运动检测重新开始");
                return Collections.emptyList();
            }
            absdiff(gray, reference, diff);
            threshold(diff, diff, config.getMotionThreshold(), 255, THRESH_BINARY);

            List<MotionPoint> points = new ArrayList<>();
            for (Map.Entry<String, RegionOfInterest> zone : zones(diff).entrySet()) {
                Rect r = GeometryUtil.clip(zone.getValue(), diff.cols(), diff.rows());
                if (r != null) {
                    collect(diff, r, zone.getKey(), points);
                }
            }
            return points;
        } finally {
            reference.close();
        }
    }

    /**
     * 命名区域按名称排序；未配置时为全局感兴趣区域或整帧，名称为 null
     */
    private Map<String, RegionOfInterest> zones(Mat diff) {
        Map<String, RegionOfInterest> zones = new TreeMap<>(Comparator.nullsFirst(Comparator.naturalOrder()));
        if (!config.getRegions().isEmpty()) {
            zones.putAll(config.getRegions());
        } else if (config.getRoi() != null) {
            zones.put(null, config.getRoi());
        } else {
            zones.put(null, new RegionOfInterest(0, 0, diff.cols(), diff.rows()));
        }
        return zones;
    }

    private void collect(Mat diff, Rect r, String region, List<MotionPoint> out) {
        try (Mat view = new Mat(diff, r); Mat zone = view.clone()) {
            int pixels = countNonZero(zone);
            if (pixels <= config.getMotionMinPixels() || pixels >= config.getMotionMaxPixels()) {
                return;
            }
            try (MatVector contours = new MatVector(); Mat hierarchy = new Mat()) {
                findContours(zone, contours, hierarchy, RETR_EXTERNAL, CHAIN_APPROX_SIMPLE);
                for (int i = 0; i < contours.size(); i++) {
                    Rect box = boundingRect(contours.get(i));
                    if (box.width() + box.height() < config.getMotionMinContourSize()) {
                        continue;
                    }
                    out.add(MotionPoint.builder()
                            .x(r.x() + box.x() + box.width() / 2)
                            .y(r.y() + box.y() + box.height() / 2)
                            .region(region)
                            .build());
                }
            }
        }
    }

    @Override
    public void close() {
        if (previous != null) {
            previous.close();
            previous = null;
        }
    }
}
