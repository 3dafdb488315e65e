package com.example.anttrack.support;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.ColorRange;
import com.example.anttrack.dto.Detection;
import com.example.anttrack.dto.Position;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgproc.FILLED;
import static org.bytedeco.opencv.global.opencv_imgproc.LINE_8;
import static org.bytedeco.opencv.global.opencv_imgproc.circle;

/**
 * 测试用合成帧与检测
 */
public final class SyntheticFrames {

    /** BGR */
    public static final Scalar RED = new Scalar(0, 0, 255, 0);
    public static final Scalar BLUE = new Scalar(255, 0, 0, 0);
    public static final Scalar WHITE = new Scalar(255, 255, 255, 0);

    private SyntheticFrames() {
    }

    public static Mat blank(int width, int height) {
        return new Mat(height, width, CV_8UC3, new Scalar(0, 0, 0, 0));
    }

    public static Mat filled(int width, int height, Scalar bgr) {
        return new Mat(height, width, CV_8UC3, bgr);
    }

    public static void drawCircle(Mat image, int x, int y, int radius, Scalar bgr) {
        circle(image, new Point(x, y), radius, bgr, FILLED, LINE_8, 0);
    }

    public static Mat circleFrame(int width, int height, int x, int y, int radius, Scalar bgr) {
        Mat image = blank(width, height);
        drawCircle(image, x, y, radius, bgr);
        return image;
    }

    /**
     * 红色 [0,10]（跨零匹配 [170,180]）、蓝色 [100,130] 的调色板配置
     */
    public static TrackerConfig.TrackerConfigBuilder redBlueConfig() {
        return TrackerConfig.builder()
                .color("red", ColorRange.builder().hueMin(0).hueMax(10)
                        .satMin(100).satMax(255).valMin(80).valMax(255).build())
                .color("blue", ColorRange.builder().hueMin(100).hueMax(130)
                        .satMin(100).satMax(255).valMin(60).valMax(255).build());
    }

    public static Detection detection(double x, double y, double area, String tag) {
        return Detection.builder()
                .centroid(new Position(x, y))
                .area(area)
                .colorTag(tag)
                .build();
    }

    public static Detection detection(double x, double y, double area) {
        return detection(x, y, area, Detection.UNCLASSIFIED);
    }
}
