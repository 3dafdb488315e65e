package com.example.anttrack.service.detection;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.ColorRange;
import com.example.anttrack.dto.ColorSignature;
import com.example.anttrack.dto.Detection;
import com.example.anttrack.dto.Position;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;

import java.util.Map;
import java.util.TreeMap;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.bitwise_or;
import static org.bytedeco.opencv.global.opencv_core.inRange;

/**
 * HSV颜色特征提取与调色板分类。
 * <p>
 * 色相按 OpenCV 8 位约定取 [0,180)。hueMin 为 0 的调色板条目同时匹配 [180-hueMax, 180)，用于跨零的红色。
 */
public class ColorClassifier {

    private static final int HUE_HALF = ColorRange.HUE_RANGE / 2;

    private final TreeMap<String, ColorRange> palette;
    private final int margin;
    private final double confidenceMargin;

    public ColorClassifier(TrackerConfig config) {
        this.palette = new TreeMap<>(config.getColorPalette());
        this.margin = config.getColorSampleMargin();
        this.confidenceMargin = config.getColorConfidenceMargin();
    }

    public Map<String, ColorRange> getPalette() {
        return palette;
    }

    /**
     * 以 (x,y) 为中心、(2m+1)² 邻域（裁剪到图像内）的 HSV 中位数与总体标准差
     *
     * @param hsv CV_8UC3 的 HSV 图像
     */
    public ColorSignature signature(Mat hsv, double x, double y) {
        int cx = (int) Math.round(x);
        int cy = (int) Math.round(y);
        int x0 = Math.max(0, cx - margin);
        int x1 = Math.min(hsv.cols() - 1, cx + margin);
        int y0 = Math.max(0, cy - margin);
        int y1 = Math.min(hsv.rows() - 1, cy + margin);
        if (x0 > x1 || y0 > y1) {
            throw new IllegalArgumentException(String.format("采样点 (%.1f, %.1f) 不在图像内", x, y));
        }

        int n = (x1 - x0 + 1) * (y1 - y0 + 1);
        double[] hue = new double[n];
        double[] sat = new double[n];
        double[] val = new double[n];
        int k = 0;
        try (UByteIndexer idx = hsv.createIndexer()) {
            for (int r = y0; r <= y1; r++) {
                for (int c = x0; c <= x1; c++) {
                    hue[k] = idx.get(r, c, 0);
                    sat[k] = idx.get(r, c, 1);
                    val[k] = idx.get(r, c, 2);
                    k++;
                }
            }
        }

        double[] hueStats = circularHueStats(hue);
        return ColorSignature.builder()
                .hueMedian(hueStats[0])
                .hueStd(hueStats[1])
                .satMedian(median(sat))
                .satStd(std(sat))
                .valMedian(median(val))
                .valStd(std(val))
                .build();
    }

    /**
     * 色相中位数与标准差。样本跨越 0/180 时改用平移半圈后的数值计算，中位数再换算回 [0,180)。
     */
    static double[] circularHueStats(double[] hue) {
        double[] shifted = new double[hue.length];
        for (int i = 0; i < hue.length; i++) {
            shifted[i] = (hue[i] + HUE_HALF) % ColorRange.HUE_RANGE;
        }
        double rawStd = std(hue);
        double shiftedStd = std(shifted);
        if (shiftedStd + 1e-9 < rawStd) {
            double m = median(shifted) - HUE_HALF;
            if (m < 0) {
                m += ColorRange.HUE_RANGE;
            }
            return new double[]{m, shiftedStd};
        }
        return new double[]{median(hue), rawStd};
    }

    /**
     * 对颜色特征分类
     *
     * @return 最佳匹配标签；没有条目在置信余量内包含该特征时返回 {@link Detection#UNCLASSIFIED}
     */
    public String classify(ColorSignature sig) {
        String best = Detection.UNCLASSIFIED;
        double bestScore = Double.MAX_VALUE;
        for (Map.Entry<String, ColorRange> e : palette.entrySet()) {
            double score = matchScore(sig, e.getValue());
            // 按标签名遍历，同分时保留先出现的
            if (score < bestScore) {
                bestScore = score;
                best = e.getKey();
            }
        }
        return best;
    }

    /**
     * 采样并分类
     */
    public String classify(Mat hsv, Position point) {
        if (point == null || !point.isValid()) {
            return Detection.UNCLASSIFIED;
        }
        return classify(signature(hsv, point.getX(), point.getY()));
    }

    /**
     * 特征到范围中心的归一化距离，不匹配时为 +∞
     */
    double matchScore(ColorSignature sig, ColorRange range) {
        double hueScore = Double.POSITIVE_INFINITY;
        for (int[] band : range.getHueBands()) {
            double s = channelScore(sig.getHueMedian(), band[0], band[1]);
            hueScore = Math.min(hueScore, s);
        }
        double satScore = channelScore(sig.getSatMedian(), range.getSatMin(), range.getSatMax());
        double valScore = channelScore(sig.getValMedian(), range.getValMin(), range.getValMax());
        return hueScore + satScore + valScore;
    }

    private double channelScore(double value, int min, int max) {
        if (value < min - confidenceMargin || value > max + confidenceMargin) {
            return Double.POSITIVE_INFINITY;
        }
        double center = (min + max) / 2.0;
        double halfWidth = Math.max((max - min) / 2.0, 1.0);
        return Math.abs(value - center) / halfWidth;
    }

    /**
     * 颜色范围的二值掩码，跨零色相取两段并集
     *
     * @return 新分配的 CV_8UC1 掩码，由调用方释放
     */
    public Mat mask(Mat hsv, ColorRange range) {
        Mat result = new Mat(hsv.size(), CV_8UC1, new Scalar(0));
        for (int[] band : range.getHueBands()) {
            try (Mat lower = new Mat(hsv.size(), hsv.type(), new Scalar(band[0], range.getSatMin(), range.getValMin(), 0));
                 Mat upper = new Mat(hsv.size(), hsv.type(), new Scalar(band[1], range.getSatMax(), range.getValMax(), 0));
                 Mat bandMask = new Mat()) {
                inRange(hsv, lower, upper, bandMask);
                bitwise_or(result, bandMask, result);
            }
        }
        return result;
    }

    private static double median(double[] values) {
        return new DescriptiveStatistics(values).getPercentile(50);
    }

    private static double std(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }
}
