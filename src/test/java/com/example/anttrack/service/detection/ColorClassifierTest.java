package com.example.anttrack.service.detection;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.ColorRange;
import com.example.anttrack.dto.ColorSignature;
import com.example.anttrack.dto.Detection;
import com.example.anttrack.dto.Position;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.Test;

import static com.example.anttrack.support.SyntheticFrames.redBlueConfig;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_core.countNonZero;
import static org.bytedeco.opencv.global.opencv_imgproc.FILLED;
import static org.bytedeco.opencv.global.opencv_imgproc.LINE_8;
import static org.bytedeco.opencv.global.opencv_imgproc.rectangle;
import static org.junit.Assert.*;

public class ColorClassifierTest {

    private final ColorClassifier classifier = new ColorClassifier(redBlueConfig().build());

    private static Mat hsv(int h, int s, int v) {
        return new Mat(9, 9, CV_8UC3, new Scalar(h, s, v, 0));
    }

    private String classifyUniform(int h, int s, int v) {
        try (Mat img = hsv(h, s, v)) {
            return classifier.classify(img, new Position(4, 4));
        }
    }

    @Test
    public void testClassifyPaletteColors() {
        assertEquals("red", classifyUniform(5, 200, 200));
        assertEquals("blue", classifyUniform(115, 200, 200));
        assertEquals("绿色不在调色板中", Detection.UNCLASSIFIED, classifyUniform(60, 200, 200));
    }

    @Test
    public void testRedWrapsAroundZero() {
        assertEquals("色相175应归为跨零的红色", "red", classifyUniform(175, 200, 200));
    }

    @Test
    public void testConfidenceMarginExtendsRange() {
        assertEquals("色相12在红色上限10的余量5以内", "red", classifyUniform(12, 200, 200));
        assertEquals("色相16超出余量", Detection.UNCLASSIFIED, classifyUniform(16, 200, 200));
    }

    @Test
    public void testLowSaturationIsUnclassified() {
        assertEquals("灰色不应被识别", Detection.UNCLASSIFIED, classifyUniform(5, 20, 200));
    }

    @Test
    public void testInvalidPointIsUnclassified() {
        try (Mat img = hsv(5, 200, 200)) {
            assertEquals(Detection.UNCLASSIFIED, classifier.classify(img, Position.none()));
        }
    }

    @Test
    public void testTieGoesToFirstTagByName() {
        ColorRange range = ColorRange.builder().hueMin(20).hueMax(40)
                .satMin(50).satMax(255).valMin(50).valMax(255).build();
        ColorClassifier twin = new ColorClassifier(TrackerConfig.builder()
                .color("yellow", range).color("amber", range).build());

        try (Mat img = hsv(30, 200, 200)) {
            assertEquals("同分时取标签名较小者", "amber", twin.classify(img, new Position(4, 4)));
        }
    }

    @Test
    public void testSignatureClampsAtBorder() {
        try (Mat img = hsv(115, 180, 90)) {
            ColorSignature sig = classifier.signature(img, 0, 0);

            assertEquals(115, sig.getHueMedian(), 1e-9);
            assertEquals(180, sig.getSatMedian(), 1e-9);
            assertEquals(90, sig.getValMedian(), 1e-9);
            assertEquals("均匀图像标准差为0", 0.0, sig.getHueStd(), 1e-9);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSignatureOutsideImage() {
        try (Mat img = hsv(5, 200, 200)) {
            classifier.signature(img, 100, 100);
        }
    }

    @Test
    public void testCircularHueStatsAcrossZero() {
        double[] stats = ColorClassifier.circularHueStats(new double[]{178, 179, 1, 2});

        assertEquals("跨零色相的中位数应接近0", 0.0, stats[0], 1e-9);
        assertTrue("跨零色相的标准差应很小: " + stats[1], stats[1] < 2.0);
    }

    @Test
    public void testCircularHueStatsPlainRange() {
        double[] stats = ColorClassifier.circularHueStats(new double[]{100, 110, 120});

        assertEquals(110, stats[0], 1e-9);
    }

    @Test
    public void testMaskCoversBothRedBands() {
        try (Mat img = new Mat(10, 20, CV_8UC3, new Scalar(5, 200, 200, 0))) {
            rectangle(img, new Rect(10, 0, 10, 10), new Scalar(175, 200, 200, 0), FILLED, LINE_8, 0);

            try (Mat red = classifier.mask(img, classifier.getPalette().get("red"));
                 Mat blue = classifier.mask(img, classifier.getPalette().get("blue"))) {
                assertEquals("两段红色色相都应进入掩码", 200, countNonZero(red));
                assertEquals(0, countNonZero(blue));
            }
        }
    }
}
