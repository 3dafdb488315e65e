package com.example.anttrack.config;

import com.example.anttrack.dto.ClusterLinkage;
import com.example.anttrack.dto.ColorRange;
import com.example.anttrack.dto.SegmentationMode;
import org.junit.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class TrackingPropertiesTest {

    private static TrackingProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bind("anttrack.tracking", TrackingProperties.class)
                .orElseGet(TrackingProperties::new);
    }

    private static Map<String, String> redPalette() {
        Map<String, String> values = new HashMap<>();
        values.put("anttrack.tracking.color-palette.red.hue-min", "0");
        values.put("anttrack.tracking.color-palette.red.hue-max", "10");
        values.put("anttrack.tracking.color-palette.red.sat-min", "100");
        values.put("anttrack.tracking.color-palette.red.sat-max", "255");
        values.put("anttrack.tracking.color-palette.red.val-min", "80");
        values.put("anttrack.tracking.color-palette.red.val-max", "255");
        return values;
    }

    @Test
    public void testBindAndConvert() {
        Map<String, String> values = redPalette();
        values.put("anttrack.tracking.track-max-gate-distance", "25.5");
        values.put("anttrack.tracking.cluster-linkage", "average");
        values.put("anttrack.tracking.roi.x", "10");
        values.put("anttrack.tracking.roi.y", "20");
        values.put("anttrack.tracking.roi.width", "300");
        values.put("anttrack.tracking.roi.height", "200");

        TrackerConfig config = bind(values).toConfig();

        assertEquals(25.5, config.getTrackMaxGateDistance(), 0.0);
        assertEquals(ClusterLinkage.AVERAGE, config.getClusterLinkage());
        assertEquals(300, config.getRoi().getWidth());
        ColorRange red = config.getColorPalette().get("red");
        assertTrue("hueMin 为 0 的红色应跨零", red.isHueWrapping());
        assertEquals("未配置的参数使用默认值", 10, config.getTrackMaxMissFrames());
        assertEquals(SegmentationMode.COLOR_TAG, config.getSegmentationMode());
    }

    @Test
    public void testBindRegionsAndMotion() {
        Map<String, String> values = redPalette();
        values.put("anttrack.tracking.regions.well-0-0.x", "0");
        values.put("anttrack.tracking.regions.well-0-0.y", "0");
        values.put("anttrack.tracking.regions.well-0-0.width", "320");
        values.put("anttrack.tracking.regions.well-0-0.height", "240");
        values.put("anttrack.tracking.regions.well-0-1.x", "320");
        values.put("anttrack.tracking.regions.well-0-1.y", "0");
        values.put("anttrack.tracking.regions.well-0-1.width", "320");
        values.put("anttrack.tracking.regions.well-0-1.height", "240");
        values.put("anttrack.tracking.motion-threshold", "25");

        TrackerConfig config = bind(values).toConfig();

        assertEquals(2, config.getRegions().size());
        assertEquals(320, config.getRegions().get("well-0-1").getX());
        assertTrue(config.isMotionEnabled());
        assertEquals(25, config.getMotionThreshold());
        assertFalse("默认关闭运动检测", bind(redPalette()).toConfig().isMotionEnabled());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMotionPixelBoundsOrder() {
        TrackingProperties properties = bind(redPalette());
        properties.setMotionMinPixels(500);
        properties.setMotionMaxPixels(100);

        properties.toConfig();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testColorModeNeedsPalette() {
        new TrackingProperties().toConfig();
    }

    @Test
    public void testForegroundModeWithoutPalette() {
        TrackingProperties properties = new TrackingProperties();
        properties.setSegmentationMode(SegmentationMode.FOREGROUND);

        assertTrue(properties.toConfig().getColorPalette().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidHueRange() {
        Map<String, String> values = redPalette();
        values.put("anttrack.tracking.color-palette.red.hue-max", "200");

        bind(values).toConfig();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlobAreaOrder() {
        Map<String, String> values = redPalette();
        values.put("anttrack.tracking.min-blob-area", "500");
        values.put("anttrack.tracking.max-blob-area", "100");

        bind(values).toConfig();
    }

    @Test
    public void testPaletteIsImmutable() {
        TrackerConfig config = bind(redPalette()).toConfig();

        try {
            config.getColorPalette().put("blue", new ColorRange());
            fail("调色板不应可修改");
        } catch (UnsupportedOperationException e) {
            assertEquals(1, config.getColorPalette().size());
        }
    }
}
