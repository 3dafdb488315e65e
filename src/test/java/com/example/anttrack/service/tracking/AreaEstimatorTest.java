package com.example.anttrack.service.tracking;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class AreaEstimatorTest {

    @Test
    public void testConfiguredAreaWins() {
        AreaEstimator estimator = new AreaEstimator(250);
        estimator.addSample(1000);

        assertEquals(250, estimator.typicalArea(), 0.0);
    }

    @Test
    public void testMedianOfSamples() {
        AreaEstimator estimator = new AreaEstimator(0);
        assertEquals("无样本时应返回0", 0.0, estimator.typicalArea(), 0.0);

        estimator.addSample(100);
        estimator.addSample(300);
        estimator.addSample(200);
        estimator.addSample(0);

        assertEquals(200, estimator.typicalArea(), 1e-9);
        assertEquals("非正面积不计入样本", 3, estimator.getSamples().size());
    }

    @Test
    public void testWindowKeepsMostRecent() {
        AreaEstimator estimator = new AreaEstimator(0);
        for (int i = 0; i < AreaEstimator.WINDOW; i++) {
            estimator.addSample(100);
        }
        for (int i = 0; i < AreaEstimator.WINDOW; i++) {
            estimator.addSample(400);
        }

        assertEquals("旧样本应被滑出窗口", 400, estimator.typicalArea(), 1e-9);
        assertEquals(AreaEstimator.WINDOW, estimator.getSamples().size());
    }

    @Test
    public void testRestoreReplacesSamples() {
        AreaEstimator estimator = new AreaEstimator(0);
        estimator.addSample(999);

        estimator.restore(Arrays.asList(10.0, 20.0, 30.0));

        assertEquals(Arrays.asList(10.0, 20.0, 30.0), estimator.getSamples());
        assertEquals(20, estimator.typicalArea(), 1e-9);
    }
}
