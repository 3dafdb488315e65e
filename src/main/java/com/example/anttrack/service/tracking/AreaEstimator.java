package com.example.anttrack.service.tracking;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * 单只蚂蚁典型面积：配置值优先，否则取最近单体匹配面积的滑动中位数
 */
public class AreaEstimator {

    static final int WINDOW = 200;

    private final double configuredArea;
    private final DescriptiveStatistics samples = new DescriptiveStatistics(WINDOW);

    public AreaEstimator(double configuredArea) {
        this.configuredArea = configuredArea;
    }

    /**
     * @return 典型面积，尚无估计时返回 0
     */
    public double typicalArea() {
        if (configuredArea > 0) {
            return configuredArea;
        }
        if (samples.getN() == 0) {
            return 0.0;
        }
        return samples.getPercentile(50);
    }

    public void addSample(double area) {
        if (area > 0) {
            samples.addValue(area);
        }
    }

    public List<Double> getSamples() {
        List<Double> values = new ArrayList<>();
        for (double v : samples.getValues()) {
            values.add(v);
        }
        return values;
    }

    public void restore(List<Double> values) {
        samples.clear();
        if (values != null) {
            values.forEach(this::addSample);
        }
    }
}
