package com.example.anttrack.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;

/**
 * 调色板中一个颜色标签的HSV范围（OpenCV 8位约定：色相 0-180，饱和度/亮度 0-255）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColorRange {

    public static final int HUE_RANGE = 180;
    public static final int CHANNEL_MAX = 255;

    @Min(0) @Max(HUE_RANGE)
    private int hueMin;

    @Min(0) @Max(HUE_RANGE)
    private int hueMax;

    @Min(0) @Max(CHANNEL_MAX)
    private int satMin;

    @Min(0) @Max(CHANNEL_MAX)
    private int satMax;

    @Min(0) @Max(CHANNEL_MAX)
    private int valMin;

    @Min(0) @Max(CHANNEL_MAX)
    private int valMax;

    /**
     * 红色等跨越0度的颜色：hueMin为0时同时匹配色相高端
     */
    @JsonIgnore
    public boolean isHueWrapping() {
        return hueMin == 0 && hueMax < HUE_RANGE;
    }

    /**
     * 色相区间列表，跨零颜色返回两段 [0,hueMax] 与 [180-hueMax,180]
     */
    @JsonIgnore
    public int[][] getHueBands() {
        if (isHueWrapping()) {
            return new int[][]{{0, hueMax}, {HUE_RANGE - hueMax, HUE_RANGE}};
        }
        return new int[][]{{hueMin, hueMax}};
    }

    /**
     * 校验取值范围，非法时抛出 IllegalArgumentException
     */
    public void validate(String tag) {
        checkBand(tag, "hue", hueMin, hueMax, HUE_RANGE);
        checkBand(tag, "sat", satMin, satMax, CHANNEL_MAX);
        checkBand(tag, "val", valMin, valMax, CHANNEL_MAX);
    }

    private static void checkBand(String tag, String channel, int min, int max, int limit) {
        if (min < 0 || max > limit || min > max) {
            throw new IllegalArgumentException(String.format(
                    "颜色标签 %s 的 %s 范围非法: [%d, %d]，允许 [0, %d]", tag, channel, min, max, limit));
        }
    }
}
