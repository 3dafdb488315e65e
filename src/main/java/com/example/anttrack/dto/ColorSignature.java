package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 邻域HSV颜色特征（中位数 + 标准差）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColorSignature {

    private double hueMedian;
    private double hueStd;
    private double satMedian;
    private double satStd;
    private double valMedian;
    private double valStd;
}
