package com.example.anttrack.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 轴对齐边界框
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox {

    /** 左上角X坐标 */
    private int x;

    /** 左上角Y坐标 */
    private int y;

    private int width;

    private int height;

    @JsonIgnore
    public int getRight() {
        return x + width;
    }

    @JsonIgnore
    public int getBottom() {
        return y + height;
    }

    /**
     * 长宽比（长边/短边）
     */
    @JsonIgnore
    public double getElongation() {
        int shortSide = Math.min(width, height);
        if (shortSide <= 0) {
            return 0.0;
        }
        return (double) Math.max(width, height) / shortSide;
    }

    /**
     * 合并两个边界框
     */
    public BoundingBox union(BoundingBox other) {
        if (other == null) return new BoundingBox(x, y, width, height);

        int x1 = Math.min(x, other.x);
        int y1 = Math.min(y, other.y);
        int x2 = Math.max(getRight(), other.getRight());
        int y2 = Math.max(getBottom(), other.getBottom());
        return new BoundingBox(x1, y1, x2 - x1, y2 - y1);
    }
}
