package com.example.anttrack.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 图像坐标点（像素）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private double x;
    private double y;

    /**
     * 空区域质心的哨兵值 (-1,-1)，使用前必须用 {@link #isValid()} 检查
     */
    public static Position none() {
        return new Position(-1, -1);
    }

    @JsonIgnore
    public boolean isValid() {
        return x >= 0 && y >= 0;
    }

    public double distanceTo(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
