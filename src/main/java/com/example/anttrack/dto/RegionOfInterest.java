package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Min;

/**
 * 矩形区域：全局感兴趣区域，或命名区域（如培养板上的一个孔）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegionOfInterest {

    @Min(0)
    private int x;

    @Min(0)
    private int y;

    @Min(1)
    private int width;

    @Min(1)
    private int height;

    public boolean contains(double px, double py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }

    public Position center() {
        return new Position(x + width / 2.0, y + height / 2.0);
    }
}
