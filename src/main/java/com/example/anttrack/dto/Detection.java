package com.example.anttrack.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单帧内分割出的一个候选蚂蚁区域
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Detection {

    public static final String UNCLASSIFIED = "unclassified";

    /** 外轮廓（有序像素坐标） */
    private List<Position> contour;

    private Position centroid;

    /** 面积（像素数） */
    private double area;

    private BoundingBox boundingBox;

    /** 主轴方向（度，-90 ~ 90） */
    private double orientation;

    private ColorSignature colorSignature;

    /** 颜色标签，未识别时为 {@link #UNCLASSIFIED} */
    private String colorTag;

    /** 骨架中线，仅对细长区域计算 */
    private List<Position> skeleton;

    /** 最深的凸包凹陷点，两只蚂蚁接触时位于两者之间；没有足够深的凹陷时为 null */
    private Position waist;

    /** 上述凹陷的深度（像素），无凹陷为 0 */
    private double waistDepth;

    /** 质心所在的命名区域，未配置区域时为 null */
    private String region;

    /** 合成检测所包含的原始检测数量 */
    @Builder.Default
    private int memberCount = 1;

    @JsonIgnore
    public boolean isClassified() {
        return colorTag != null && !UNCLASSIFIED.equals(colorTag);
    }
}
