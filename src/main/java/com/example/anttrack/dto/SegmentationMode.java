package com.example.anttrack.dto;

public enum SegmentationMode {
    /** 按调色板颜色标签阈值分割 */
    COLOR_TAG,
    /** 按背景模型做前景分割 */
    FOREGROUND
}
