package com.example.anttrack.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import javax.validation.constraints.NotBlank;

/**
 * 单个视频分析请求DTO
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class AnalysisRequest extends AnalysisOptions {

    /** 视频源路径 */
    @NotBlank(message = "视频源路径不能为空")
    private String videoSource;

    /** CSV输出路径，为空时写到视频旁 */
    private String outputPath;
}
