package com.example.anttrack.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import javax.validation.constraints.NotBlank;

/**
 * 文件夹批量分析请求，按文件名顺序逐个分析视频
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class FolderAnalysisRequest extends AnalysisOptions {

    /** 视频文件夹 */
    @NotBlank(message = "文件夹路径不能为空")
    private String folderPath;

    /** 是否递归子文件夹 */
    private Boolean recursive = false;
}
