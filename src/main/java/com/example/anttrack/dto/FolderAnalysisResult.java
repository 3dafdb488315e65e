package com.example.anttrack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 文件夹批量分析结果
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FolderAnalysisResult {

    private String folderPath;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    @Builder.Default
    private List<AnalysisResult> results = new ArrayList<>();

    /** 失败的视频路径 */
    @Builder.Default
    private List<String> failedVideos = new ArrayList<>();

    private boolean cancelled;
}
