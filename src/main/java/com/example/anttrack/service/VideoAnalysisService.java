package com.example.anttrack.service;

import com.example.anttrack.dto.AnalysisRequest;
import com.example.anttrack.dto.AnalysisResult;
import com.example.anttrack.dto.FolderAnalysisRequest;
import com.example.anttrack.dto.FolderAnalysisResult;
import com.example.anttrack.dto.FrameResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

public interface VideoAnalysisService {

    /**
     * 逐帧输出跟踪记录，每个已处理帧一批
     * @param request 视频与参数
     * @return 帧结果流；视频无法读取时以错误结束
     */
    Flux<FrameResult> streamVideo(AnalysisRequest request);

    /**
     * 分析整个视频，写出CSV并返回统计与轨迹摘要
     * @param request 视频与参数
     * @return 分析结果，失败时 success=false
     */
    Mono<AnalysisResult> analyzeVideo(AnalysisRequest request);

    /**
     * 顺序分析文件夹中的视频，单个视频失败不影响其余视频
     */
    Mono<FolderAnalysisResult> analyzeFolder(FolderAnalysisRequest request);

    /**
     * 请求停止任务，当前帧处理完成后生效
     * @return 任务是否存在
     */
    boolean cancel(String jobId);

    /**
     * 运行中的任务与当前默认参数
     */
    Map<String, Object> getStatus();
}
