package com.example.anttrack.controller;

import com.example.anttrack.dto.AnalysisRequest;
import com.example.anttrack.dto.FolderAnalysisRequest;
import com.example.anttrack.dto.FrameResult;
import com.example.anttrack.service.VideoAnalysisService;
import com.example.anttrack.util.PathConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.validation.Valid;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class VideoAnalysisController {

    private final VideoAnalysisService analysisService;
    private final PathConverter pathConverter;

    /**
     * 分析单个视频，完成后返回统计与轨迹摘要
     */
    @PostMapping("/video")
    public Mono<ResponseEntity<Map<String, Object>>> analyzeVideo(@Valid @RequestBody AnalysisRequest request) {
        return analysisService.analyzeVideo(request)
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", result.isSuccess());
                    response.put("result", result);
                    response.put("csvUrl", pathConverter.convertToWebPath(result.getCsvPath()));
                    if (result.getMotionCsvPath() != null) {
                        response.put("motionCsvUrl", pathConverter.convertToWebPath(result.getMotionCsvPath()));
                    }
                    return result.isSuccess()
                            ? ResponseEntity.ok(response)
                            : ResponseEntity.badRequest().body(response);
                })
                .onErrorResume(ex -> errorResponse("视频分析失败", ex));
    }

    /**
     * 逐帧输出跟踪记录（NDJSON）
     */
    @PostMapping(value = "/video/stream", produces = MediaType.APPLICATION_NDJSON_VALUE)
    public Flux<FrameResult> streamVideo(@Valid @RequestBody AnalysisRequest request) {
        return analysisService.streamVideo(request)
                .doOnError(ex -> log.error("逐帧分析失败: {}", ex.getMessage()));
    }

    /**
     * 顺序分析文件夹中的全部视频
     */
    @PostMapping("/folder")
    public Mono<ResponseEntity<Map<String, Object>>> analyzeFolder(@Valid @RequestBody FolderAnalysisRequest request) {
        return analysisService.analyzeFolder(request)
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", result.getFailedVideos().isEmpty());
                    response.put("result", result);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("批量分析失败", ex));
    }

    /**
     * 停止任务，当前帧处理完成并保存断点后结束
     */
    @PostMapping("/jobs/{jobId}/cancel")
    public Mono<ResponseEntity<Map<String, Object>>> cancel(@PathVariable String jobId) {
        return Mono.fromCallable(() -> {
            boolean found = analysisService.cancel(jobId);
            Map<String, Object> response = new HashMap<>();
            response.put("success", found);
            response.put("jobId", jobId);
            if (!found) {
                response.put("error", "任务不存在或已结束");
                return ResponseEntity.badRequest().body(response);
            }
            response.put("message", "已请求停止");
            return ResponseEntity.ok(response);
        });
    }

    /**
     * 获取服务状态
     */
    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> getStatus() {
        return Mono.fromCallable(() -> {
            Map<String, Object> status = new HashMap<>();
            status.put("system", "Ant Tracking Service");
            status.put("version", "1.0.0");
            status.put("status", "running");
            status.putAll(analysisService.getStatus());
            return ResponseEntity.ok(status);
        });
    }

    private Mono<ResponseEntity<Map<String, Object>>> errorResponse(String action, Throwable ex) {
        log.error("{}: {}", action, ex.getMessage(), ex);
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("error", ex.getMessage());
        return Mono.just(ResponseEntity.badRequest().body(errorResponse));
    }
}
