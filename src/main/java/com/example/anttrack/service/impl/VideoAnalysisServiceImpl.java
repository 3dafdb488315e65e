package com.example.anttrack.service.impl;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.AnalysisOptions;
import com.example.anttrack.dto.AnalysisRequest;
import com.example.anttrack.dto.AnalysisResult;
import com.example.anttrack.dto.FolderAnalysisRequest;
import com.example.anttrack.dto.FolderAnalysisResult;
import com.example.anttrack.dto.FrameResult;
import com.example.anttrack.dto.SegmentationMode;
import com.example.anttrack.dto.Track;
import com.example.anttrack.dto.TrackState;
import com.example.anttrack.dto.TrackSummary;
import com.example.anttrack.dto.TrackingCheckpoint;
import com.example.anttrack.exception.AnalysisException;
import com.example.anttrack.exception.ErrorKind;
import com.example.anttrack.service.CheckpointService;
import com.example.anttrack.service.MotionCsvWriter;
import com.example.anttrack.service.TrackCsvWriter;
import com.example.anttrack.service.VideoAnalysisService;
import com.example.anttrack.service.detection.BackgroundModelBuilder;
import com.example.anttrack.service.source.FrameSource;
import com.example.anttrack.service.source.FrameSourceFactory;
import com.example.anttrack.service.source.VideoFrame;
import com.example.anttrack.service.tracking.TrackingPipeline;
import com.example.anttrack.util.FFmpegUtil;
import com.example.anttrack.util.PathConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class VideoAnalysisServiceImpl implements VideoAnalysisService {

    private final TrackerConfig trackerConfig;
    private final FrameSourceFactory frameSourceFactory;
    private final CheckpointService checkpointService;
    private final PathConverter pathConverter;

    /** 任务ID -> 停止标志 */
    private final Map<String, AtomicBoolean> runningJobs = new ConcurrentHashMap<>();

    @Override
    public Flux<FrameResult> streamVideo(AnalysisRequest request) {
        String jobId = resolveJobId(request);
        return Flux.defer(() -> {
                    AtomicBoolean stopFlag = registerJob(jobId);
                    return Flux.using(
                                    () -> openSession(request, request.getVideoSource(),
                                            pathConverter.outputName(request.getVideoSource()), request.getOutputPath(),
                                            jobId, stopFlag),
                                    this::frames,
                                    AnalysisSession::close)
                            .doFinally(signal -> runningJobs.remove(jobId));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<AnalysisResult> analyzeVideo(AnalysisRequest request) {
        String jobId = resolveJobId(request);
        return Mono.defer(() -> {
                    AtomicBoolean stopFlag = registerJob(jobId);
                    return analyze(request, request.getVideoSource(), pathConverter.outputName(request.getVideoSource()),
                            request.getOutputPath(), jobId, stopFlag)
                            .doFinally(signal -> runningJobs.remove(jobId));
                })
                .onErrorResume(e -> Mono.just(failure(request.getVideoSource(), jobId, LocalDateTime.now(), e)));
    }

    @Override
    public Mono<FolderAnalysisResult> analyzeFolder(FolderAnalysisRequest request) {
        String jobId = resolveJobId(request);
        LocalDateTime startTime = LocalDateTime.now();

        Path folder = Paths.get(request.getFolderPath());

        return Mono.fromCallable(() -> pathConverter.outputNames(folder,
                        pathConverter.listVideos(folder, Boolean.TRUE.equals(request.getRecursive()))))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(videos -> {
                    log.info("开始批量分析: {}，共 {} 个视频，任务 {}", request.getFolderPath(), videos.size(), jobId);
                    AtomicBoolean stopFlag = registerJob(jobId);
                    return Flux.fromIterable(videos.entrySet())
                            .takeWhile(video -> !stopFlag.get())
                            .concatMap(video -> analyze(request, video.getKey().toString(), video.getValue(), null,
                                    jobId, stopFlag))
                            .collectList()
                            .map(results -> FolderAnalysisResult.builder()
                                    .folderPath(request.getFolderPath())
                                    .startTime(startTime)
                                    .endTime(LocalDateTime.now())
                                    .results(results)
                                    .failedVideos(results.stream()
                                            .filter(r -> !r.isSuccess())
                                            .map(AnalysisResult::getVideoPath)
                                            .collect(Collectors.toList()))
                                    .cancelled(stopFlag.get())
                                    .build())
                            .doFinally(signal -> runningJobs.remove(jobId));
                })
                .doOnNext(result -> log.info("批量分析结束: {}，成功 {}，失败 {}", request.getFolderPath(),
                        result.getResults().size() - result.getFailedVideos().size(), result.getFailedVideos().size()));
    }

    @Override
    public boolean cancel(String jobId) {
        AtomicBoolean flag = runningJobs.get(jobId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        log.info("任务 {} 收到停止请求", jobId);
        return true;
    }

    @Override
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("runningJobs", new ArrayList<>(runningJobs.keySet()));
        status.put("segmentationMode", trackerConfig.getSegmentationMode());
        status.put("colorTags", new ArrayList<>(trackerConfig.getColorPalette().keySet()));
        status.put("trackMaxGateDistance", trackerConfig.getTrackMaxGateDistance());
        status.put("trackMaxMissFrames", trackerConfig.getTrackMaxMissFrames());
        return status;
    }

    /**
     * 单个视频的完整分析；所有错误都转换为失败结果，批处理可以继续
     */
    private Mono<AnalysisResult> analyze(AnalysisOptions options, String videoPath, String outputName,
                                         String csvOverride, String jobId, AtomicBoolean stopFlag) {
        LocalDateTime startTime = LocalDateTime.now();
        return Mono.using(
                        () -> openSession(options, videoPath, outputName, csvOverride, jobId, stopFlag),
                        session -> frames(session).then(Mono.fromCallable(() -> session.toResult(startTime))),
                        AnalysisSession::close)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(result -> log.info("视频分析完成: {}，处理 {} 帧，轨迹 {} 条，耗时 {} ms{}", videoPath,
                        result.getStats().getProcessedFrames(), result.getStats().getTotalTracks(),
                        result.getProcessingTimeMs(), result.isCancelled() ? "（已停止）" : ""))
                .onErrorResume(e -> Mono.just(failure(videoPath, jobId, startTime, e)));
    }

    /**
     * 解码在独立线程上进行，经容量为 frameQueueCapacity 的队列交给计算线程；每帧开始前检查停止标志
     */
    private Flux<FrameResult> frames(AnalysisSession session) {
        return Flux.<VideoFrame>generate(sink -> {
                    VideoFrame frame = session.nextFrame();
                    if (frame == null) {
                        sink.complete();
                    } else {
                        sink.next(frame);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .publishOn(Schedulers.boundedElastic(), session.config.getFrameQueueCapacity())
                .<FrameResult>handle((frame, sink) -> {
                    try (VideoFrame f = frame) {
                        if (session.stopFlag.get()) {
                            session.markCancelled();
                            sink.complete();
                            return;
                        }
                        sink.next(session.process(f));
                    }
                })
                .doOnDiscard(VideoFrame.class, VideoFrame::close)
                .concatWith(Mono.<FrameResult>fromRunnable(session::finish));
    }

    private AnalysisSession openSession(AnalysisOptions options, String videoPath, String outputName,
                                        String csvOverride, String jobId, AtomicBoolean stopFlag) throws IOException {
        TrackerConfig config = resolveConfig(options);
        Path checkpointPath = pathConverter.checkpointPath(outputName);
        Path csvPath = pathConverter.csvPath(outputName, csvOverride);
        Path motionCsvPath = config.isMotionEnabled() ? pathConverter.motionCsvPath(outputName) : null;

        Optional<TrackingCheckpoint> checkpoint = Optional.empty();
        if (Boolean.TRUE.equals(options.getResume())) {
            checkpoint = checkpointService.load(checkpointPath).filter(c -> belongsTo(c, videoPath, checkpointPath));
            if (checkpoint.isEmpty()) {
                log.warn("未找到断点 {}，从头开始分析", checkpointPath);
            }
        }

        Mat background = null;
        if (config.getSegmentationMode() == SegmentationMode.FOREGROUND) {
            background = new BackgroundModelBuilder(config.getBackgroundSampleFrames())
                    .loadOrBuild(pathConverter.backgroundPath(outputName), () -> frameSourceFactory.open(videoPath));
        }

        log.info("开始分析视频: {}，任务 {}，模式 {}", videoPath, jobId, config.getSegmentationMode());
        FrameSource source = frameSourceFactory.open(videoPath);
        TrackingPipeline pipeline = null;
        TrackCsvWriter csv = null;
        try {
            pipeline = new TrackingPipeline(videoPath, config, background);
            long resumedFrom = -1;
            if (checkpoint.isPresent()) {
                pipeline.restore(checkpoint.get());
                resumedFrom = checkpoint.get().getLastProcessedFrame();
                source.skipTo(resumedFrom + 1);
            }
            csv = new TrackCsvWriter(csvPath, checkpoint.isPresent());
            MotionCsvWriter motionCsv = motionCsvPath == null
                    ? null
                    : new MotionCsvWriter(motionCsvPath, checkpoint.isPresent());
            return new AnalysisSession(jobId, videoPath, config, stopFlag, source, pipeline, csv, motionCsv,
                    csvPath, motionCsvPath, checkpointPath, resumedFrom);
        } catch (IOException | RuntimeException e) {
            if (csv != null) {
                csv.close();
            }
            if (pipeline != null) {
                pipeline.close();
            }
            source.close();
            throw e;
        }
    }

    /**
     * 断点记录的视频与当前视频不一致时不能续跑
     */
    private static boolean belongsTo(TrackingCheckpoint checkpoint, String videoPath, Path checkpointPath) {
        if (checkpoint.getVideoPath() == null
                || Paths.get(checkpoint.getVideoPath()).toAbsolutePath().normalize()
                .equals(Paths.get(videoPath).toAbsolutePath().normalize())) {
            return true;
        }
        log.warn("断点 {} 属于视频 {}，与 {} 不符，忽略", checkpointPath, checkpoint.getVideoPath(), videoPath);
        return false;
    }

    /**
     * 请求中非空的参数覆盖默认配置
     */
    TrackerConfig resolveConfig(AnalysisOptions o) {
        TrackerConfig.TrackerConfigBuilder b = trackerConfig.toBuilder();
        if (o.getSegmentationMode() != null) b.segmentationMode(o.getSegmentationMode());
        if (o.getColorPalette() != null && !o.getColorPalette().isEmpty()) {
            b.clearColorPalette().colorPalette(o.getColorPalette());
        }
        if (o.getMinBlobArea() != null) b.minBlobArea(o.getMinBlobArea());
        if (o.getMaxBlobArea() != null) b.maxBlobArea(o.getMaxBlobArea());
        if (o.getClusterDistanceThreshold() != null) b.clusterDistanceThreshold(o.getClusterDistanceThreshold());
        if (o.getTrackMaxGateDistance() != null) b.trackMaxGateDistance(o.getTrackMaxGateDistance());
        if (o.getTrackMaxMissFrames() != null) b.trackMaxMissFrames(o.getTrackMaxMissFrames());
        if (o.getMorphDilationIters() != null) b.morphDilationIters(o.getMorphDilationIters());
        if (o.getMorphErosionIters() != null) b.morphErosionIters(o.getMorphErosionIters());
        if (o.getSingleAntArea() != null) b.singleAntArea(o.getSingleAntArea());
        if (o.getMaxSubjects() != null) b.maxSubjects(o.getMaxSubjects());
        if (o.getRoi() != null) b.roi(o.getRoi());
        if (o.getRegions() != null && !o.getRegions().isEmpty()) {
            b.clearRegions().regions(o.getRegions());
        }
        if (o.getMotionThreshold() != null) b.motionThreshold(o.getMotionThreshold());
        return b.build().validate();
    }

    private AtomicBoolean registerJob(String jobId) {
        AtomicBoolean flag = new AtomicBoolean(false);
        if (runningJobs.putIfAbsent(jobId, flag) != null) {
            throw new IllegalStateException("任务已在运行: " + jobId);
        }
        return flag;
    }

    private static String resolveJobId(AnalysisOptions options) {
        String jobId = options.getJobId();
        return jobId == null || jobId.isEmpty() ? UUID.randomUUID().toString() : jobId;
    }

    private AnalysisResult failure(String videoPath, String jobId, LocalDateTime startTime, Throwable e) {
        ErrorKind kind = e instanceof AnalysisException ? ((AnalysisException) e).getKind() : ErrorKind.INTERNAL;
        log.error("[{}] 视频分析失败: {} - {}", kind, videoPath, e.getMessage(), e);
        LocalDateTime endTime = LocalDateTime.now();
        return AnalysisResult.builder()
                .success(false)
                .jobId(jobId)
                .error(kind.name())
                .message("视频分析失败: " + e.getMessage())
                .videoPath(videoPath)
                .startTime(startTime)
                .endTime(endTime)
                .processingTimeMs(Duration.between(startTime, endTime).toMillis())
                .build();
    }

    /**
     * 一个视频的运行状态。帧源读取与帧处理分别加锁，关闭时两者都要获取。
     */
    private final class AnalysisSession {

        private final String jobId;
        private final String videoPath;
        private final TrackerConfig config;
        private final AtomicBoolean stopFlag;
        private final FrameSource source;
        private final TrackingPipeline pipeline;
        private final TrackCsvWriter csv;
        private final MotionCsvWriter motionCsv;
        private final Path csvPath;
        private final Path motionCsvPath;
        private final Path checkpointPath;
        private final long resumedFrom;

        private final Object sourceLock = new Object();
        private int framesSinceCheckpoint = 0;
        private boolean cancelled = false;
        private boolean finished = false;
        private boolean closed = false;

        private AnalysisSession(String jobId, String videoPath, TrackerConfig config, AtomicBoolean stopFlag,
                                FrameSource source, TrackingPipeline pipeline, TrackCsvWriter csv,
                                MotionCsvWriter motionCsv, Path csvPath, Path motionCsvPath, Path checkpointPath,
                                long resumedFrom) {
            this.jobId = jobId;
            this.videoPath = videoPath;
            this.config = config;
            this.stopFlag = stopFlag;
            this.source = source;
            this.pipeline = pipeline;
            this.csv = csv;
            this.motionCsv = motionCsv;
            this.csvPath = csvPath;
            this.motionCsvPath = motionCsvPath;
            this.checkpointPath = checkpointPath;
            this.resumedFrom = resumedFrom;
        }

        VideoFrame nextFrame() {
            synchronized (sourceLock) {
                return closed ? null : source.next();
            }
        }

        synchronized FrameResult process(VideoFrame frame) {
            FrameResult result = pipeline.process(frame);
            try {
                csv.write(result.getRecords());
                if (motionCsv != null) {
                    motionCsv.write(result.getFrameIndex(), result.getMotionPoints());
                }
                if (++framesSinceCheckpoint >= config.getCheckpointInterval()) {
                    saveCheckpoint();
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return result;
        }

        synchronized void markCancelled() {
            cancelled = true;
        }

        synchronized void finish() {
            try {
                saveCheckpoint();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            finished = true;
        }

        /**
         * 先把已处理帧的输出落盘，再写断点：断点声明完成的帧在磁盘上都有对应记录
         */
        private void saveCheckpoint() throws IOException {
            csv.flush();
            if (motionCsv != null) {
                motionCsv.flush();
            }
            checkpointService.save(checkpointPath, pipeline.checkpoint());
            framesSinceCheckpoint = 0;
        }

        synchronized AnalysisResult toResult(LocalDateTime startTime) {
            LocalDateTime endTime = LocalDateTime.now();
            List<Track> tracks = pipeline.getAllTracks();
            AnalysisResult.AnalysisStats stats = AnalysisResult.AnalysisStats.builder()
                    .processedFrames(pipeline.getProcessedFrames())
                    .skippedFrames(pipeline.getSkippedFrames())
                    .totalDetections(pipeline.getTotalDetections())
                    .totalMotionPoints(pipeline.getTotalMotionPoints())
                    .totalTracks(tracks.size())
                    .maxConcurrentTracks(pipeline.getMaxConcurrentTracks())
                    .mergeCount(pipeline.countTracks(TrackState.MERGED))
                    .splitCount(pipeline.countSplits())
                    .terminatedCount(pipeline.countTracks(TrackState.TERMINATED))
                    .resumedFromFrame(resumedFrom)
                    .build();

            return AnalysisResult.builder()
                    .success(true)
                    .cancelled(cancelled)
                    .jobId(jobId)
                    .message(cancelled ? "分析已停止，可从断点续跑" : "视频分析完成")
                    .videoPath(videoPath)
                    .csvPath(csvPath.toString())
                    .motionCsvPath(motionCsvPath == null ? null : motionCsvPath.toString())
                    .checkpointPath(checkpointPath.toString())
                    .startTime(startTime)
                    .endTime(endTime)
                    .processingTimeMs(Duration.between(startTime, endTime).toMillis())
                    .stats(stats)
                    .tracks(tracks.stream().map(TrackSummary::of).collect(Collectors.toList()))
                    .videoMetadata(Files.isRegularFile(Paths.get(videoPath)) ? FFmpegUtil.getVideoInfo(videoPath) : null)
                    .build();
        }

        void close() {
            synchronized (sourceLock) {
                synchronized (this) {
                    if (closed) {
                        return;
                    }
                    closed = true;
                    if (!finished) {
                        try {
                            saveCheckpoint();
                        } catch (IOException | RuntimeException e) {
                            log.warn("{} 关闭时保存断点失败: {}", videoPath, e.getMessage());
                        }
                    }
                    try {
                        csv.close();
                        if (motionCsv != null) {
                            motionCsv.close();
                        }
                    } catch (IOException e) {
                        log.warn("{} 关闭CSV失败: {}", csvPath, e.getMessage());
                    }
                    pipeline.close();
                    source.close();
                }
            }
        }
    }
}
