package com.example.anttrack.service.tracking;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.Cluster;
import com.example.anttrack.dto.Detection;
import com.example.anttrack.dto.FrameResult;
import com.example.anttrack.dto.MotionPoint;
import com.example.anttrack.dto.Track;
import com.example.anttrack.dto.TrackRecord;
import com.example.anttrack.dto.TrackState;
import com.example.anttrack.dto.TrackingCheckpoint;
import com.example.anttrack.exception.AnalysisException;
import com.example.anttrack.exception.ErrorKind;
import com.example.anttrack.service.detection.BlobSegmenter;
import com.example.anttrack.service.detection.ColorClassifier;
import com.example.anttrack.service.detection.FrameClusterer;
import com.example.anttrack.service.detection.MotionDetector;
import com.example.anttrack.service.source.VideoFrame;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Collections;
import java.util.List;

/**
 * 单个视频的逐帧处理链：分割 -> 帧内聚类 -> 跟踪，开启时另做帧间运动检测。
 * <p>
 * {@link #process(VideoFrame)} 不抛异常：空帧跳过，内部错误降级为本帧不更新，跟踪器状态保持一致。
 */
@Slf4j
public class TrackingPipeline implements AutoCloseable {

    private final String videoPath;
    private final BlobSegmenter segmenter;
    private final FrameClusterer clusterer;
    private final MotionDetector motionDetector;
    @Getter
    private final AntTracker tracker;

    @Getter
    private long lastProcessedFrame = -1;
    @Getter
    private int processedFrames = 0;
    @Getter
    private int skippedFrames = 0;
    @Getter
    private long totalDetections = 0;
    @Getter
    private int maxConcurrentTracks = 0;
    @Getter
    private long totalMotionPoints = 0;

    /**
     * @param background 前景分割模式的背景模型，颜色模式传 null
     */
    public TrackingPipeline(String videoPath, TrackerConfig config, Mat background) {
        config.validate();
        this.videoPath = videoPath;
        this.segmenter = new BlobSegmenter(config, new ColorClassifier(config), background);
        this.clusterer = new FrameClusterer(config);
        this.tracker = new AntTracker(config);
        this.motionDetector = config.isMotionEnabled() ? new MotionDetector(config) : null;
    }

    /**
     * 处理一帧，返回该帧的输出批次
     */
    public FrameResult process(VideoFrame frame) {
        long index = frame.getIndex();
        try {
            if (frame.isEmpty()) {
                throw new AnalysisException(ErrorKind.EMPTY_FRAME, "空帧");
            }

            List<Detection> detections = segmenter.segment(frame.getImage());
            if (detections.isEmpty()) {
                log.debug("[{}] 帧 {}", ErrorKind.NO_DETECTIONS, index);
            }
            List<MotionPoint> motion = motionDetector == null
                    ? Collections.emptyList()
                    : motionDetector.detect(frame.getImage());
            List<Cluster> clusters = clusterer.cluster(detections, tracker.liveTagCounts());
            List<TrackRecord> records = tracker.update(index, FrameClusterer.candidates(clusters));

            processedFrames++;
            totalDetections += detections.size();
            totalMotionPoints += motion.size();
            maxConcurrentTracks = Math.max(maxConcurrentTracks, tracker.getLiveCount());

            return FrameResult.builder()
                    .frameIndex(index)
                    .timestampMs(frame.getTimestampMs())
                    .detectionCount(detections.size())
                    .records(records)
                    .motionPoints(motion)
                    .build();
        } catch (AnalysisException e) {
            skippedFrames++;
            log.warn("[{}] {} 第 {} 帧跳过: {}", e.getKind(), videoPath, index, e.getMessage());
            return FrameResult.skipped(index, frame.getTimestampMs(), e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            skippedFrames++;
            log.warn("[{}] {} 第 {} 帧处理异常，本帧不更新", ErrorKind.INTERNAL, videoPath, index, e);
            return FrameResult.skipped(index, frame.getTimestampMs(), ErrorKind.INTERNAL, e.getMessage());
        } finally {
            lastProcessedFrame = Math.max(lastProcessedFrame, index);
        }
    }

    /**
     * 当前完整工作状态，只应在帧与帧之间调用
     */
    public TrackingCheckpoint checkpoint() {
        TrackingCheckpoint checkpoint = tracker.exportState();
        checkpoint.setVideoPath(videoPath);
        checkpoint.setLastProcessedFrame(lastProcessedFrame);
        checkpoint.setSavedAtMs(System.currentTimeMillis());
        return checkpoint;
    }

    /**
     * 从断点恢复，之后应从 lastProcessedFrame + 1 继续
     */
    public void restore(TrackingCheckpoint checkpoint) {
        tracker.restore(checkpoint);
        lastProcessedFrame = checkpoint.getLastProcessedFrame();
        log.info("{} 从第 {} 帧之后恢复，存活轨迹 {} 条", videoPath, lastProcessedFrame,
                checkpoint.getLiveTracks().size());
    }

    public List<Track> getAllTracks() {
        return tracker.getAllTracks();
    }

    public int countTracks(TrackState state) {
        return (int) tracker.getRetiredTracks().stream().filter(t -> t.getState() == state).count();
    }

    public int countSplits() {
        return (int) tracker.getAllTracks().stream().filter(t -> t.getParentId() != null).count();
    }

    @Override
    public void close() {
        if (motionDetector != null) {
            motionDetector.close();
        }
    }
}
