package com.example.anttrack.service.source;

import com.example.anttrack.config.TrackerConfig;
import com.example.anttrack.dto.Detection;
import com.example.anttrack.exception.AnalysisException;
import com.example.anttrack.exception.ErrorKind;
import com.example.anttrack.service.detection.BlobSegmenter;
import com.example.anttrack.service.detection.ColorClassifier;
import com.example.anttrack.support.TestVideos;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.example.anttrack.support.SyntheticFrames.RED;
import static com.example.anttrack.support.SyntheticFrames.circleFrame;
import static com.example.anttrack.support.SyntheticFrames.redBlueConfig;
import static org.junit.Assert.*;

public class FFmpegFrameSourceTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    /**
     * 红色圆点每帧向右移动 5 像素
     */
    private Path movingAnt(int frames) throws Exception {
        return TestVideos.record(tmp.getRoot().toPath().resolve("moving.mkv"), 320, 160, frames,
                i -> circleFrame(320, 160, (int) (40 + 5 * i), 80, 10, RED));
    }

    @Test
    public void testReadsAllFramesInOrder() throws Exception {
        Path video = movingAnt(12);

        try (FFmpegFrameSource source = new FFmpegFrameSource(video.toString())) {
            assertEquals(320, source.getWidth());
            assertEquals(160, source.getHeight());
            assertTrue("帧率应大于0", source.getFrameRate() > 0);

            long expected = 0;
            VideoFrame frame;
            while ((frame = source.next()) != null) {
                try (VideoFrame f = frame) {
                    assertEquals(expected++, f.getIndex());
                    assertFalse(f.isEmpty());
                    assertEquals(3, f.getImage().channels());
                }
            }
            assertEquals("应读到全部帧", 12, expected);
            assertNull("结尾之后仍返回 null", source.next());
        }
    }

    @Test
    public void testDecodedFramesKeepTheAnt() throws Exception {
        Path video = movingAnt(5);
        TrackerConfig config = redBlueConfig().build();
        BlobSegmenter segmenter = new BlobSegmenter(config, new ColorClassifier(config), null);

        try (FFmpegFrameSource source = new FFmpegFrameSource(video.toString())) {
            for (int i = 0; i < 5; i++) {
                try (VideoFrame f = source.next()) {
                    List<Detection> detections = segmenter.segment(f.getImage());
                    assertEquals(1, detections.size());
                    assertEquals(40 + 5 * i, detections.get(0).getCentroid().getX(), 0.5);
                    assertEquals("red", detections.get(0).getColorTag());
                }
            }
        }
    }

    @Test
    public void testSkipToResumesAtFrame() throws Exception {
        Path video = movingAnt(12);

        try (FFmpegFrameSource source = new FFmpegFrameSource(video.toString())) {
            source.skipTo(7);

            assertEquals(7, source.position());
            try (VideoFrame f = source.next()) {
                assertEquals(7, f.getIndex());
            }
        }
    }

    @Test
    public void testUnreadableFileIsCorruptSource() throws Exception {
        Path bogus = tmp.newFile("bogus.mp4").toPath();
        Files.write(bogus, "not a video".getBytes());

        try {
            new FFmpegFrameSource(bogus.toString());
            fail("无法解码的文件应抛出异常");
        } catch (AnalysisException e) {
            assertEquals(ErrorKind.CORRUPT_SOURCE, e.getKind());
        }
    }
}
