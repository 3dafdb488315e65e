package com.example.anttrack.util;

import com.example.anttrack.dto.AnalysisResult;
import com.example.anttrack.support.TestVideos;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.example.anttrack.support.SyntheticFrames.blank;
import static org.junit.Assert.*;

public class FFmpegUtilTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testVideoInfo() throws Exception {
        Path video = TestVideos.record(tmp.getRoot().toPath().resolve("info.mkv"), 160, 120, 25, i -> blank(160, 120));

        AnalysisResult.VideoMetadata info = FFmpegUtil.getVideoInfo(video.toString());

        assertNotNull(info);
        assertEquals("视频宽度", 160, info.getWidth());
        assertEquals("视频高度", 120, info.getHeight());
        assertTrue("视频帧率应大于0", info.getFps() > 0);
        assertNotNull("视频格式不应为空", info.getFormat());
        assertEquals(Files.size(video), info.getFileSize());
    }

    @Test
    public void testVideoInfoMissingFile() {
        assertNull("文件不存在时返回 null", FFmpegUtil.getVideoInfo(tmp.getRoot().toPath().resolve("none.mp4").toString()));
    }

    @Test
    public void testVideoInfoNotAVideo() throws Exception {
        Path text = tmp.newFile("notes.mp4").toPath();
        Files.write(text, "hello".getBytes());

        assertNull("无法解码时返回 null", FFmpegUtil.getVideoInfo(text.toString()));
    }
}
