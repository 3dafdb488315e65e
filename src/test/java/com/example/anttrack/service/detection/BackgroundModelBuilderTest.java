package com.example.anttrack.service.detection;

import com.example.anttrack.service.source.FrameSource;
import com.example.anttrack.support.ScriptedFrameSource;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.example.anttrack.support.SyntheticFrames.WHITE;
import static com.example.anttrack.support.SyntheticFrames.drawCircle;
import static com.example.anttrack.support.SyntheticFrames.filled;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.junit.Assert.*;

public class BackgroundModelBuilderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    /**
     * 灰色背景上一只每帧移动 15 像素的白色蚂蚁
     */
    private static ScriptedFrameSource movingAnt() {
        return new ScriptedFrameSource(20, i -> {
            Mat image = filled(400, 100, new Scalar(50, 50, 50, 0));
            drawCircle(image, (int) (20 + 15 * i), 50, 6, WHITE);
            return image;
        });
    }

    private static int blueAt(Mat image, int x, int y) {
        try (UByteIndexer idx = image.createIndexer()) {
            return idx.get(y, x, 0);
        }
    }

    @Test
    public void testAverageRemovesMovingAnt() {
        try (Mat background = new BackgroundModelBuilder(10).build(movingAnt())) {
            assertEquals(CV_8UC3, background.type());
            assertEquals(400, background.cols());
            assertEquals("从未被覆盖的像素保持背景值", 50, blueAt(background, 5, 5));
            int atAnt = blueAt(background, 20, 50);
            assertTrue("只在一帧出现的蚂蚁应被平均掉: " + atAnt, atAnt < 80);
        }
    }

    @Test
    public void testCacheIsWrittenAndReused() throws Exception {
        Path cache = tmp.getRoot().toPath().resolve("colony_bg.png");
        BackgroundModelBuilder builder = new BackgroundModelBuilder(10);

        try (Mat first = builder.loadOrBuild(cache, BackgroundModelBuilderTest::movingAnt)) {
            assertTrue("背景模型应写入缓存", Files.exists(cache));
        }
        try (Mat second = builder.loadOrBuild(cache, () -> {
            throw new AssertionError("缓存存在时不应重新读取视频");
        })) {
            assertEquals(50, blueAt(second, 5, 5));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testEmptySourceRejected() {
        FrameSource empty = new ScriptedFrameSource(0, i -> null);
        new BackgroundModelBuilder(5).build(empty);
    }
}
