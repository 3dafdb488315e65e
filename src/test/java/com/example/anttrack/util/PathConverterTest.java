package com.example.anttrack.util;

import com.example.anttrack.config.FileStorageConfig;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PathConverterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private PathConverter converter;
    private Path outputs;

    @Before
    public void setUp() throws Exception {
        outputs = tmp.newFolder("outputs").toPath();
        FileStorageConfig storage = new FileStorageConfig();
        storage.setOutputDir(outputs.toString());
        storage.setCheckpointDir(outputs.resolve("checkpoints").toString());
        converter = new PathConverter(storage);
    }

    @Test
    public void testDerivedPaths() {
        String name = converter.outputName("/data/videos/colony.mp4");
        assertEquals("colony", name);
        assertEquals(outputs.resolve("colony.csv"), converter.csvPath(name, null));
        assertEquals(Paths.get("/tmp/custom.csv"), converter.csvPath(name, "/tmp/custom.csv"));
        assertEquals(outputs.resolve("checkpoints").resolve("colony.checkpoint.json"), converter.checkpointPath(name));
        assertEquals(outputs.resolve("colony_bg.png"), converter.backgroundPath(name));
        assertEquals(outputs.resolve("colony_motion.csv"), converter.motionCsvPath(name));
    }

    @Test
    public void testOutputNamesUseFolderRelativePath() {
        Path folder = Paths.get("/data/videos");
        List<Path> videos = Arrays.asList(folder.resolve("a/colony.mp4"), folder.resolve("b/colony.mp4"),
                folder.resolve("solo.mp4"));

        Map<Path, String> names = converter.outputNames(folder, videos);

        assertEquals("a__colony", names.get(videos.get(0)));
        assertEquals("b__colony", names.get(videos.get(1)));
        assertEquals("不重名的视频保持原名", "solo", names.get(videos.get(2)));
    }

    @Test
    public void testOutputNamesDisambiguateExtensions() {
        Path folder = Paths.get("/data/videos");
        List<Path> videos = Arrays.asList(folder.resolve("colony.mp4"), folder.resolve("colony.AVI"),
                folder.resolve("a__colony.mp4"), folder.resolve("a/colony.mp4"));

        Map<Path, String> names = converter.outputNames(folder, videos);

        assertEquals("colony_mp4", names.get(videos.get(0)));
        assertEquals("colony_avi", names.get(videos.get(1)));
        assertEquals("批内输出名必须互不相同", 4, new HashSet<>(names.values()).size());
        assertTrue(names.get(videos.get(2)).startsWith("a__colony_mp4_"));
        assertEquals("同一批视频的命名应稳定，续跑才能找到断点", names, converter.outputNames(folder, videos));
    }

    @Test
    public void testGetBaseName() {
        assertEquals("colony", converter.getBaseName("C:\\videos\\colony.mp4"));
        assertEquals("colony.day1", converter.getBaseName("/videos/colony.day1.avi"));
        assertEquals("noext", converter.getBaseName("noext"));
        assertNull(converter.getBaseName(""));
    }

    @Test
    public void testConvertToWebPath() {
        assertEquals("/outputs/colony.csv", converter.convertToWebPath(outputs.resolve("colony.csv").toString()));
        assertNull("输出目录外的文件不对外暴露", converter.convertToWebPath("/etc/passwd"));
    }

    @Test
    public void testListVideos() throws Exception {
        Path folder = tmp.newFolder("videos").toPath();
        Files.createDirectories(folder.resolve("day2"));
        for (String name : Arrays.asList("b.MP4", "a.avi", "notes.txt", "day2/c.mkv")) {
            Files.createFile(folder.resolve(name));
        }

        List<Path> flat = converter.listVideos(folder, false);
        List<Path> recursive = converter.listVideos(folder, true);

        assertEquals(Arrays.asList(folder.resolve("a.avi"), folder.resolve("b.MP4")), flat);
        assertEquals(3, recursive.size());
        assertTrue(recursive.contains(folder.resolve("day2/c.mkv")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testListVideosMissingFolder() throws Exception {
        converter.listVideos(tmp.getRoot().toPath().resolve("missing"), false);
    }
}
