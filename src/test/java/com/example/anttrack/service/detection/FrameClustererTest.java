package com.example.anttrack.service.detection;

import com.example.anttrack.dto.BoundingBox;
import com.example.anttrack.dto.Cluster;
import com.example.anttrack.dto.Detection;
import com.example.anttrack.dto.Position;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.example.anttrack.support.SyntheticFrames.detection;
import static com.example.anttrack.support.SyntheticFrames.redBlueConfig;
import static org.junit.Assert.*;

public class FrameClustererTest {

    private final FrameClusterer clusterer = new FrameClusterer(redBlueConfig().clusterDistanceThreshold(15).build());

    private static final Map<String, Integer> ONE_RED = Collections.singletonMap("red", 1);

    private static Detection boxed(double x, double y, double area, String tag, BoundingBox box) {
        return detection(x, y, area, tag).toBuilder().boundingBox(box).build();
    }

    @Test
    public void testFragmentsOfOneTaggedAntAreMerged() {
        Detection head = boxed(100, 100, 200, "red", new BoundingBox(90, 90, 20, 20));
        Detection tail = boxed(110, 100, 100, "red", new BoundingBox(105, 95, 10, 10));

        List<Cluster> clusters = clusterer.cluster(Arrays.asList(head, tail), ONE_RED);

        assertEquals(1, clusters.size());
        assertTrue("同色且只属于一条轨迹的碎片应合并", clusters.get(0).isMerged());
        Detection merged = clusters.get(0).getMerged();
        assertEquals(300, merged.getArea(), 1e-9);
        assertEquals("质心按面积加权", 310.0 / 3, merged.getCentroid().getX(), 1e-9);
        assertEquals(100, merged.getCentroid().getY(), 1e-9);
        assertEquals(2, merged.getMemberCount());
        assertEquals("red", merged.getColorTag());
        assertEquals(new BoundingBox(90, 90, 25, 20), merged.getBoundingBox());
        assertEquals(1, FrameClusterer.candidates(clusters).size());
    }

    @Test
    public void testUnclassifiedFragmentJoinsTaggedOne() {
        List<Cluster> clusters = clusterer.cluster(Arrays.asList(
                detection(100, 100, 200, "red"), detection(108, 100, 80)), ONE_RED);

        assertEquals(1, clusters.size());
        assertTrue(clusters.get(0).isMerged());
        assertEquals("red", clusters.get(0).getMerged().getColorTag());
    }

    @Test
    public void testTagSharedByTwoTracksIsNotMerged() {
        List<Cluster> clusters = clusterer.cluster(Arrays.asList(
                detection(100, 100, 200, "red"), detection(110, 100, 200, "red")),
                Collections.singletonMap("red", 2));

        assertEquals(1, clusters.size());
        assertFalse("颜色属于多条轨迹时应交给跟踪器消歧", clusters.get(0).isMerged());
        assertEquals(2, FrameClusterer.candidates(clusters).size());
    }

    @Test
    public void testDifferentTagsAreNotMerged() {
        List<Cluster> clusters = clusterer.cluster(Arrays.asList(
                detection(100, 100, 200, "red"), detection(110, 100, 200, "blue")), ONE_RED);

        assertEquals(2, FrameClusterer.candidates(clusters).size());
    }

    @Test
    public void testUntaggedGroupIsNotMerged() {
        List<Cluster> clusters = clusterer.cluster(Arrays.asList(
                detection(100, 100, 200), detection(110, 100, 200)), Collections.emptyMap());

        assertEquals(2, FrameClusterer.candidates(clusters).size());
    }

    @Test
    public void testDistantDetectionsStaySingletons() {
        List<Cluster> clusters = clusterer.cluster(Arrays.asList(
                detection(100, 100, 200, "red"), detection(200, 100, 200, "red")), ONE_RED);

        assertEquals(2, clusters.size());
        for (Cluster c : clusters) {
            assertEquals(1, c.getMembers().size());
        }
    }

    @Test
    public void testClusteringFailureFallsBackToSingletons() {
        List<Cluster> clusters = clusterer.cluster(Arrays.asList(
                detection(100, 100, 200, "red"), detection(Double.NaN, 100, 200, "red")), ONE_RED);

        assertEquals("无法分组时每个检测单独成组", 2, clusters.size());
        assertFalse(clusters.get(0).isMerged());
    }

    @Test
    public void testTrivialInputs() {
        assertTrue(clusterer.cluster(Collections.emptyList(), ONE_RED).isEmpty());

        Detection only = detection(10, 10, 100, "red");
        List<Cluster> clusters = clusterer.cluster(Collections.singletonList(only), ONE_RED);
        assertEquals(Collections.singletonList(only), FrameClusterer.candidates(clusters));
    }

    @Test
    public void testMergedContourIsConvexHull() {
        Detection left = detection(100, 100, 200, "red").toBuilder()
                .contour(Arrays.asList(new Position(95, 95), new Position(105, 95),
                        new Position(105, 105), new Position(95, 105)))
                .build();
        Detection right = detection(110, 100, 200, "red").toBuilder()
                .contour(Arrays.asList(new Position(106, 95), new Position(115, 95),
                        new Position(115, 105), new Position(106, 105)))
                .build();

        Detection merged = clusterer.merge(Arrays.asList(left, right));

        for (Position corner : Arrays.asList(new Position(95, 95), new Position(115, 95),
                new Position(115, 105), new Position(95, 105))) {
            assertTrue("凸包应包含外角点 " + corner, merged.getContour().contains(corner));
        }
        assertNull(merged.getSkeleton());
    }
}
