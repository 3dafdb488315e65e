package com.example.anttrack.service.tracking;

import com.example.anttrack.dto.TrackEvent;
import com.example.anttrack.dto.TrackState;
import org.junit.Test;

import static org.junit.Assert.*;

public class TrackLifecycleTest {

    private static final int K = 3;

    @Test
    public void testMatchedAlwaysActivates() {
        for (TrackState s : new TrackState[]{TrackState.NEW, TrackState.ACTIVE, TrackState.LOST}) {
            assertEquals(s + " 匹配后应为 ACTIVE", TrackState.ACTIVE, TrackLifecycle.next(s, TrackEvent.MATCHED, 0, K));
        }
    }

    @Test
    public void testMissedLostUntilLimitExceeded() {
        assertEquals(TrackState.LOST, TrackLifecycle.next(TrackState.NEW, TrackEvent.MISSED, 1, K));
        assertEquals(TrackState.LOST, TrackLifecycle.next(TrackState.LOST, TrackEvent.MISSED, K, K));
        assertEquals("丢失计数超过K应终止", TrackState.TERMINATED,
                TrackLifecycle.next(TrackState.LOST, TrackEvent.MISSED, K + 1, K));
    }

    @Test
    public void testZeroToleranceTerminatesOnFirstMiss() {
        assertEquals(TrackState.TERMINATED, TrackLifecycle.next(TrackState.ACTIVE, TrackEvent.MISSED, 1, 0));
    }

    @Test
    public void testAbsorbedBecomesMerged() {
        assertEquals(TrackState.MERGED, TrackLifecycle.next(TrackState.ACTIVE, TrackEvent.ABSORBED, 0, K));
        assertEquals(TrackState.MERGED, TrackLifecycle.next(TrackState.LOST, TrackEvent.ABSORBED, 2, K));
    }

    @Test(expected = IllegalStateException.class)
    public void testNewTrackCannotBeAbsorbed() {
        TrackLifecycle.next(TrackState.NEW, TrackEvent.ABSORBED, 0, K);
    }

    @Test(expected = IllegalStateException.class)
    public void testTerminatedIsFinal() {
        TrackLifecycle.next(TrackState.TERMINATED, TrackEvent.MATCHED, 0, K);
    }

    @Test(expected = IllegalStateException.class)
    public void testMergedIsFinal() {
        TrackLifecycle.next(TrackState.MERGED, TrackEvent.MISSED, 1, K);
    }

    @Test(expected = IllegalStateException.class)
    public void testMissedRequiresPositiveCount() {
        TrackLifecycle.next(TrackState.ACTIVE, TrackEvent.MISSED, 0, K);
    }
}
