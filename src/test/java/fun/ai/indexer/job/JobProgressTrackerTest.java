package fun.ai.indexer.job;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobProgressTrackerTest {

    @Test
    void testUnknownTotalReportsZeroPercent() {
        JobProgressTracker tracker = new JobProgressTracker();
        tracker.begin(JobPhase.INITIALIZING, -1);
        tracker.record("find_executables:/r", ItemOutcome.ok(5));

        JobState s = tracker.snapshot();
        assertFalse(s.isTotalKnown());
        assertEquals(0, s.getTotal());
        assertEquals(0d, s.progressPercentage());
        assertTrue(s.isActive());
    }

    @Test
    void testTotalIsFixedOnce() {
        JobProgressTracker tracker = new JobProgressTracker();
        tracker.begin(JobPhase.INITIALIZING, -1);
        assertTrue(tracker.fixTotal(2));
        assertFalse(tracker.fixTotal(10));

        tracker.itemFinished("a", ItemOutcome.ok(1));
        tracker.itemFinished("b", ItemOutcome.failed("boom", 1));
        tracker.itemFinished("c", ItemOutcome.ok(1));

        JobState s = tracker.snapshot();
        assertEquals(2, s.getTotal());
        assertEquals(2, s.getCompleted());
        assertEquals(100d, s.progressPercentage());
        assertEquals(0, s.remaining());
    }

    @Test
    void testBeginResetsPreviousBatch() {
        JobProgressTracker tracker = new JobProgressTracker();
        tracker.begin(JobPhase.CAPTURING, 1);
        tracker.itemFinished("a", ItemOutcome.failed("x", 1));
        tracker.finish();
        assertFalse(tracker.snapshot().isActive());

        tracker.begin(JobPhase.CAPTURING, 3);
        JobState s = tracker.snapshot();
        assertEquals(0, s.getCompleted());
        assertEquals(3, s.getTotal());
        assertTrue(s.getResults().isEmpty());
    }

    @Test
    void testExtendTotalAndMetrics() {
        JobProgressTracker tracker = new JobProgressTracker();
        tracker.begin(JobPhase.CAPTURING, 2);
        tracker.itemStarted("a");
        assertEquals("a", tracker.snapshot().getCurrentItem());
        tracker.itemFinished("a", ItemOutcome.ok(1000));
        assertNull(tracker.snapshot().getCurrentItem());
        tracker.itemFinished("b", ItemOutcome.ok(3000));
        tracker.extendTotal(2);

        JobState s = tracker.snapshot();
        assertEquals(4, s.getTotal());
        assertEquals(2, s.remaining());
        assertEquals(2000, s.averageSuccessMillis());
        assertEquals(50d, s.progressPercentage());
    }

    @Test
    void testRecentFailuresKeepsNewestInOrder() {
        JobProgressTracker tracker = new JobProgressTracker();
        tracker.begin(JobPhase.CAPTURING, 8);
        for (int i = 1; i <= 7; i++) {
            tracker.itemFinished("item" + i, ItemOutcome.failed("err" + i, 1));
        }
        tracker.itemFinished("ok", ItemOutcome.ok(1));

        JobState s = tracker.snapshot();
        List<Map.Entry<String, ItemOutcome>> failures = s.recentFailures(5);
        assertEquals(5, failures.size());
        assertEquals("item3", failures.get(0).getKey());
        assertEquals("item7", failures.get(4).getKey());
        assertEquals(-1, new JobProgressTracker().snapshot().averageSuccessMillis());
    }

    @Test
    void testVersionChangesOnEveryUpdate() {
        JobProgressTracker tracker = new JobProgressTracker();
        long v0 = tracker.snapshot().getVersion();
        tracker.begin(JobPhase.CAPTURING, 1);
        long v1 = tracker.snapshot().getVersion();
        tracker.itemStarted("a");
        long v2 = tracker.snapshot().getVersion();
        assertTrue(v1 > v0);
        assertTrue(v2 > v1);
    }
}
