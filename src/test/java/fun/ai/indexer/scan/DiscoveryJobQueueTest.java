package fun.ai.indexer.scan;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.indexer.catalog.CatalogEntry;
import fun.ai.indexer.catalog.EntryKind;
import fun.ai.indexer.catalog.JsonFileCatalogStore;
import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.job.JobPhase;
import fun.ai.indexer.job.JobState;
import fun.ai.indexer.launcher.AppProcessLauncher;
import fun.ai.indexer.launcher.PortAllocator;
import fun.ai.indexer.launcher.ProcessTerminator;
import fun.ai.indexer.preview.PreviewCaptureJobQueue;
import fun.ai.indexer.preview.PreviewCapturer;
import fun.ai.indexer.support.FakePageCapturer;
import fun.ai.indexer.support.TestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryJobQueueTest {

    @TempDir
    Path tmp;

    private IndexerProperties props;
    private JsonFileCatalogStore store;
    private PreviewCaptureJobQueue previewQueue;
    private DiscoveryJobQueue queue;
    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        props = TestSupport.props(tmp);
        store = new JsonFileCatalogStore(props, new ObjectMapper());
        FolderWalker walker = new FolderWalker(props);
        FolderScanner scanner = new FolderScanner(new AppCandidateDetector(props, walker), walker, props);
        PreviewCapturer capturer = new PreviewCapturer(new AppProcessLauncher(props), new ProcessTerminator(props),
                new PortAllocator(), store, props, TestSupport.NO_PAUSE);
        previewQueue = new PreviewCaptureJobQueue(capturer, FakePageCapturer::new);
        queue = new DiscoveryJobQueue(scanner, new FileMetadataReader(), store, previewQueue);

        root = tmp.resolve("apps");
        TestSupport.write(root.resolve("todo/app.py"), TestSupport.flaskApp(5001));
        TestSupport.write(root.resolve("todo/templates/index.html"), "<html>todo</html>");
        TestSupport.write(root.resolve("game/snake.html"), "<html>snake</html>");
    }

    @AfterEach
    void tearDown() {
        queue.stop();
        previewQueue.shutdown();
    }

    @Test
    void testScanPersistsExecutableAndStandalonePage() throws Exception {
        queue.start();
        ScanBatch batch = queue.submit(root, false);
        assertTrue(batch.awaitDone(Duration.ofSeconds(30)));

        JobState s = queue.snapshot();
        assertEquals(2, s.getTotal());
        assertEquals(2, s.getCompleted());
        assertEquals(100d, s.progressPercentage());
        assertEquals(JobPhase.IDLE, s.getPhase());
        assertTrue(s.recentFailures(5).isEmpty());

        List<CatalogEntry> all = store.getAll();
        assertEquals(2, all.size());
        CatalogEntry app = all.stream().filter(e -> e.getKind() == EntryKind.EXECUTABLE).findFirst().orElseThrow();
        CatalogEntry page = all.stream().filter(e -> e.getKind() == EntryKind.STATIC).findFirst().orElseThrow();
        assertEquals("A001", app.getShortId());
        assertEquals("B001", page.getShortId());
        assertEquals(5001, app.getPort());
        assertEquals(List.of("flask"), app.getDependencies());
        assertTrue(app.isMissingDependencies());
        assertTrue(app.getInterfaceFilePath().endsWith("index.html"));
        assertNull(app.getPreviewPath());
    }

    @Test
    void testRescanDoesNotDuplicate() throws Exception {
        queue.start();
        assertTrue(queue.submit(root, false).awaitDone(Duration.ofSeconds(30)));
        assertTrue(queue.submit(root, false).awaitDone(Duration.ofSeconds(30)));

        assertEquals(2, store.getAll().size());
        assertEquals(2, queue.snapshot().getCompleted());
    }

    @Test
    void testRescanPrunesVanishedEntriesUnderRoot() throws Exception {
        Path elsewhere = TestSupport.write(tmp.resolve("other/keep.html"), "<html>keep</html>");
        queue.start();
        assertTrue(queue.submit(root, false).awaitDone(Duration.ofSeconds(30)));
        assertTrue(queue.submit(elsewhere.getParent(), false).awaitDone(Duration.ofSeconds(30)));
        assertEquals(3, store.getAll().size());

        Files.delete(root.resolve("game/snake.html"));
        Files.delete(elsewhere);
        assertTrue(queue.submit(root, false).awaitDone(Duration.ofSeconds(30)));

        List<CatalogEntry> all = store.getAll();
        assertEquals(2, all.size());
        assertTrue(all.stream().noneMatch(e -> e.getMainFilePath().endsWith("snake.html")));
        // 其他根目录下的条目不受本次扫描影响
        assertTrue(all.stream().anyMatch(e -> e.getMainFilePath().endsWith("keep.html")));
    }

    @Test
    void testProgressPolledDuringBatchStaysConsistent() throws Exception {
        for (int i = 0; i < 60; i++) {
            TestSupport.write(root.resolve("pages/p" + i + ".html"), "<html>" + i + "</html>");
        }
        queue.start();
        ScanBatch batch = queue.submit(root, false);

        int lastCompleted = 0;
        int fixedTotal = -1;
        boolean finished;
        do {
            finished = batch.isDone();
            JobState s = queue.snapshot();
            assertTrue(s.getCompleted() >= lastCompleted, "completed went backwards");
            lastCompleted = s.getCompleted();
            assertTrue(s.progressPercentage() >= 0d && s.progressPercentage() <= 100d);
            if (s.isTotalKnown()) {
                assertTrue(s.getCompleted() <= s.getTotal(), s.getCompleted() + " > " + s.getTotal());
                if (fixedTotal < 0) {
                    fixedTotal = s.getTotal();
                }
                assertEquals(fixedTotal, s.getTotal());
            } else {
                assertEquals(0, s.getCompleted());
            }
            Thread.sleep(1);
        } while (!finished);
        assertTrue(batch.awaitDone(Duration.ofSeconds(30)));
        JobState done = queue.snapshot();
        assertEquals(62, done.getTotal());
        assertEquals(62, done.getCompleted());
    }

    @Test
    void testTotalUnknownUntilStandalonePagesAreFound() {
        ScanBatch batch = new ScanBatch(1, root.toAbsolutePath().normalize(), false);

        queue.execute(new DiscoveryJobQueue.ScanTask(ScanTaskType.FIND_EXECUTABLES, batch));
        JobState afterFirst = queue.snapshot();
        assertFalse(afterFirst.isTotalKnown());
        assertEquals(0d, afterFirst.progressPercentage());
        assertEquals(JobPhase.FINDING_EXECUTABLES, afterFirst.getPhase());

        queue.execute(new DiscoveryJobQueue.ScanTask(ScanTaskType.FIND_STATIC, batch));
        JobState afterSecond = queue.snapshot();
        assertTrue(afterSecond.isTotalKnown());
        assertEquals(2, afterSecond.getTotal());
        assertEquals(0, afterSecond.getCompleted());

        queue.execute(new DiscoveryJobQueue.ScanTask(ScanTaskType.PERSIST, batch));
        assertTrue(batch.isDone());
        assertEquals(2, queue.snapshot().getCompleted());
    }

    @Test
    void testMissingRootFinishesWithEmptyBatch() {
        Path missing = tmp.resolve("does-not-exist");
        ScanBatch batch = new ScanBatch(1, missing, false);
        queue.execute(new DiscoveryJobQueue.ScanTask(ScanTaskType.FIND_EXECUTABLES, batch));
        queue.execute(new DiscoveryJobQueue.ScanTask(ScanTaskType.FIND_STATIC, batch));
        queue.execute(new DiscoveryJobQueue.ScanTask(ScanTaskType.PERSIST, batch));

        JobState s = queue.snapshot();
        assertTrue(s.isTotalKnown());
        assertEquals(0, s.getTotal());
        assertFalse(s.isActive());
        assertTrue(batch.isDone());
    }

    @Test
    void testAutoPreviewHandsPagesToCaptureQueue() throws Exception {
        Path pagesOnly = tmp.resolve("pages");
        TestSupport.write(pagesOnly.resolve("clock.html"), "<html>clock</html>");

        queue.start();
        assertTrue(queue.submit(pagesOnly, true).awaitDone(Duration.ofSeconds(30)));

        long deadline = System.currentTimeMillis() + 30_000L;
        while (previewQueue.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertEquals(1, previewQueue.snapshot().getCompleted());
        CatalogEntry e = store.findByShortId("B001").orElseThrow();
        assertNotNull(e.getPreviewPath());
        assertEquals("B00001.png", Paths.get(e.getPreviewPath()).getFileName().toString());
        assertTrue(Files.isRegularFile(Paths.get(e.getPreviewPath())));
    }
}
