package fun.ai.indexer.preview;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.indexer.catalog.EntryKind;
import fun.ai.indexer.catalog.JsonFileCatalogStore;
import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.job.ItemOutcome;
import fun.ai.indexer.job.JobState;
import fun.ai.indexer.launcher.AppProcessLauncher;
import fun.ai.indexer.launcher.PortAllocator;
import fun.ai.indexer.launcher.ProcessTerminator;
import fun.ai.indexer.support.FakePageCapturer;
import fun.ai.indexer.support.TestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PreviewCaptureJobQueueTest {

    @TempDir
    Path tmp;

    private IndexerProperties props;
    private PreviewCapturer capturer;
    private PreviewCaptureJobQueue queue;

    @BeforeEach
    void setUp() {
        props = TestSupport.props(tmp);
        JsonFileCatalogStore store = new JsonFileCatalogStore(props, new ObjectMapper());
        capturer = new PreviewCapturer(new AppProcessLauncher(props), new ProcessTerminator(props),
                new PortAllocator(), store, props, TestSupport.NO_PAUSE);
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    private PreviewItem page(String shortId, String file) throws Exception {
        Path html = TestSupport.write(tmp.resolve("site").resolve(file), "<html>" + file + "</html>");
        return new PreviewItem(null, shortId, EntryKind.STATIC, file, html, html, 0);
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 30_000L;
        while (queue.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(queue.isRunning());
    }

    @Test
    void testBatchSharesOneBrowser() throws Exception {
        FakePageCapturer browser = new FakePageCapturer();
        queue = new PreviewCaptureJobQueue(capturer, () -> browser);

        assertEquals(2, queue.enqueue(Arrays.asList(page("B001", "a.html"), page("B002", "b.html"))));
        awaitIdle();

        JobState s = queue.snapshot();
        assertEquals(2, s.getTotal());
        assertEquals(2, s.getCompleted());
        assertFalse(s.isActive());
        assertEquals(2, browser.getOpenedUrls().size());
        assertEquals(1, browser.getCloseCount());
        assertTrue(s.averageSuccessMillis() >= 0);
    }

    @Test
    void testItemsAddedDuringBatchAreAppendedAndDeduplicated() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        FakePageCapturer browser = new FakePageCapturer();
        queue = new PreviewCaptureJobQueue(capturer, () -> {
            try {
                assertTrue(release.await(30, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return browser;
        });

        PreviewItem a = page("B001", "a.html");
        PreviewItem b = page("B002", "b.html");
        assertEquals(2, queue.enqueue(Arrays.asList(a, b)));
        assertEquals(0, queue.enqueue(List.of(a)));
        assertEquals(1, queue.enqueue(List.of(page("B003", "c.html"))));
        assertEquals(3, queue.snapshot().getTotal());
        assertTrue(queue.isRunning());

        release.countDown();
        awaitIdle();
        assertEquals(3, queue.snapshot().getCompleted());
        assertEquals(3, browser.getOpenedUrls().size());
    }

    @Test
    void testBrowserUnavailableFailsEveryItem() throws Exception {
        queue = new PreviewCaptureJobQueue(capturer, () -> {
            throw new IllegalStateException("chrome not installed");
        });

        queue.enqueue(Arrays.asList(page("B001", "a.html"), page("B002", "b.html")));
        awaitIdle();

        JobState s = queue.snapshot();
        assertEquals(2, s.getCompleted());
        List<Map.Entry<String, ItemOutcome>> failures = s.recentFailures(5);
        assertEquals(2, failures.size());
        assertTrue(failures.get(0).getValue().getError().contains("chrome not installed"));
    }

    @Test
    void testFailedItemDoesNotStopTheBatch() throws Exception {
        FakePageCapturer browser = new FakePageCapturer();
        queue = new PreviewCaptureJobQueue(capturer, () -> browser);
        PreviewItem missing = new PreviewItem(null, "B009", EntryKind.STATIC, "gone",
                tmp.resolve("gone.html"), tmp.resolve("gone.html"), 0);

        queue.enqueue(Arrays.asList(missing, page("B001", "a.html")));
        awaitIdle();

        JobState s = queue.snapshot();
        assertEquals(2, s.getCompleted());
        assertEquals(1, s.recentFailures(5).size());
        assertTrue(s.recentFailures(5).get(0).getValue().getError().startsWith("page file not found"));

        // 新批次重新计数
        queue.enqueue(List.of(page("B002", "b.html")));
        awaitIdle();
        assertEquals(1, queue.snapshot().getTotal());
        assertEquals(1, queue.snapshot().getCompleted());
    }
}
