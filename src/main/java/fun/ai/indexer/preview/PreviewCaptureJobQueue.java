package fun.ai.indexer.preview;

import fun.ai.indexer.job.ItemOutcome;
import fun.ai.indexer.job.JobPhase;
import fun.ai.indexer.job.JobProgressTracker;
import fun.ai.indexer.job.JobState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 预览截图队列：单 worker 顺序处理，整批共用一个浏览器实例。
 * 队列取空时 worker 结束并关闭浏览器；批次进行中再提交的条目追加到当前批次。
 */
@Component
public class PreviewCaptureJobQueue {
    private static final Logger log = LoggerFactory.getLogger(PreviewCaptureJobQueue.class);

    private final PreviewCapturer capturer;
    private final PageCapturerFactory pageCapturerFactory;
    private final JobProgressTracker tracker = new JobProgressTracker();

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<PreviewItem> pending = new ArrayDeque<>();
    private final Set<String> pendingKeys = new HashSet<>();
    private Thread worker;
    private volatile boolean shuttingDown;

    public PreviewCaptureJobQueue(PreviewCapturer capturer, PageCapturerFactory pageCapturerFactory) {
        this.capturer = capturer;
        this.pageCapturerFactory = pageCapturerFactory;
    }

    /**
     * 立即返回；同一条目已在队列中时不重复加入
     *
     * @return 实际加入的条目数
     */
    public int enqueue(List<PreviewItem> items) {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        lock.lock();
        try {
            List<PreviewItem> accepted = new ArrayList<>();
            for (PreviewItem item : items) {
                if (item != null && pendingKeys.add(item.key())) {
                    accepted.add(item);
                }
            }
            if (accepted.isEmpty()) {
                return 0;
            }
            if (worker == null) {
                tracker.begin(JobPhase.CAPTURING, accepted.size());
                pending.addAll(accepted);
                worker = new Thread(this::drain, "preview-worker");
                worker.setDaemon(true);
                worker.start();
                log.info("preview batch started: items={}", accepted.size());
            } else {
                tracker.extendTotal(accepted.size());
                pending.addAll(accepted);
                log.info("preview batch extended: added={}", accepted.size());
            }
            return accepted.size();
        } finally {
            lock.unlock();
        }
    }

    private void drain() {
        PageCapturer page = null;
        String browserError = null;
        try {
            page = pageCapturerFactory.create();
        } catch (Exception e) {
            browserError = "browser unavailable: " + e.getMessage();
            log.error("start headless browser failed: error={}", e.getMessage(), e);
        }
        try {
            while (true) {
                PreviewItem item = next();
                if (item == null) {
                    break;
                }
                if (browserError != null) {
                    tracker.itemFinished(item.key(), ItemOutcome.failed(browserError, 0L));
                    continue;
                }
                process(page, item);
            }
        } finally {
            if (page != null) {
                page.close();
            }
        }
    }

    /**
     * 取下一个条目；队列为空时在同一把锁内结束 worker，保证与 enqueue 不会错过彼此
     */
    private PreviewItem next() {
        lock.lock();
        try {
            PreviewItem item = shuttingDown ? null : pending.poll();
            if (item == null) {
                for (PreviewItem skipped : pending) {
                    tracker.itemFinished(skipped.key(), ItemOutcome.failed("cancelled: shutting down", 0L));
                }
                pending.clear();
                pendingKeys.clear();
                worker = null;
                tracker.finish();
                log.info("preview batch finished: {}", summary(tracker.snapshot()));
            }
            return item;
        } finally {
            lock.unlock();
        }
    }

    private void process(PageCapturer page, PreviewItem item) {
        String key = item.key();
        tracker.itemStarted(key);
        long start = System.nanoTime();
        try {
            Path preview = capturer.capture(page, item);
            long ms = (System.nanoTime() - start) / 1_000_000L;
            tracker.itemFinished(key, ItemOutcome.ok(ms));
            log.info("preview captured: shortId={}, file={}, durationMs={}", item.getShortId(), preview, ms);
        } catch (Exception e) {
            long ms = (System.nanoTime() - start) / 1_000_000L;
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            tracker.itemFinished(key, ItemOutcome.failed(msg, ms));
            log.warn("preview failed: shortId={}, path={}, error={}", item.getShortId(), item.getMainFile(), msg);
        } finally {
            lock.lock();
            try {
                pendingKeys.remove(key);
            } finally {
                lock.unlock();
            }
        }
    }

    private String summary(JobState s) {
        return "completed=" + s.getCompleted() + "/" + s.getTotal();
    }

    public JobState snapshot() {
        return tracker.snapshot();
    }

    public int queueSize() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return worker != null;
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
    }
}
