package fun.ai.indexer.scan;

import fun.ai.indexer.catalog.CatalogEntry;
import fun.ai.indexer.catalog.CatalogStore;
import fun.ai.indexer.catalog.EntryKind;
import fun.ai.indexer.job.ItemOutcome;
import fun.ai.indexer.job.JobPhase;
import fun.ai.indexer.job.JobProgressTracker;
import fun.ai.indexer.job.JobState;
import fun.ai.indexer.preview.PreviewCaptureJobQueue;
import fun.ai.indexer.preview.PreviewItem;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 发现任务队列：一个常驻 worker 按提交顺序执行 find_executables -> find_static -> persist。
 * 多个扫描请求按 FIFO 排队，每个批次在其第一个阶段开始时重置进度。
 */
@Component
public class DiscoveryJobQueue {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryJobQueue.class);

    private static final ScanTask STOP = new ScanTask(null, null);

    private final FolderScanner scanner;
    private final FileMetadataReader metadataReader;
    private final CatalogStore catalogStore;
    private final PreviewCaptureJobQueue previewQueue;

    private final JobProgressTracker tracker = new JobProgressTracker();
    private final LinkedBlockingQueue<ScanTask> queue = new LinkedBlockingQueue<>();
    private final AtomicLong batchSeq = new AtomicLong();
    private Thread worker;

    public DiscoveryJobQueue(FolderScanner scanner,
                             FileMetadataReader metadataReader,
                             CatalogStore catalogStore,
                             PreviewCaptureJobQueue previewQueue) {
        this.scanner = scanner;
        this.metadataReader = metadataReader;
        this.catalogStore = catalogStore;
        this.previewQueue = previewQueue;
    }

    @PostConstruct
    public void start() {
        worker = new Thread(this::runLoop, "discovery-worker");
        worker.setDaemon(true);
        worker.start();
    }

    @PreDestroy
    public void stop() {
        queue.clear();
        queue.offer(STOP);
    }

    /**
     * 入队三个阶段任务后立即返回
     */
    public ScanBatch submit(Path rootDir, boolean autoPreview) {
        if (rootDir == null) {
            throw new IllegalArgumentException("rootDir 不能为空");
        }
        ScanBatch batch = new ScanBatch(batchSeq.incrementAndGet(), rootDir.toAbsolutePath().normalize(), autoPreview);
        queue.add(new ScanTask(ScanTaskType.FIND_EXECUTABLES, batch));
        queue.add(new ScanTask(ScanTaskType.FIND_STATIC, batch));
        queue.add(new ScanTask(ScanTaskType.PERSIST, batch));
        log.info("scan batch queued: batchId={}, root={}, autoPreview={}", batch.getId(), batch.getRootDir(), autoPreview);
        return batch;
    }

    private void runLoop() {
        while (true) {
            ScanTask task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task == STOP) {
                return;
            }
            execute(task);
        }
    }

    void execute(ScanTask task) {
        ScanBatch batch = task.batch;
        String key = batch.taskKey(task.type);
        long start = System.nanoTime();
        try {
            switch (task.type) {
                case FIND_EXECUTABLES:
                    tracker.begin(JobPhase.INITIALIZING, -1);
                    tracker.phase(JobPhase.FINDING_EXECUTABLES);
                    batch.setExecutables(scanner.findExecutables(batch.getRootDir()));
                    break;
                case FIND_STATIC:
                    tracker.phase(JobPhase.FINDING_STATIC);
                    batch.setPages(scanner.findStatic(batch.getRootDir(), batch.getExecutables()));
                    break;
                case PERSIST:
                    tracker.phase(JobPhase.SAVING_DATABASE);
                    persist(batch);
                    break;
                default:
                    throw new IllegalStateException("unknown scan task: " + task.type);
            }
            tracker.record(key, ItemOutcome.ok(elapsedMs(start)));
        } catch (Exception e) {
            log.error("scan task failed: task={}, root={}, error={}", task.type, batch.getRootDir(), e.getMessage(), e);
            tracker.record(key, ItemOutcome.failed(e.getMessage(), elapsedMs(start)));
        } finally {
            if (task.type == ScanTaskType.FIND_STATIC) {
                // total 在第二阶段结束时确定一次，之后不再变化
                tracker.fixTotal(batch.getExecutables().size() + batch.getPages().size());
            }
            if (task.type == ScanTaskType.PERSIST) {
                tracker.finish();
                log.info("scan batch finished: batchId={}, executables={}, pages={}",
                        batch.getId(), batch.getExecutables().size(), batch.getPages().size());
                handOffPreviews(batch);
                batch.markDone();
            }
        }
    }

    private void persist(ScanBatch batch) {
        for (AppDescriptor d : batch.allItems()) {
            long start = System.nanoTime();
            try {
                CatalogEntry stored = catalogStore.upsert(toEntry(d, batch.getRootDir()));
                d.resolved(stored.getId(), stored.getShortId());
                tracker.itemFinished(d.key(), ItemOutcome.ok(elapsedMs(start)));
                log.debug("scan item saved: shortId={}, path={}", stored.getShortId(), d.getMainFile());
            } catch (Exception e) {
                log.warn("scan item save failed: path={}, error={}", d.getMainFile(), e.getMessage());
                tracker.itemFinished(d.key(), ItemOutcome.failed(e.getMessage(), elapsedMs(start)));
            }
        }
        pruneVanished(batch.getRootDir());
    }

    // 该根目录下之前登记过、本次磁盘上已不存在的条目
    private void pruneVanished(Path root) {
        try {
            List<String> underRoot = new ArrayList<>();
            for (CatalogEntry e : catalogStore.getAll()) {
                if (e.getMainFilePath() != null && Paths.get(e.getMainFilePath()).startsWith(root)) {
                    underRoot.add(e.getMainFilePath());
                }
            }
            int removed = catalogStore.removeIfMissing(underRoot);
            if (removed > 0) {
                log.info("scan pruned vanished entries: root={}, removed={}", root, removed);
            }
        } catch (Exception e) {
            log.warn("scan prune failed: root={}, error={}", root, e.getMessage());
        }
    }

    CatalogEntry toEntry(AppDescriptor d, Path scanRoot) {
        CatalogEntry e = new CatalogEntry();
        e.setKind(d.getKind());
        e.setName(d.getName());
        e.setFolderPath(d.getFolder().toString());
        e.setMainFilePath(d.getMainFile().toString());
        e.setInterfaceFilePath(d.getInterfaceFile() == null ? null : d.getInterfaceFile().toString());
        e.setFileSize(metadataReader.size(d.getMainFile()));
        e.setLastModified(metadataReader.lastModified(d.getMainFile()));
        if (d.getKind() == EntryKind.EXECUTABLE) {
            e.setPort(d.getPort());
            e.setAppFramework(d.getAppFramework());
            List<String> deps = metadataReader.dependencies(d.getMainFile());
            e.setDependencies(deps);
            e.setMissingDependencies(metadataReader.hasMissingDependencies(deps, d.getFolder(), scanRoot));
        }
        return e;
    }

    private void handOffPreviews(ScanBatch batch) {
        if (!batch.isAutoPreview()) {
            return;
        }
        List<PreviewItem> items = new ArrayList<>();
        for (AppDescriptor d : batch.allItems()) {
            if (d.getShortId() != null) {
                items.add(PreviewItem.of(d));
            }
        }
        try {
            int n = previewQueue.enqueue(items);
            log.info("scan batch handed to preview: batchId={}, items={}", batch.getId(), n);
        } catch (Exception e) {
            log.warn("hand off previews failed: batchId={}, error={}", batch.getId(), e.getMessage());
        }
    }

    private long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }

    public JobState snapshot() {
        return tracker.snapshot();
    }

    /**
     * 尚未执行的阶段任务数
     */
    public int queueSize() {
        return queue.size();
    }

    static final class ScanTask {
        final ScanTaskType type;
        final ScanBatch batch;

        ScanTask(ScanTaskType type, ScanBatch batch) {
            this.type = type;
            this.batch = batch;
        }
    }
}
