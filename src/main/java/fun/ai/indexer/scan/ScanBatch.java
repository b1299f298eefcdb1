package fun.ai.indexer.scan;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 一次扫描请求；阶段之间的中间结果保存在这里
 */
public class ScanBatch {
    private final long id;
    private final Path rootDir;
    private final boolean autoPreview;
    private final CountDownLatch done = new CountDownLatch(1);

    private volatile List<AppDescriptor> executables = Collections.emptyList();
    private volatile List<AppDescriptor> pages = Collections.emptyList();

    public ScanBatch(long id, Path rootDir, boolean autoPreview) {
        this.id = id;
        this.rootDir = rootDir;
        this.autoPreview = autoPreview;
    }

    public long getId() {
        return id;
    }

    public Path getRootDir() {
        return rootDir;
    }

    public boolean isAutoPreview() {
        return autoPreview;
    }

    public List<AppDescriptor> getExecutables() {
        return executables;
    }

    void setExecutables(List<AppDescriptor> executables) {
        this.executables = Collections.unmodifiableList(new ArrayList<>(executables));
    }

    public List<AppDescriptor> getPages() {
        return pages;
    }

    void setPages(List<AppDescriptor> pages) {
        this.pages = Collections.unmodifiableList(new ArrayList<>(pages));
    }

    /**
     * 可执行应用在前，静态页面在后
     */
    public List<AppDescriptor> allItems() {
        List<AppDescriptor> all = new ArrayList<>(executables);
        all.addAll(pages);
        return all;
    }

    void markDone() {
        done.countDown();
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    public boolean awaitDone(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 进度结果表中阶段任务的 key
     */
    String taskKey(ScanTaskType type) {
        return type.name().toLowerCase() + ":" + rootDir;
    }
}
