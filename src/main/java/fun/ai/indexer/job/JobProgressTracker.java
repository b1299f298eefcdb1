package fun.ai.indexer.job;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 后台 worker 通过事件方法写入进度，轮询方通过 {@link #snapshot()} 读取。
 * 约束：completed/total 只增不减；total 已知时 completed 永远不超过 total。
 */
public class JobProgressTracker {

    private final ReentrantLock lock = new ReentrantLock();

    private int total;
    private int completed;
    private boolean totalKnown;
    private JobPhase phase = JobPhase.IDLE;
    private String currentItem;
    private final Map<String, ItemOutcome> results = new LinkedHashMap<>();
    private long startedAtMs;
    private long version;

    /**
     * 新批次开始：清空结果与计数
     *
     * @param total 已知的条目数；传 -1 表示暂未知
     */
    public void begin(JobPhase initialPhase, int total) {
        lock.lock();
        try {
            this.results.clear();
            this.completed = 0;
            this.totalKnown = total >= 0;
            this.total = Math.max(0, total);
            this.phase = initialPhase;
            this.currentItem = null;
            this.startedAtMs = System.currentTimeMillis();
            this.version++;
        } finally {
            lock.unlock();
        }
    }

    public void phase(JobPhase phase) {
        lock.lock();
        try {
            this.phase = phase;
            this.version++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 确定批次总数（只生效一次）；之后的调用被忽略
     */
    public boolean fixTotal(int total) {
        lock.lock();
        try {
            if (totalKnown) return false;
            this.total = Math.max(total, completed);
            this.totalKnown = true;
            this.version++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 运行中的批次追加条目
     */
    public void extendTotal(int more) {
        if (more <= 0) return;
        lock.lock();
        try {
            this.total += more;
            this.totalKnown = true;
            this.version++;
        } finally {
            lock.unlock();
        }
    }

    public void itemStarted(String key) {
        lock.lock();
        try {
            this.currentItem = key;
            this.version++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 记录结果但不计入 completed（例如发现阶段的 stage 任务）
     */
    public void record(String key, ItemOutcome outcome) {
        lock.lock();
        try {
            results.put(key, outcome);
            this.version++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 记录结果并 completed + 1
     */
    public void itemFinished(String key, ItemOutcome outcome) {
        lock.lock();
        try {
            results.put(key, outcome);
            if (totalKnown && completed < total) {
                completed++;
            }
            if (key != null && key.equals(currentItem)) {
                currentItem = null;
            }
            this.version++;
        } finally {
            lock.unlock();
        }
    }

    public void finish() {
        lock.lock();
        try {
            this.phase = JobPhase.IDLE;
            this.currentItem = null;
            this.version++;
        } finally {
            lock.unlock();
        }
    }

    public JobState snapshot() {
        lock.lock();
        try {
            return new JobState(total, completed, totalKnown, phase, currentItem, results, startedAtMs, version);
        } finally {
            lock.unlock();
        }
    }
}
