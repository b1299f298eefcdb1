package fun.ai.indexer.job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 进度快照（不可变）。轮询接口只会拿到它，不会看到写入中的中间状态。
 */
public final class JobState {
    private final int total;
    private final int completed;
    private final boolean totalKnown;
    private final JobPhase phase;
    private final String currentItem;
    private final Map<String, ItemOutcome> results;
    private final long startedAtMs;
    private final long version;

    JobState(int total, int completed, boolean totalKnown, JobPhase phase, String currentItem,
             Map<String, ItemOutcome> results, long startedAtMs, long version) {
        this.total = total;
        this.completed = completed;
        this.totalKnown = totalKnown;
        this.phase = phase;
        this.currentItem = currentItem;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.startedAtMs = startedAtMs;
        this.version = version;
    }

    public int getTotal() {
        return total;
    }

    public int getCompleted() {
        return completed;
    }

    public boolean isTotalKnown() {
        return totalKnown;
    }

    public JobPhase getPhase() {
        return phase;
    }

    public String getCurrentItem() {
        return currentItem;
    }

    /**
     * 按完成顺序排列
     */
    public Map<String, ItemOutcome> getResults() {
        return results;
    }

    public long getStartedAtMs() {
        return startedAtMs;
    }

    /**
     * 每次状态变化 +1，用于推送端判断是否有更新
     */
    public long getVersion() {
        return version;
    }

    public boolean isActive() {
        return phase != JobPhase.IDLE;
    }

    /**
     * total 未知（发现任务的前两个阶段）时为 0
     */
    public double progressPercentage() {
        if (!totalKnown || total <= 0) return 0d;
        return Math.min(100d, completed * 100d / total);
    }

    public int remaining() {
        return Math.max(0, total - completed);
    }

    /**
     * 成功条目的平均耗时；没有成功条目时返回 -1
     */
    public long averageSuccessMillis() {
        long sum = 0;
        int n = 0;
        for (ItemOutcome o : results.values()) {
            if (o.isSuccess()) {
                sum += o.getDurationMs();
                n++;
            }
        }
        return n == 0 ? -1 : sum / n;
    }

    /**
     * 最近的失败（新的在后），最多 limit 条
     */
    public List<Map.Entry<String, ItemOutcome>> recentFailures(int limit) {
        List<Map.Entry<String, ItemOutcome>> failures = new ArrayList<>();
        for (Map.Entry<String, ItemOutcome> e : results.entrySet()) {
            if (!e.getValue().isSuccess()) {
                failures.add(e);
            }
        }
        int from = Math.max(0, failures.size() - Math.max(0, limit));
        return new ArrayList<>(failures.subList(from, failures.size()));
    }
}
