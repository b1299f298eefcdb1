package fun.ai.indexer.job;

/**
 * 单个任务/条目的终态结果
 */
public final class ItemOutcome {
    private final boolean success;
    private final String error;
    private final long durationMs;

    public ItemOutcome(boolean success, String error, long durationMs) {
        this.success = success;
        this.error = error;
        this.durationMs = durationMs;
    }

    public static ItemOutcome ok(long durationMs) {
        return new ItemOutcome(true, null, durationMs);
    }

    public static ItemOutcome failed(String error, long durationMs) {
        return new ItemOutcome(false, error, durationMs);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    public long getDurationMs() {
        return durationMs;
    }
}
