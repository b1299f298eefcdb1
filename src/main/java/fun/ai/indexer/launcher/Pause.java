package fun.ai.indexer.launcher;

import java.time.Duration;

/**
 * 固定等待（settle / render delay）。测试中替换为不等待的实现。
 */
@FunctionalInterface
public interface Pause {

    void sleep(Duration duration) throws InterruptedException;

    static Pause threadSleep() {
        return d -> {
            long ms = d == null ? 0 : d.toMillis();
            if (ms > 0) {
                Thread.sleep(ms);
            }
        };
    }
}
