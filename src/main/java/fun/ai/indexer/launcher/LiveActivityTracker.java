package fun.ai.indexer.launcher;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 单机单用户：记录最近一次 live 相关操作的时间（launch/open/status 都会 touch）
 */
@Component
public class LiveActivityTracker {

    /**
     * wall clock（用于展示/诊断），不要用于 idle 判定
     */
    private final AtomicLong lastActiveAtMs = new AtomicLong(System.currentTimeMillis());

    /**
     * monotonic clock（用于 idle 判定）
     */
    private final AtomicLong lastTouchNs = new AtomicLong(System.nanoTime());

    public void touch() {
        lastActiveAtMs.set(System.currentTimeMillis());
        lastTouchNs.set(System.nanoTime());
    }

    public long getLastActiveAtMs() {
        return lastActiveAtMs.get();
    }

    public long getLastTouchNs() {
        return lastTouchNs.get();
    }
}
