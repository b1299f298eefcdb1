package fun.ai.indexer.launcher;

import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.service.AppIndexerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时回收：无 live 操作超过 idle-stop-minutes 时释放前台应用与全部静态服务
 */
@Component
public class LiveIdleReaper {
    private static final Logger log = LoggerFactory.getLogger(LiveIdleReaper.class);

    private final LiveActivityTracker tracker;
    private final ForegroundSupervisor supervisor;
    private final StaticServerRegistry staticServers;
    private final AppIndexerService indexerService;
    private final IndexerProperties props;

    public LiveIdleReaper(LiveActivityTracker tracker,
                          ForegroundSupervisor supervisor,
                          StaticServerRegistry staticServers,
                          AppIndexerService indexerService,
                          IndexerProperties props) {
        this.tracker = tracker;
        this.supervisor = supervisor;
        this.staticServers = staticServers;
        this.indexerService = indexerService;
        this.props = props;
    }

    @Scheduled(fixedDelay = 60_000L)
    public void sweep() {
        int stopMin = props.getIdleStopMinutes();
        // 约定：<=0 表示禁用
        if (stopMin <= 0) return;
        if (supervisor.status().isEmpty() && staticServers.snapshot().isEmpty()) return;

        // idle 判定使用 monotonic clock（nanoTime），避免系统时间跳变导致误回收
        long idleNs = System.nanoTime() - tracker.getLastTouchNs();
        long thresholdNs = stopMin * 60_000_000_000L;
        if (idleNs < thresholdNs) return;

        long idleMs = idleNs / 1_000_000L;
        try {
            int stopped = indexerService.freeAllResources().getStoppedCount();
            log.info("idle reaper: live resources released: stopped={}, idleMs={}, thresholdMs={}",
                    stopped, idleMs, thresholdNs / 1_000_000L);
        } catch (Exception ex) {
            log.warn("idle reaper failed: idleMs={}, error={}", idleMs, ex.getMessage());
        }
    }
}
