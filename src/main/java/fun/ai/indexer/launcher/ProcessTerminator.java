package fun.ai.indexer.launcher;

import fun.ai.indexer.config.IndexerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 进程终止：soft terminate -> 有界等待 -> 强制 kill（连同子进程）-> 有界等待
 */
@Component
public class ProcessTerminator {
    private static final Logger log = LoggerFactory.getLogger(ProcessTerminator.class);

    private final IndexerProperties props;

    public ProcessTerminator(IndexerProperties props) {
        this.props = props;
    }

    public TerminationOutcome terminate(Process process) {
        if (process == null || !process.isAlive()) {
            return TerminationOutcome.NOT_RUNNING;
        }
        long pid = process.pid();
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        try {
            process.destroy();
            descendants.forEach(ProcessHandle::destroy);
            if (await(process, props.getTerminateGrace())) {
                log.debug("process stopped: pid={}", pid);
                return TerminationOutcome.STOPPED;
            }

            log.warn("process did not exit within {}ms, killing: pid={}", millis(props.getTerminateGrace()), pid);
            descendants.forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            if (await(process, props.getKillWait())) {
                return TerminationOutcome.KILLED;
            }
            log.error("process still alive after kill: pid={}", pid);
            return TerminationOutcome.SURVIVED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return process.isAlive() ? TerminationOutcome.SURVIVED : TerminationOutcome.KILLED;
        }
    }

    private boolean await(Process process, Duration timeout) throws InterruptedException {
        long ms = millis(timeout);
        if (ms <= 0) {
            return !process.isAlive();
        }
        return process.waitFor(ms, TimeUnit.MILLISECONDS);
    }

    private long millis(Duration d) {
        return d == null ? 0 : d.toMillis();
    }
}
