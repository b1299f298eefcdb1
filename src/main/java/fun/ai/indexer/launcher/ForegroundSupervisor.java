package fun.ai.indexer.launcher;

import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.exception.AppLaunchException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 前台应用槽位：同一时间只允许一个已启动的应用（它们可能都想绑定同一个默认端口）。
 * 替换是 "先彻底停掉旧的，再启动新的"，launch/stop 之间由锁串行化；
 * 槽位本身是 volatile 引用，只在锁内整体替换，status() 不加锁，只会看到旧进程或新进程。
 * launch/stop 可能阻塞到 terminate-grace + kill-wait，调用方需在后台线程执行。
 */
@Component
public class ForegroundSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ForegroundSupervisor.class);

    private final AppProcessLauncher launcher;
    private final ProcessTerminator terminator;
    private final IndexerProperties props;
    private final Pause pause;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile RunningApp current;

    public ForegroundSupervisor(AppProcessLauncher launcher,
                                ProcessTerminator terminator,
                                IndexerProperties props,
                                Pause pause) {
        this.launcher = launcher;
        this.terminator = terminator;
        this.props = props;
        this.pause = pause;
    }

    /**
     * 启动（或替换为）指定脚本，返回访问地址。
     * 若该脚本已经是存活的前台进程，直接复用，不重启。
     * settle 之后进程已退出（例如端口被占用）则清空槽位并抛出 {@link AppLaunchException}。
     */
    public String launch(Path scriptPath, int port) {
        if (scriptPath == null || !Files.isRegularFile(scriptPath)) {
            throw new AppLaunchException("app file not found: " + scriptPath);
        }
        Path script = scriptPath.toAbsolutePath().normalize();
        String url = "http://localhost:" + port;

        RunningApp started;
        lock.lock();
        try {
            RunningApp old = current;
            if (old != null && old.isAlive() && old.getScriptPath().equals(script) && old.getPort() == port) {
                log.info("app already running, reuse: path={}, url={}", script, old.getUrl());
                return old.getUrl();
            }
            if (old != null) {
                TerminationOutcome outcome = terminator.terminate(old.getProcess());
                log.info("previous app terminated: path={}, outcome={}", old.getScriptPath(), outcome);
            }
            Process p;
            try {
                p = launcher.spawnForeground(script, port);
            } catch (RuntimeException e) {
                current = null;
                throw e;
            }
            started = new RunningApp(p, script, port, url);
            current = started;
        } finally {
            lock.unlock();
        }

        try {
            pause.sleep(props.getForegroundSettle());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (!started.isAlive()) {
            boolean superseded;
            lock.lock();
            try {
                superseded = current != started;
                if (!superseded) {
                    current = null;
                }
            } finally {
                lock.unlock();
            }
            if (superseded) {
                throw new AppLaunchException("app was stopped or replaced during startup: " + script);
            }
            int exitCode = started.getProcess().exitValue();
            log.warn("app exited during startup: path={}, port={}, exitCode={}", script, port, exitCode);
            throw new AppLaunchException("app exited during startup (exit code " + exitCode
                    + "), port " + port + " may be in use");
        }
        return url;
    }

    /**
     * 当前前台应用；已退出的进程视为空闲
     */
    public Optional<RunningApp> status() {
        RunningApp app = current;
        if (app == null || !app.isAlive()) {
            return Optional.empty();
        }
        return Optional.of(app);
    }

    public StopResult stop() {
        lock.lock();
        try {
            RunningApp app = current;
            if (app == null) {
                return StopResult.nothingRunning();
            }
            current = null;
            TerminationOutcome outcome = terminator.terminate(app.getProcess());
            log.info("app stopped: path={}, outcome={}", app.getScriptPath(), outcome);
            return new StopResult(outcome, app.getScriptPath().toString());
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        StopResult r = stop();
        if (r.getOutcome() != TerminationOutcome.NOT_RUNNING) {
            log.info("foreground app released on shutdown: path={}, outcome={}", r.getPath(), r.getOutcome());
        }
    }
}
