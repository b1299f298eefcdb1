package fun.ai.indexer.launcher;

import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.exception.AppLaunchException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 以子进程方式启动小应用脚本。
 * 环境变量只保留 PATH / PYTHONPATH / HOME / USER / PORT，工作目录固定为 scratch 目录。
 */
@Component
public class AppProcessLauncher {
    private static final Logger log = LoggerFactory.getLogger(AppProcessLauncher.class);

    static final int OUTPUT_LIMIT = 32_000;

    // Small, shared pool for reading capture-process output without blocking the worker.
    private final ExecutorService ioPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "app-io");
        t.setDaemon(true);
        return t;
    });

    private final IndexerProperties props;

    public AppProcessLauncher(IndexerProperties props) {
        this.props = props;
    }

    /**
     * 前台进程：输出直接丢弃
     */
    public Process spawnForeground(Path script, int port) {
        ProcessBuilder pb = prepare(script, port);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process p = start(pb, script);
        closeStdin(p);
        log.info("app started: pid={}, path={}, port={}", p.pid(), script, port);
        return p;
    }

    /**
     * 预览进程：合并输出并保留前 32k 字符，用于启动即退出时的诊断
     */
    public CapturedProcess spawnForCapture(Path script, int port) {
        ProcessBuilder pb = prepare(script, port);
        pb.redirectErrorStream(true);
        Process p = start(pb, script);
        closeStdin(p);

        StringBuffer out = new StringBuffer();
        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> {
            try (BufferedReader r = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = r.readLine()) != null) {
                    // keep reading to avoid blocking the child on a full pipe
                    if (out.length() < OUTPUT_LIMIT) {
                        out.append(line).append('\n');
                    }
                }
            } catch (IOException ignore) {
                // stream closed when the process is torn down
            }
        }, ioPool);
        log.debug("capture app started: pid={}, path={}, port={}", p.pid(), script, port);
        return new CapturedProcess(p, out, reader);
    }

    private ProcessBuilder prepare(Path script, int port) {
        if (ioPool.isShutdown()) {
            throw new AppLaunchException("launcher is shut down");
        }
        if (script == null || !Files.isRegularFile(script)) {
            throw new AppLaunchException("app file not found: " + script);
        }
        List<String> prefix = props.getInterpreterCommand();
        if (prefix == null || prefix.isEmpty()) {
            throw new AppLaunchException("interpreter-command 未配置");
        }
        List<String> command = new ArrayList<>(prefix);
        command.add(script.toAbsolutePath().toString());

        Path scratch = Paths.get(props.getScratchDir()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(scratch);
        } catch (IOException e) {
            throw new AppLaunchException("create scratch dir failed: " + scratch, e);
        }

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(scratch.toFile());
        buildEnvironment(pb.environment(), port);
        return pb;
    }

    void buildEnvironment(Map<String, String> env, int port) {
        env.clear();
        putIfText(env, "PATH", System.getenv("PATH"));
        String pythonPath = StringUtils.hasText(props.getInterpreterPath())
                ? props.getInterpreterPath()
                : System.getenv("PYTHONPATH");
        putIfText(env, "PYTHONPATH", pythonPath);
        putIfText(env, "HOME", System.getenv("HOME"));
        putIfText(env, "USER", System.getenv("USER"));
        env.put("PORT", String.valueOf(port));
        env.put("FLASK_DEBUG", "0");
    }

    private void putIfText(Map<String, String> env, String key, String value) {
        if (StringUtils.hasText(value)) {
            env.put(key, value);
        }
    }

    private Process start(ProcessBuilder pb, Path script) {
        try {
            return pb.start();
        } catch (IOException e) {
            log.error("spawn app failed: path={}, cmd={}, error={}", script, pb.command(), e.getMessage());
            throw new AppLaunchException("spawn failed: " + e.getMessage(), e);
        }
    }

    /**
     * 容器关闭时停止输出读取线程；之后不再接受新的启动
     */
    @PreDestroy
    public void shutdown() {
        ioPool.shutdownNow();
    }

    private void closeStdin(Process p) {
        try {
            p.getOutputStream().close();
        } catch (IOException ignore) {
            // child may already be gone
        }
    }
}
