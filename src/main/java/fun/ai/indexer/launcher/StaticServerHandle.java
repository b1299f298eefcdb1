package fun.ai.indexer.launcher;

import com.sun.net.httpserver.HttpServer;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

/**
 * 一个静态页面对应的本地文件服务
 */
public final class StaticServerHandle {
    private final Path target;
    private final int port;
    private final HttpServer server;
    private final ExecutorService executor;
    private final long startedAtMs;

    StaticServerHandle(Path target, int port, HttpServer server, ExecutorService executor) {
        this.target = target;
        this.port = port;
        this.server = server;
        this.executor = executor;
        this.startedAtMs = System.currentTimeMillis();
    }

    public Path getTarget() {
        return target;
    }

    public int getPort() {
        return port;
    }

    public String getUrl() {
        return "http://localhost:" + port + "/";
    }

    public long getStartedAtMs() {
        return startedAtMs;
    }

    HttpServer getServer() {
        return server;
    }

    ExecutorService getExecutor() {
        return executor;
    }

    boolean isRunning() {
        return !executor.isShutdown();
    }
}
