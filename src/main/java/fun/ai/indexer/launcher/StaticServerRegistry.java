package fun.ai.indexer.launcher;

import com.sun.net.httpserver.HttpServer;
import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.exception.StaticServerException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 静态页面的临时文件服务注册表（按目标文件路径去重，每个服务一个线程）
 */
@Component
public class StaticServerRegistry {
    private static final Logger log = LoggerFactory.getLogger(StaticServerRegistry.class);

    private final PortAllocator portAllocator;
    private final IndexerProperties props;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Path, StaticServerHandle> servers = new HashMap<>();

    public StaticServerRegistry(PortAllocator portAllocator, IndexerProperties props) {
        this.portAllocator = portAllocator;
        this.props = props;
    }

    /**
     * 已有服务则复用其端口，否则新起一个并等待其开始监听。
     * 检查与创建在同一把锁内完成，同一目标不会被并发起两个服务。
     */
    public int getOrStart(Path targetPath) {
        if (targetPath == null || !Files.isRegularFile(targetPath)) {
            throw new StaticServerException("static page not found: " + targetPath);
        }
        Path target = targetPath.toAbsolutePath().normalize();

        lock.lock();
        try {
            StaticServerHandle existing = servers.get(target);
            if (existing != null) {
                if (existing.isRunning()) {
                    log.info("reusing static server: path={}, port={}", target, existing.getPort());
                    return existing.getPort();
                }
                servers.remove(target);
            }

            StaticServerHandle handle = start(target);
            servers.put(target, handle);
            log.info("static server started: path={}, port={}", target, handle.getPort());
            return handle.getPort();
        } finally {
            lock.unlock();
        }
    }

    private StaticServerHandle start(Path target) {
        int port = portAllocator.allocate();
        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", port), 0);
        } catch (IOException e) {
            throw new StaticServerException("bind static server failed: port=" + port + ", error=" + e.getMessage(), e);
        }
        server.createContext("/", new StaticFileHandler(target.getParent(), target));
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "static-srv-" + port);
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();

        if (!awaitListening(port, props.getStaticServerReadyTimeout())) {
            shutdown(server, executor);
            throw new StaticServerException("static server not listening: port=" + port);
        }
        return new StaticServerHandle(target, port, server, executor);
    }

    private boolean awaitListening(int port, Duration timeout) {
        long deadline = System.nanoTime() + (timeout == null ? 0 : timeout.toNanos());
        do {
            try (Socket s = new Socket()) {
                s.connect(new InetSocketAddress("127.0.0.1", port), 200);
                return true;
            } catch (IOException e) {
                try {
                    Thread.sleep(50);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        } while (System.nanoTime() < deadline);
        return false;
    }

    /**
     * 停止并移除；无论关闭是否顺利，注册表都不会留下该条目
     */
    public boolean stop(Path targetPath) {
        if (targetPath == null) return false;
        Path target = targetPath.toAbsolutePath().normalize();
        StaticServerHandle handle;
        lock.lock();
        try {
            handle = servers.remove(target);
        } finally {
            lock.unlock();
        }
        if (handle == null) return false;
        shutdown(handle.getServer(), handle.getExecutor());
        log.info("static server stopped: path={}, port={}", target, handle.getPort());
        return true;
    }

    public int stopAll() {
        List<StaticServerHandle> all;
        lock.lock();
        try {
            all = new ArrayList<>(servers.values());
            servers.clear();
        } finally {
            lock.unlock();
        }
        for (StaticServerHandle h : all) {
            shutdown(h.getServer(), h.getExecutor());
        }
        if (!all.isEmpty()) {
            log.info("static servers stopped: count={}", all.size());
        }
        return all.size();
    }

    public List<StaticServerHandle> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(servers.values());
        } finally {
            lock.unlock();
        }
    }

    private void shutdown(HttpServer server, ExecutorService executor) {
        try {
            server.stop(0);
        } catch (Exception e) {
            log.warn("static server stop failed: address={}, error={}", server.getAddress(), e.getMessage());
        }
        executor.shutdownNow();
    }

    @PreDestroy
    public void shutdownAll() {
        stopAll();
    }
}
