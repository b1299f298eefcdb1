package fun.ai.indexer.launcher;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * 本机端口分配
 */
@Component
public class PortAllocator {

    /**
     * 绑定 0 端口，读出系统分配的临时端口后立即释放。资源耗尽时直接抛出，不重试。
     */
    public int allocate() {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress("127.0.0.1", 0));
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("无法分配本地端口: " + e.getMessage(), e);
        }
    }

    public boolean isFree(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress("0.0.0.0", port));
            return true;
        } catch (IOException ignore) {
            return false;
        }
    }
}
