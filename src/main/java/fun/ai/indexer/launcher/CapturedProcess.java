package fun.ai.indexer.launcher;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 预览用的一次性进程：stdout/stderr 合并后由后台线程读入有界缓冲区
 */
public class CapturedProcess {
    private final Process process;
    private final StringBuffer output;
    private final CompletableFuture<Void> reader;

    CapturedProcess(Process process, StringBuffer output, CompletableFuture<Void> reader) {
        this.process = process;
        this.output = output;
        this.reader = reader;
    }

    public Process getProcess() {
        return process;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * 进程已退出时，给读取线程一个短暂窗口读完剩余输出
     */
    public String drainOutput() {
        if (!process.isAlive()) {
            try {
                reader.get(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception ignore) {
                // 读取超时：返回已读部分
            }
        }
        return output.toString();
    }
}
