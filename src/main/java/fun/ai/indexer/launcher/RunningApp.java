package fun.ai.indexer.launcher;

import java.nio.file.Path;

/**
 * 当前前台应用（全局至多一个）
 */
public final class RunningApp {
    private final Process process;
    private final Path scriptPath;
    private final int port;
    private final String url;
    private final long startedAtMs;

    public RunningApp(Process process, Path scriptPath, int port, String url) {
        this.process = process;
        this.scriptPath = scriptPath;
        this.port = port;
        this.url = url;
        this.startedAtMs = System.currentTimeMillis();
    }

    public Process getProcess() {
        return process;
    }

    public Path getScriptPath() {
        return scriptPath;
    }

    public int getPort() {
        return port;
    }

    public String getUrl() {
        return url;
    }

    public long getStartedAtMs() {
        return startedAtMs;
    }

    public boolean isAlive() {
        return process != null && process.isAlive();
    }
}
