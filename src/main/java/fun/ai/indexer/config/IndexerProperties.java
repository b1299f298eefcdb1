package fun.ai.indexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Indexer（本地小应用目录 + 预览 + 在线启动）配置
 */
@Component
@ConfigurationProperties(prefix = "funai.indexer")
public class IndexerProperties {

    /**
     * 数据目录：catalog.json 存放于此
     */
    private String dataDir = "./data";

    /**
     * 预览图目录（文件名：{shortId 5 位补零}.png）
     */
    private String thumbnailsDir = "./data/thumbnails";

    /**
     * 被启动应用的工作目录（应用运行时产生的副作用文件都落在这里）
     */
    private String scratchDir = "./apps-debris";

    /**
     * 启动脚本的命令前缀，主文件路径会追加在末尾。例如 [python3] -> python3 /path/app.py
     */
    private List<String> interpreterCommand = new ArrayList<>(List.of("python3"));

    /**
     * 透传给子进程的 PYTHONPATH（为空则透传当前进程的 PYTHONPATH）
     */
    private String interpreterPath;

    private String executableExtension = ".py";

    private String pageExtension = ".html";

    /**
     * 扫描时跳过的目录名（依赖目录/虚拟环境）
     */
    private List<String> excludedDirs = new ArrayList<>(Arrays.asList(
            ".venv", "venv", "site-packages", "node_modules", "__pycache__", ".git"));

    /**
     * 脚本未声明端口时使用的默认端口（Flask 默认 5000）
     */
    private int defaultPort = 5000;

    /**
     * 前台启动后的等待时间（等待 server 绑定端口）
     */
    private Duration foregroundSettle = Duration.ofSeconds(5);

    /**
     * 预览截图：启动应用后的等待时间
     */
    private Duration captureSettle = Duration.ofSeconds(8);

    /**
     * 预览截图：页面打开后等待渲染的时间（可执行应用）
     */
    private Duration captureRender = Duration.ofSeconds(3);

    /**
     * 预览截图：静态页面等待渲染的时间
     */
    private Duration staticRender = Duration.ofSeconds(2);

    /**
     * terminate 之后的有界等待；超时则强制 kill
     */
    private Duration terminateGrace = Duration.ofSeconds(5);

    /**
     * 强制 kill 之后等待进程退出的时间
     */
    private Duration killWait = Duration.ofSeconds(2);

    /**
     * 静态预览服务启动后确认监听的最长等待
     */
    private Duration staticServerReadyTimeout = Duration.ofSeconds(1);

    private int screenshotWidth = 1024;

    private int screenshotHeight = 768;

    /**
     * 无操作多少分钟后自动释放前台应用与静态服务；<=0 表示禁用
     */
    private int idleStopMinutes = 0;

    private Enrichment enrichment = new Enrichment();

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getThumbnailsDir() {
        return thumbnailsDir;
    }

    public void setThumbnailsDir(String thumbnailsDir) {
        this.thumbnailsDir = thumbnailsDir;
    }

    public String getScratchDir() {
        return scratchDir;
    }

    public void setScratchDir(String scratchDir) {
        this.scratchDir = scratchDir;
    }

    public List<String> getInterpreterCommand() {
        return interpreterCommand;
    }

    public void setInterpreterCommand(List<String> interpreterCommand) {
        this.interpreterCommand = interpreterCommand;
    }

    public String getInterpreterPath() {
        return interpreterPath;
    }

    public void setInterpreterPath(String interpreterPath) {
        this.interpreterPath = interpreterPath;
    }

    public String getExecutableExtension() {
        return executableExtension;
    }

    public void setExecutableExtension(String executableExtension) {
        this.executableExtension = executableExtension;
    }

    public String getPageExtension() {
        return pageExtension;
    }

    public void setPageExtension(String pageExtension) {
        this.pageExtension = pageExtension;
    }

    public List<String> getExcludedDirs() {
        return excludedDirs;
    }

    public void setExcludedDirs(List<String> excludedDirs) {
        this.excludedDirs = excludedDirs;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    public void setDefaultPort(int defaultPort) {
        this.defaultPort = defaultPort;
    }

    public Duration getForegroundSettle() {
        return foregroundSettle;
    }

    public void setForegroundSettle(Duration foregroundSettle) {
        this.foregroundSettle = foregroundSettle;
    }

    public Duration getCaptureSettle() {
        return captureSettle;
    }

    public void setCaptureSettle(Duration captureSettle) {
        this.captureSettle = captureSettle;
    }

    public Duration getCaptureRender() {
        return captureRender;
    }

    public void setCaptureRender(Duration captureRender) {
        this.captureRender = captureRender;
    }

    public Duration getStaticRender() {
        return staticRender;
    }

    public void setStaticRender(Duration staticRender) {
        this.staticRender = staticRender;
    }

    public Duration getTerminateGrace() {
        return terminateGrace;
    }

    public void setTerminateGrace(Duration terminateGrace) {
        this.terminateGrace = terminateGrace;
    }

    public Duration getKillWait() {
        return killWait;
    }

    public void setKillWait(Duration killWait) {
        this.killWait = killWait;
    }

    public Duration getStaticServerReadyTimeout() {
        return staticServerReadyTimeout;
    }

    public void setStaticServerReadyTimeout(Duration staticServerReadyTimeout) {
        this.staticServerReadyTimeout = staticServerReadyTimeout;
    }

    public int getScreenshotWidth() {
        return screenshotWidth;
    }

    public void setScreenshotWidth(int screenshotWidth) {
        this.screenshotWidth = screenshotWidth;
    }

    public int getScreenshotHeight() {
        return screenshotHeight;
    }

    public void setScreenshotHeight(int screenshotHeight) {
        this.screenshotHeight = screenshotHeight;
    }

    public int getIdleStopMinutes() {
        return idleStopMinutes;
    }

    public void setIdleStopMinutes(int idleStopMinutes) {
        this.idleStopMinutes = idleStopMinutes;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public static class Enrichment {
        /**
         * 是否启用外部描述生成服务
         */
        private boolean enabled = false;

        /**
         * 接收 {id,name,kind,mainFilePath,folderPath} 并返回描述字段的 HTTP 地址
         */
        private String endpoint;

        private int timeoutSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }
}
