package fun.ai.indexer.preview;

import fun.ai.indexer.catalog.CatalogEntry;
import fun.ai.indexer.catalog.CatalogStore;
import fun.ai.indexer.catalog.EntryKind;
import fun.ai.indexer.catalog.ShortId;
import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.exception.CaptureException;
import fun.ai.indexer.launcher.AppProcessLauncher;
import fun.ai.indexer.launcher.CapturedProcess;
import fun.ai.indexer.launcher.Pause;
import fun.ai.indexer.launcher.PortAllocator;
import fun.ai.indexer.launcher.ProcessTerminator;
import fun.ai.indexer.launcher.TerminationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

/**
 * 单个条目的截图流程。
 * 可执行应用：起一个一次性进程（不进前台槽位）-> settle -> 打开页面 -> render -> 截图 -> finally 必定回收进程。
 * 静态页面：直接打开 file:// 地址截图。
 */
@Component
public class PreviewCapturer {
    private static final Logger log = LoggerFactory.getLogger(PreviewCapturer.class);

    private final AppProcessLauncher launcher;
    private final ProcessTerminator terminator;
    private final PortAllocator portAllocator;
    private final CatalogStore catalogStore;
    private final IndexerProperties props;
    private final Pause pause;

    public PreviewCapturer(AppProcessLauncher launcher,
                           ProcessTerminator terminator,
                           PortAllocator portAllocator,
                           CatalogStore catalogStore,
                           IndexerProperties props,
                           Pause pause) {
        this.launcher = launcher;
        this.terminator = terminator;
        this.portAllocator = portAllocator;
        this.catalogStore = catalogStore;
        this.props = props;
        this.pause = pause;
    }

    public Path capture(PageCapturer page, PreviewItem item) {
        if (item.getKind() == EntryKind.EXECUTABLE) {
            return captureExecutable(page, item);
        }
        return captureStatic(page, item);
    }

    Path captureExecutable(PageCapturer page, PreviewItem item) {
        Path script = item.getMainFile();
        if (script == null || !Files.isRegularFile(script)) {
            throw new CaptureException("app file not found: " + script);
        }
        if (item.getInterfaceFile() == null) {
            throw new CaptureException("no companion page recorded for app: " + script);
        }
        int port = item.getPort();
        // 端口被占用（通常是前台应用）时直接失败，不去动别人的进程
        if (!portAllocator.isFree(port)) {
            throw new CaptureException("port busy: " + port + " is already in use, skip capture");
        }
        Path target = previewFile(item);

        CapturedProcess proc = launcher.spawnForCapture(script, port);
        try {
            sleep(props.getCaptureSettle());
            if (!proc.isAlive()) {
                String output = proc.drainOutput().trim();
                throw new CaptureException("app exited before capture: exitCode=" + proc.getProcess().exitValue()
                        + ", output=" + output);
            }
            page.open("http://localhost:" + port);
            sleep(props.getCaptureRender());
            log.debug("capture page opened: shortId={}, title={}", item.getShortId(), page.title());
            page.saveScreenshot(target);
            return recordPreview(item, target);
        } finally {
            TerminationOutcome outcome = terminator.terminate(proc.getProcess());
            log.debug("capture app released: path={}, outcome={}", script, outcome);
        }
    }

    Path captureStatic(PageCapturer page, PreviewItem item) {
        Path html = item.getMainFile();
        if (html == null || !Files.isRegularFile(html)) {
            throw new CaptureException("page file not found: " + html);
        }
        Path target = previewFile(item);
        page.open(html.toAbsolutePath().toUri().toString());
        sleep(props.getStaticRender());
        page.saveScreenshot(target);
        return recordPreview(item, target);
    }

    /**
     * {thumbnailsDir}/{shortId 5 位补零}.png
     */
    Path previewFile(PreviewItem item) {
        if (item.getShortId() == null || item.getShortId().isBlank()) {
            throw new CaptureException("item has no short id: " + item.getMainFile());
        }
        return Paths.get(props.getThumbnailsDir()).toAbsolutePath().normalize()
                .resolve(ShortId.toFileStem(item.getShortId()) + ".png");
    }

    private Path recordPreview(PreviewItem item, Path target) {
        if (!Files.isRegularFile(target)) {
            throw new CaptureException("screenshot was not created: " + target);
        }
        Optional<CatalogEntry> row = catalogStore.getByPrimaryOrInterfacePath(item.getMainFile().toString());
        if (row.isPresent()) {
            catalogStore.setPreviewPath(row.get().getId(), target.toString());
        } else {
            log.warn("catalog row not found for preview: path={}, preview={}", item.getMainFile(), target);
        }
        return target;
    }

    private void sleep(Duration d) {
        try {
            pause.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptureException("capture interrupted", e);
        }
    }
}
