package fun.ai.indexer.service.impl;

import fun.ai.indexer.catalog.CatalogEntry;
import fun.ai.indexer.catalog.CatalogStore;
import fun.ai.indexer.catalog.EntryKind;
import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.enrich.EnrichmentClient;
import fun.ai.indexer.entity.response.FreeResourcesResponse;
import fun.ai.indexer.entity.response.JobErrorItem;
import fun.ai.indexer.entity.response.LiveLaunchResponse;
import fun.ai.indexer.entity.response.LiveStatusResponse;
import fun.ai.indexer.entity.response.LiveStopResponse;
import fun.ai.indexer.entity.response.PreviewProgressResponse;
import fun.ai.indexer.entity.response.PreviewStartResponse;
import fun.ai.indexer.entity.response.ScanProgressResponse;
import fun.ai.indexer.entity.response.ScanStartResponse;
import fun.ai.indexer.entity.response.StaticServerInfo;
import fun.ai.indexer.exception.CatalogEntryNotFoundException;
import fun.ai.indexer.job.ItemOutcome;
import fun.ai.indexer.job.JobState;
import fun.ai.indexer.launcher.ForegroundSupervisor;
import fun.ai.indexer.launcher.LiveActivityTracker;
import fun.ai.indexer.launcher.RunningApp;
import fun.ai.indexer.launcher.StaticServerHandle;
import fun.ai.indexer.launcher.StaticServerRegistry;
import fun.ai.indexer.launcher.StopResult;
import fun.ai.indexer.launcher.TerminationOutcome;
import fun.ai.indexer.preview.PreviewCaptureJobQueue;
import fun.ai.indexer.preview.PreviewItem;
import fun.ai.indexer.scan.DiscoveryJobQueue;
import fun.ai.indexer.scan.ScanBatch;
import fun.ai.indexer.service.AppIndexerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
public class AppIndexerServiceImpl implements AppIndexerService {
    private static final Logger log = LoggerFactory.getLogger(AppIndexerServiceImpl.class);

    static final int RECENT_ERROR_LIMIT = 5;
    static final int ERROR_TEXT_LIMIT = 100;

    private final DiscoveryJobQueue discoveryQueue;
    private final PreviewCaptureJobQueue previewQueue;
    private final ForegroundSupervisor supervisor;
    private final StaticServerRegistry staticServers;
    private final CatalogStore catalogStore;
    private final EnrichmentClient enrichmentClient;
    private final LiveActivityTracker activityTracker;
    private final IndexerProperties props;

    public AppIndexerServiceImpl(DiscoveryJobQueue discoveryQueue,
                                 PreviewCaptureJobQueue previewQueue,
                                 ForegroundSupervisor supervisor,
                                 StaticServerRegistry staticServers,
                                 CatalogStore catalogStore,
                                 EnrichmentClient enrichmentClient,
                                 LiveActivityTracker activityTracker,
                                 IndexerProperties props) {
        this.discoveryQueue = discoveryQueue;
        this.previewQueue = previewQueue;
        this.supervisor = supervisor;
        this.staticServers = staticServers;
        this.catalogStore = catalogStore;
        this.enrichmentClient = enrichmentClient;
        this.activityTracker = activityTracker;
        this.props = props;
    }

    // ---------------- scan ----------------

    @Override
    public ScanStartResponse scanStart(String rootDir, boolean autoPreview) {
        if (!StringUtils.hasText(rootDir)) {
            throw new IllegalArgumentException("rootDir 不能为空");
        }
        Path root = Paths.get(rootDir.trim()).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("不是有效目录: " + root);
        }
        ScanBatch batch = discoveryQueue.submit(root, autoPreview);
        ScanStartResponse resp = new ScanStartResponse();
        resp.setStatus("started");
        resp.setBatchId(batch.getId());
        resp.setRootDir(batch.getRootDir().toString());
        resp.setAutoPreview(autoPreview);
        return resp;
    }

    @Override
    public ScanProgressResponse scanProgress() {
        JobState s = discoveryQueue.snapshot();
        int queueSize = discoveryQueue.queueSize();
        ScanProgressResponse resp = new ScanProgressResponse();
        resp.setTotal(s.getTotal());
        resp.setCompleted(s.getCompleted());
        resp.setTotalKnown(s.isTotalKnown());
        resp.setScanning(s.isActive() || queueSize > 0);
        resp.setProgressPercentage(round(s.progressPercentage(), 1));
        resp.setPhase(s.getPhase().name().toLowerCase(Locale.ROOT));
        resp.setPhaseDescription(s.getPhase().getDescription());
        resp.setQueueSize(queueSize);
        resp.setRecentErrors(toErrors(s));
        resp.setStartedAt(s.getStartedAtMs() > 0 ? s.getStartedAtMs() : null);
        return resp;
    }

    // ---------------- preview ----------------

    @Override
    public PreviewStartResponse previewRegenerate() {
        List<PreviewItem> items = new ArrayList<>();
        for (CatalogEntry e : catalogStore.getAll()) {
            if (!hasPreviewFile(e)) {
                items.add(PreviewItem.of(e, props.getDefaultPort()));
            }
        }
        return startPreview(items);
    }

    @Override
    public PreviewStartResponse previewStart(List<Long> entryIds) {
        if (entryIds == null || entryIds.isEmpty()) {
            throw new IllegalArgumentException("entryIds 不能为空");
        }
        List<PreviewItem> items = new ArrayList<>();
        for (Long id : entryIds) {
            if (id == null) continue;
            CatalogEntry e = catalogStore.findById(id).orElseThrow(() -> new CatalogEntryNotFoundException(id));
            items.add(PreviewItem.of(e, props.getDefaultPort()));
        }
        return startPreview(items);
    }

    private PreviewStartResponse startPreview(List<PreviewItem> items) {
        int n = previewQueue.enqueue(items);
        PreviewStartResponse resp = new PreviewStartResponse();
        resp.setStatus(n > 0 ? "started" : "nothing_to_do");
        resp.setCount(n);
        return resp;
    }

    @Override
    public PreviewProgressResponse previewProgress() {
        JobState s = previewQueue.snapshot();
        PreviewProgressResponse resp = new PreviewProgressResponse();
        resp.setTotal(s.getTotal());
        resp.setCompleted(s.getCompleted());
        resp.setProcessing(previewQueue.isRunning());
        resp.setProgressPercentage(round(s.progressPercentage(), 1));
        resp.setCurrentItem(s.getCurrentItem());
        resp.setQueueSize(previewQueue.queueSize());

        long avg = s.averageSuccessMillis();
        resp.setEtaSeconds(avg < 0 ? 0L : Math.round(avg * (double) s.remaining() / 1000d));

        double perMinute = 0d;
        if (s.getStartedAtMs() > 0) {
            double elapsedSec = Math.max((System.currentTimeMillis() - s.getStartedAtMs()) / 1000d, 1d);
            perMinute = s.getCompleted() / elapsedSec * 60d;
        }
        resp.setItemsPerMinute(round(perMinute, 2));
        resp.setRecentErrors(toErrors(s));
        return resp;
    }

    // ---------------- live ----------------

    @Override
    public LiveLaunchResponse liveLaunch(Long entryId, String shortId) {
        activityTracker.touch();
        CatalogEntry entry = resolveEntry(entryId, shortId);
        Path main = Paths.get(entry.getMainFilePath());
        String url;
        if (entry.getKind() == EntryKind.EXECUTABLE) {
            int port = entry.getPort() == null ? props.getDefaultPort() : entry.getPort();
            url = supervisor.launch(main, port);
        } else {
            int port = staticServers.getOrStart(main);
            url = "http://localhost:" + port + "/";
        }
        log.info("live launched: shortId={}, kind={}, url={}", entry.getShortId(), entry.getKind(), url);
        LiveLaunchResponse resp = new LiveLaunchResponse();
        resp.setUrl(url);
        resp.setKind(entry.getKind().name().toLowerCase(Locale.ROOT));
        resp.setShortId(entry.getShortId());
        resp.setStatus("running");
        return resp;
    }

    private CatalogEntry resolveEntry(Long entryId, String shortId) {
        if (entryId != null) {
            return catalogStore.findById(entryId).orElseThrow(() -> new CatalogEntryNotFoundException(entryId));
        }
        if (StringUtils.hasText(shortId)) {
            return catalogStore.findByShortId(shortId).orElseThrow(() -> new CatalogEntryNotFoundException(shortId));
        }
        throw new IllegalArgumentException("entryId/shortId 不能同时为空");
    }

    @Override
    public LiveStopResponse liveStop() {
        activityTracker.touch();
        StopResult r = supervisor.stop();
        LiveStopResponse resp = new LiveStopResponse();
        resp.setStatus(r.getOutcome().name().toLowerCase(Locale.ROOT));
        resp.setPath(r.getPath());
        return resp;
    }

    @Override
    public LiveStatusResponse liveStatus() {
        LiveStatusResponse resp = new LiveStatusResponse();
        Optional<RunningApp> app = supervisor.status();
        resp.setRunning(app.isPresent());
        app.ifPresent(a -> {
            resp.setPath(a.getScriptPath().toString());
            resp.setUrl(a.getUrl());
            resp.setPort(a.getPort());
            resp.setPid(a.getProcess().pid());
            resp.setStartedAt(a.getStartedAtMs());
        });
        for (StaticServerHandle h : staticServers.snapshot()) {
            StaticServerInfo info = new StaticServerInfo();
            info.setPath(h.getTarget().toString());
            info.setPort(h.getPort());
            info.setUrl(h.getUrl());
            info.setStartedAt(h.getStartedAtMs());
            resp.getStaticServers().add(info);
        }
        resp.setLastActiveAt(activityTracker.getLastActiveAtMs());
        return resp;
    }

    @Override
    public FreeResourcesResponse freeAllResources() {
        int stopped = 0;
        StopResult r = supervisor.stop();
        if (r.getOutcome() != TerminationOutcome.NOT_RUNNING) {
            stopped++;
        }
        stopped += staticServers.stopAll();
        log.info("live resources freed: stoppedCount={}", stopped);
        FreeResourcesResponse resp = new FreeResourcesResponse();
        resp.setStoppedCount(stopped);
        return resp;
    }

    // ---------------- catalog ----------------

    @Override
    public List<CatalogEntry> listItems(String query, String category, Boolean favourite) {
        String q = StringUtils.hasText(query) ? query.trim().toLowerCase(Locale.ROOT) : null;
        List<CatalogEntry> out = new ArrayList<>();
        for (CatalogEntry e : catalogStore.getAll()) {
            if (e.getPreviewPath() != null && !hasPreviewFile(e)) {
                // 预览图文件已丢失：清掉引用，下次 regenerate 会重新生成
                log.warn("preview file missing, cleared: shortId={}, preview={}", e.getShortId(), e.getPreviewPath());
                catalogStore.clearPreviewPath(e.getId());
                e.setPreviewPath(null);
            }
            if (q != null && !matches(e, q)) continue;
            if (StringUtils.hasText(category) && !category.trim().equalsIgnoreCase(e.getCategory())) continue;
            if (Boolean.TRUE.equals(favourite) && !e.isFavourite()) continue;
            out.add(e);
        }
        return out;
    }

    private boolean matches(CatalogEntry e, String q) {
        return contains(e.getName(), q)
                || contains(e.getDescription(), q)
                || contains(e.getTechStack(), q)
                || (e.getTags() != null && e.getTags().stream().anyMatch(t -> contains(t, q)));
    }

    private boolean contains(String text, String lowerQuery) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerQuery);
    }

    @Override
    public CatalogEntry getItem(long id) {
        return catalogStore.findById(id).orElseThrow(() -> new CatalogEntryNotFoundException(id));
    }

    @Override
    public Path previewImage(long id) {
        CatalogEntry e = getItem(id);
        return hasPreviewFile(e) ? Paths.get(e.getPreviewPath()) : null;
    }

    @Override
    public boolean toggleFavourite(long id) {
        return catalogStore.toggleFavourite(id).orElseThrow(() -> new CatalogEntryNotFoundException(id));
    }

    @Override
    public void updateDescription(long id, String description) {
        if (!catalogStore.updateDescription(id, description)) {
            throw new CatalogEntryNotFoundException(id);
        }
    }

    @Override
    public void removeItem(long id) {
        CatalogEntry e = getItem(id);
        Path main = Paths.get(e.getMainFilePath());
        if (e.getKind() == EntryKind.STATIC) {
            staticServers.stop(main);
        } else if (supervisor.status().map(a -> a.getScriptPath().equals(main.toAbsolutePath().normalize())).orElse(false)) {
            supervisor.stop();
        }
        catalogStore.removeById(id);
    }

    @Override
    public int removeFolder(String folderPath) {
        if (!StringUtils.hasText(folderPath)) {
            throw new IllegalArgumentException("folderPath 不能为空");
        }
        return catalogStore.removeByFolder(folderPath.trim());
    }

    @Override
    public int cleanup() {
        return catalogStore.removeIfMissing();
    }

    @Override
    public int purge() {
        return catalogStore.removeAll();
    }

    @Override
    public boolean enrich(long id) {
        return enrichmentClient.enrich(id);
    }

    // ---------------- helpers ----------------

    private boolean hasPreviewFile(CatalogEntry e) {
        return StringUtils.hasText(e.getPreviewPath()) && Files.isRegularFile(Paths.get(e.getPreviewPath()));
    }

    private List<JobErrorItem> toErrors(JobState s) {
        List<JobErrorItem> errors = new ArrayList<>();
        for (Map.Entry<String, ItemOutcome> f : s.recentFailures(RECENT_ERROR_LIMIT)) {
            JobErrorItem item = new JobErrorItem();
            item.setItem(f.getKey());
            item.setError(truncate(f.getValue().getError()));
            errors.add(item);
        }
        return errors;
    }

    static String truncate(String error) {
        if (error == null) return null;
        return error.length() > ERROR_TEXT_LIMIT ? error.substring(0, ERROR_TEXT_LIMIT) + "..." : error;
    }

    private static double round(double v, int scale) {
        double f = Math.pow(10, scale);
        return Math.round(v * f) / f;
    }
}
