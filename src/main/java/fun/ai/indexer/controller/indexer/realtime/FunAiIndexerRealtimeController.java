package fun.ai.indexer.controller.indexer.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.indexer.common.Result;
import fun.ai.indexer.scan.DiscoveryJobQueue;
import fun.ai.indexer.preview.PreviewCaptureJobQueue;
import fun.ai.indexer.service.AppIndexerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@RestController
@RequestMapping("/api/indexer/realtime")
@Tag(name = "Fun AI Indexer 实时通道", description = "SSE 推送扫描/预览进度，替代前端轮询")
public class FunAiIndexerRealtimeController {
    private static final Logger log = LoggerFactory.getLogger(FunAiIndexerRealtimeController.class);
    private static final AtomicInteger SEQ = new AtomicInteger();

    private final AppIndexerService indexerService;
    private final DiscoveryJobQueue discoveryQueue;
    private final PreviewCaptureJobQueue previewQueue;
    private final ObjectMapper objectMapper;

    public FunAiIndexerRealtimeController(AppIndexerService indexerService,
                                          DiscoveryJobQueue discoveryQueue,
                                          PreviewCaptureJobQueue previewQueue,
                                          ObjectMapper objectMapper) {
        this.indexerService = indexerService;
        this.discoveryQueue = discoveryQueue;
        this.previewQueue = previewQueue;
        this.objectMapper = objectMapper;
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
            summary = "SSE：推送扫描/预览进度",
            description = "事件：scan（同 /scan/progress）、preview（同 /preview/progress）、error。仅在进度变化时推送。"
    )
    public ResponseEntity<SseEmitter> events() {
        // 不设置超时（由前端主动断开/重连）
        SseEmitter emitter = new SseEmitter(0L);
        AtomicBoolean closed = new AtomicBoolean(false);

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("indexer-sse-" + SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        AtomicLong lastScanVersion = new AtomicLong(-1L);
        AtomicLong lastPreviewVersion = new AtomicLong(-1L);
        AtomicLong lastKeepAliveMs = new AtomicLong(System.currentTimeMillis());

        Runnable tick = () -> {
            if (closed.get()) return;
            try {
                long now = System.currentTimeMillis();

                // tracker 每次变更都会递增 version：只在变化时推送
                long scanVersion = discoveryQueue.snapshot().getVersion();
                if (scanVersion != lastScanVersion.get()) {
                    lastScanVersion.set(scanVersion);
                    String json = objectMapper.writeValueAsString(Result.success(indexerService.scanProgress()));
                    emitter.send(SseEmitter.event().name("scan").data(json, MediaType.APPLICATION_JSON));
                }

                long previewVersion = previewQueue.snapshot().getVersion();
                if (previewVersion != lastPreviewVersion.get()) {
                    lastPreviewVersion.set(previewVersion);
                    String json = objectMapper.writeValueAsString(Result.success(indexerService.previewProgress()));
                    emitter.send(SseEmitter.event().name("preview").data(json, MediaType.APPLICATION_JSON));
                }

                // keep-alive：SSE comment，EventSource 不会触发 message 事件
                if (now - lastKeepAliveMs.get() >= 25_000L) {
                    lastKeepAliveMs.set(now);
                    emitter.send(":" + now + "\n\n");
                }
            } catch (Exception e) {
                try {
                    emitter.send(SseEmitter.event().name("error").data("events error: " + e.getMessage(), MediaType.TEXT_PLAIN));
                } catch (Exception sendEx) {
                    log.debug("sse error event not delivered: {}", sendEx.getMessage());
                }
                safeClose(emitter, scheduler, closed);
            }
        };

        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(tick, 0L, 2000L, TimeUnit.MILLISECONDS);

        emitter.onCompletion(() -> safeClose(emitter, scheduler, closed));
        emitter.onTimeout(() -> safeClose(emitter, scheduler, closed));
        emitter.onError((ex) -> safeClose(emitter, scheduler, closed));

        // 兜底：emitter 已关闭时取消定时任务
        scheduler.scheduleAtFixedRate(() -> {
            if (closed.get()) {
                future.cancel(true);
            }
        }, 5, 5, TimeUnit.SECONDS);

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.CACHE_CONTROL, "no-cache");
        headers.add("X-Accel-Buffering", "no");
        return ResponseEntity.ok().headers(headers).body(emitter);
    }

    private void safeClose(SseEmitter emitter, ScheduledExecutorService scheduler, AtomicBoolean closed) {
        if (!closed.compareAndSet(false, true)) return;
        try {
            emitter.complete();
        } catch (Exception e) {
            log.debug("sse complete failed: {}", e.getMessage());
        }
        scheduler.shutdownNow();
    }
}
