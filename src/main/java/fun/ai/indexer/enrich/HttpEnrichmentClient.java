package fun.ai.indexer.enrich;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.indexer.catalog.CatalogEntry;
import fun.ai.indexer.catalog.CatalogStore;
import fun.ai.indexer.catalog.EnrichmentData;
import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.exception.CatalogEntryNotFoundException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * POST {id,name,kind,mainFilePath,folderPath} 到配置的 endpoint，
 * 返回的 {description,shortDescription,techStack,tags,category} 写回目录记录。
 */
@Component
public class HttpEnrichmentClient implements EnrichmentClient {
    private static final Logger log = LoggerFactory.getLogger(HttpEnrichmentClient.class);

    private final IndexerProperties props;
    private final CatalogStore catalogStore;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "enrich-worker");
        t.setDaemon(true);
        return t;
    });

    public HttpEnrichmentClient(IndexerProperties props, CatalogStore catalogStore, ObjectMapper objectMapper) {
        this.props = props;
        this.catalogStore = catalogStore;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    }

    @Override
    public boolean enrich(long entryId) {
        IndexerProperties.Enrichment cfg = props.getEnrichment();
        if (cfg == null || !cfg.isEnabled() || !StringUtils.hasText(cfg.getEndpoint())) {
            log.info("enrichment disabled, skip: id={}", entryId);
            return false;
        }
        CatalogEntry entry = catalogStore.findById(entryId)
                .orElseThrow(() -> new CatalogEntryNotFoundException(entryId));
        executor.submit(() -> enrichNow(entry));
        return true;
    }

    boolean enrichNow(CatalogEntry entry) {
        IndexerProperties.Enrichment cfg = props.getEnrichment();
        Map<String, Object> body = new HashMap<>();
        body.put("id", entry.getId());
        body.put("name", entry.getName());
        body.put("kind", entry.getKind() == null ? null : entry.getKind().name().toLowerCase());
        body.put("mainFilePath", entry.getMainFilePath());
        body.put("folderPath", entry.getFolderPath());

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (Exception e) {
            log.warn("enrichment encode failed: id={}, error={}", entry.getId(), e.getMessage());
            return false;
        }

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(cfg.getEndpoint().trim()))
                .timeout(Duration.ofSeconds(Math.max(1, cfg.getTimeoutSeconds())))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(bytes))
                .build();

        try {
            HttpResponse<byte[]> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofByteArray());
            int code = resp.statusCode();
            if (code / 100 != 2) {
                log.warn("enrichment failed: http={}, id={}", code, entry.getId());
                return false;
            }
            EnrichmentData data = objectMapper.readValue(resp.body(), EnrichmentData.class);
            boolean saved = catalogStore.markEnriched(entry.getId(), data);
            log.info("enrichment applied: id={}, shortId={}, saved={}", entry.getId(), entry.getShortId(), saved);
            return saved;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("enrichment request failed: id={}, error={}", entry.getId(), e.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
