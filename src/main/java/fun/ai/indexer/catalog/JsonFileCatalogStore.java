package fun.ai.indexer.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fun.ai.indexer.config.IndexerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 单机版记录存储：内存中维护全部条目，每次变更后整体写回 {dataDir}/catalog.json。
 * 所有读写共用一把锁，保证 "读最大序号 -> 插入" 不会与并发插入交错。
 */
@Component
public class JsonFileCatalogStore implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileCatalogStore.class);

    static final String FILE_NAME = "catalog.json";

    private final ObjectMapper objectMapper;
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final CatalogFile state;

    public JsonFileCatalogStore(IndexerProperties props, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.file = Paths.get(props.getDataDir()).toAbsolutePath().normalize().resolve(FILE_NAME);
        this.state = load();
    }

    private CatalogFile load() {
        if (Files.notExists(file)) {
            return new CatalogFile();
        }
        try {
            CatalogFile f = objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), CatalogFile.class);
            if (f.getEntries() == null) f.setEntries(new ArrayList<>());
            if (f.getHighWater() == null) f.setHighWater(new EnumMap<>(EntryKind.class));
            log.info("catalog loaded: file={}, entries={}", file, f.getEntries().size());
            return f;
        } catch (IOException e) {
            throw new IllegalStateException("读取 catalog 失败: " + file + ", error=" + e.getMessage(), e);
        }
    }

    private void persist() {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(FILE_NAME + ".tmp");
            Files.writeString(tmp, objectMapper.writeValueAsString(state), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("写入 catalog 失败: " + file + ", error=" + e.getMessage(), e);
        }
    }

    @Override
    public CatalogEntry upsert(CatalogEntry candidate) {
        if (candidate == null || !StringUtils.hasText(candidate.getMainFilePath()) || candidate.getKind() == null) {
            throw new IllegalArgumentException("mainFilePath/kind 不能为空");
        }
        long now = System.currentTimeMillis();
        lock.lock();
        try {
            CatalogEntry existing = state.getEntries().stream()
                    .filter(e -> Objects.equals(e.getMainFilePath(), candidate.getMainFilePath())
                            && Objects.equals(e.getFolderPath(), candidate.getFolderPath()))
                    .findFirst()
                    .orElse(null);
            if (existing != null) {
                CatalogEntry before = copy(existing);
                Long stored = existing.getLastModified();
                Long current = candidate.getLastModified();
                if (stored != null && current != null && !stored.equals(current)) {
                    copyScanFields(candidate, existing);
                    log.debug("catalog entry refreshed: shortId={}, path={}", existing.getShortId(), existing.getMainFilePath());
                }
                existing.setLastScanned(now);
                try {
                    persist();
                } catch (IllegalStateException e) {
                    state.getEntries().set(state.getEntries().indexOf(existing), before);
                    throw e;
                }
                return copy(existing);
            }

            // 先在内存中分配 id/ShortId，写盘失败则整体回滚，内存与文件保持一致
            EntryKind kind = candidate.getKind();
            long prevLastId = state.getLastId();
            Long prevHighWater = state.getHighWater().get(kind);
            CatalogEntry created = copy(candidate);
            long id = prevLastId + 1;
            state.setLastId(id);
            created.setId(id);
            created.setShortId(allocate(kind).display());
            created.setPreviewPath(null);
            created.setCreatedAt(now);
            created.setLastScanned(now);
            state.getEntries().add(created);
            try {
                persist();
            } catch (IllegalStateException e) {
                state.getEntries().remove(state.getEntries().size() - 1);
                state.setLastId(prevLastId);
                restoreHighWater(kind, prevHighWater);
                log.warn("catalog entry not saved, rolled back: path={}, error={}", created.getMainFilePath(), e.getMessage());
                throw e;
            }
            log.info("catalog entry created: id={}, shortId={}, path={}", created.getId(), created.getShortId(), created.getMainFilePath());
            return copy(created);
        } finally {
            lock.unlock();
        }
    }

    private void copyScanFields(CatalogEntry from, CatalogEntry to) {
        to.setKind(from.getKind());
        to.setName(from.getName());
        to.setInterfaceFilePath(from.getInterfaceFilePath());
        to.setPort(from.getPort());
        to.setAppFramework(from.getAppFramework());
        to.setFileSize(from.getFileSize());
        to.setLastModified(from.getLastModified());
        to.setDependencies(from.getDependencies() == null ? new ArrayList<>() : new ArrayList<>(from.getDependencies()));
        to.setMissingDependencies(from.isMissingDependencies());
    }

    @Override
    public List<CatalogEntry> getAll() {
        lock.lock();
        try {
            return state.getEntries().stream()
                    .sorted(Comparator.comparing(CatalogEntry::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
                            .thenComparing(CatalogEntry::getId))
                    .map(this::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CatalogEntry> findById(long id) {
        return findFirst(e -> e.getId() != null && e.getId() == id);
    }

    @Override
    public Optional<CatalogEntry> findByShortId(String shortId) {
        if (!StringUtils.hasText(shortId)) return Optional.empty();
        String s = shortId.trim();
        return findFirst(e -> s.equalsIgnoreCase(e.getShortId()));
    }

    @Override
    public Optional<CatalogEntry> getByPrimaryOrInterfacePath(String path) {
        if (!StringUtils.hasText(path)) return Optional.empty();
        return findFirst(e -> path.equals(e.getInterfaceFilePath()) || path.equals(e.getMainFilePath()));
    }

    private Optional<CatalogEntry> findFirst(Predicate<CatalogEntry> p) {
        lock.lock();
        try {
            return state.getEntries().stream().filter(p).findFirst().map(this::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean setPreviewPath(long id, String previewPath) {
        return mutate(id, e -> e.setPreviewPath(previewPath));
    }

    @Override
    public boolean clearPreviewPath(long id) {
        return mutate(id, e -> e.setPreviewPath(null));
    }

    @Override
    public ShortId nextShortId(EntryKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind 不能为空");
        }
        lock.lock();
        try {
            Long prevHighWater = state.getHighWater().get(kind);
            ShortId next = allocate(kind);
            try {
                persist();
            } catch (IllegalStateException e) {
                restoreHighWater(kind, prevHighWater);
                throw e;
            }
            return next;
        } finally {
            lock.unlock();
        }
    }

    // 调用方持有锁；只修改内存中的高水位
    private ShortId allocate(EntryKind kind) {
        List<String> ids = state.getEntries().stream()
                .filter(e -> e.getKind() == kind)
                .map(CatalogEntry::getShortId)
                .collect(Collectors.toList());
        long hw = state.getHighWater().getOrDefault(kind, 0L);
        ShortId next = IdentifierAllocator.next(kind, ids, hw);
        state.getHighWater().put(kind, next.getNumber());
        return next;
    }

    private void restoreHighWater(EntryKind kind, Long previous) {
        if (previous == null) {
            state.getHighWater().remove(kind);
        } else {
            state.getHighWater().put(kind, previous);
        }
    }

    @Override
    public int removeIfMissing() {
        return removeWhere(e -> !StringUtils.hasText(e.getMainFilePath()) || Files.notExists(Paths.get(e.getMainFilePath())));
    }

    @Override
    public int removeIfMissing(Collection<String> mainFilePaths) {
        if (mainFilePaths == null || mainFilePaths.isEmpty()) {
            return 0;
        }
        Set<String> targets = new HashSet<>(mainFilePaths);
        return removeWhere(e -> e.getMainFilePath() != null
                && targets.contains(e.getMainFilePath())
                && Files.notExists(Paths.get(e.getMainFilePath())));
    }

    @Override
    public int removeByFolder(String folderPath) {
        if (!StringUtils.hasText(folderPath)) {
            throw new IllegalArgumentException("folderPath 不能为空");
        }
        return removeWhere(e -> folderPath.equals(e.getFolderPath()));
    }

    @Override
    public boolean removeById(long id) {
        return removeWhere(e -> e.getId() != null && e.getId() == id) > 0;
    }

    @Override
    public int removeAll() {
        return removeWhere(e -> true);
    }

    @Override
    public boolean updateDescription(long id, String description) {
        return mutate(id, e -> e.setDescription(description));
    }

    private int removeWhere(Predicate<CatalogEntry> p) {
        List<String> previews = new ArrayList<>();
        int removed = 0;
        lock.lock();
        try {
            Iterator<CatalogEntry> it = state.getEntries().iterator();
            while (it.hasNext()) {
                CatalogEntry e = it.next();
                if (!p.test(e)) continue;
                if (StringUtils.hasText(e.getPreviewPath())) {
                    previews.add(e.getPreviewPath());
                }
                it.remove();
                removed++;
            }
            if (removed > 0) {
                persist();
            }
        } finally {
            lock.unlock();
        }
        for (String preview : previews) {
            try {
                Files.deleteIfExists(Paths.get(preview));
            } catch (Exception ex) {
                log.warn("delete preview failed: path={}, error={}", preview, ex.getMessage());
            }
        }
        if (removed > 0) {
            log.info("catalog entries removed: count={}", removed);
        }
        return removed;
    }

    @Override
    public Optional<Boolean> toggleFavourite(long id) {
        lock.lock();
        try {
            for (CatalogEntry e : state.getEntries()) {
                if (e.getId() != null && e.getId() == id) {
                    e.setFavourite(!e.isFavourite());
                    persist();
                    return Optional.of(e.isFavourite());
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean markEnriched(long id, EnrichmentData data) {
        if (data == null) return false;
        return mutate(id, e -> {
            e.setDescription(data.getDescription());
            e.setShortDescription(data.getShortDescription());
            e.setTechStack(data.getTechStack());
            e.setTags(data.getTags() == null ? new ArrayList<>() : new ArrayList<>(data.getTags()));
            e.setCategory(data.getCategory());
            e.setEnriched(true);
        });
    }

    private boolean mutate(long id, Consumer<CatalogEntry> change) {
        lock.lock();
        try {
            for (CatalogEntry e : state.getEntries()) {
                if (e.getId() != null && e.getId() == id) {
                    change.accept(e);
                    persist();
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    private CatalogEntry copy(CatalogEntry e) {
        return objectMapper.convertValue(e, CatalogEntry.class);
    }
}
