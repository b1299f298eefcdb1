package fun.ai.indexer.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.indexer.config.IndexerProperties;
import fun.ai.indexer.support.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileCatalogStoreTest {

    @TempDir
    Path tmp;

    private IndexerProperties props;
    private JsonFileCatalogStore store;

    @BeforeEach
    void setUp() {
        props = TestSupport.props(tmp);
        store = new JsonFileCatalogStore(props, new ObjectMapper());
    }

    private CatalogEntry candidate(EntryKind kind, Path main, long mtime) {
        CatalogEntry e = new CatalogEntry();
        e.setKind(kind);
        e.setName(main.getFileName().toString());
        e.setFolderPath(main.getParent().toString());
        e.setMainFilePath(main.toString());
        e.setInterfaceFilePath(kind == EntryKind.STATIC ? main.toString() : null);
        e.setLastModified(mtime);
        e.setFileSize(10L);
        return e;
    }

    @Test
    void testUpsertAssignsPerKindShortIds() {
        CatalogEntry a = store.upsert(candidate(EntryKind.EXECUTABLE, tmp.resolve("x/app.py"), 1L));
        CatalogEntry b = store.upsert(candidate(EntryKind.STATIC, tmp.resolve("y/page.html"), 1L));
        CatalogEntry a2 = store.upsert(candidate(EntryKind.EXECUTABLE, tmp.resolve("z/server.py"), 1L));

        assertEquals("A001", a.getShortId());
        assertEquals("B001", b.getShortId());
        assertEquals("A002", a2.getShortId());
        assertNotEquals(a.getId(), b.getId());
        assertNotNull(a.getCreatedAt());
    }

    @Test
    void testRescanKeepsIdentityAndUserFields() {
        Path main = tmp.resolve("x/app.py");
        CatalogEntry first = store.upsert(candidate(EntryKind.EXECUTABLE, main, 1L));
        store.setPreviewPath(first.getId(), "/tmp/A00001.png");
        store.updateDescription(first.getId(), "my notes");

        // mtime 未变：只更新 lastScanned
        CatalogEntry same = candidate(EntryKind.EXECUTABLE, main, 1L);
        same.setName("Renamed");
        CatalogEntry second = store.upsert(same);
        assertEquals(first.getId(), second.getId());
        assertEquals("A001", second.getShortId());
        assertEquals(first.getName(), second.getName());

        // mtime 变化：刷新扫描字段，保留 id / shortId / 预览 / 描述
        CatalogEntry changed = candidate(EntryKind.EXECUTABLE, main, 2L);
        changed.setName("Renamed");
        changed.setPort(8080);
        CatalogEntry third = store.upsert(changed);
        assertEquals(first.getId(), third.getId());
        assertEquals("A001", third.getShortId());
        assertEquals("Renamed", third.getName());
        assertEquals(8080, third.getPort());
        assertEquals("/tmp/A00001.png", third.getPreviewPath());
        assertEquals("my notes", third.getDescription());
        assertEquals(1, store.getAll().size());
    }

    @Test
    void testShortIdsAreNotReusedAfterPurge() {
        store.upsert(candidate(EntryKind.EXECUTABLE, tmp.resolve("a/one.py"), 1L));
        store.upsert(candidate(EntryKind.EXECUTABLE, tmp.resolve("b/two.py"), 1L));
        assertEquals(2, store.removeAll());

        CatalogEntry next = store.upsert(candidate(EntryKind.EXECUTABLE, tmp.resolve("c/three.py"), 1L));
        assertEquals("A003", next.getShortId());
    }

    @Test
    void testStateSurvivesReload() {
        CatalogEntry a = store.upsert(candidate(EntryKind.STATIC, tmp.resolve("p/index.html"), 5L));
        store.toggleFavourite(a.getId());
        assertTrue(Files.isRegularFile(tmp.resolve("data").resolve(JsonFileCatalogStore.FILE_NAME)));

        JsonFileCatalogStore reloaded = new JsonFileCatalogStore(props, new ObjectMapper());
        CatalogEntry back = reloaded.findByShortId("b001").orElseThrow();
        assertEquals(a.getId(), back.getId());
        assertTrue(back.isFavourite());

        CatalogEntry b = reloaded.upsert(candidate(EntryKind.STATIC, tmp.resolve("q/index.html"), 5L));
        assertEquals("B002", b.getShortId());
        assertTrue(b.getId() > a.getId());
    }

    @Test
    void testRemoveIfMissingDeletesRowAndPreview() throws Exception {
        Path kept = TestSupport.write(tmp.resolve("apps/kept.html"), "<html></html>");
        Path gone = tmp.resolve("apps/gone.html");
        CatalogEntry keptEntry = store.upsert(candidate(EntryKind.STATIC, kept, 1L));
        CatalogEntry goneEntry = store.upsert(candidate(EntryKind.STATIC, gone, 1L));
        Path preview = TestSupport.write(tmp.resolve("thumbs/B00002.png"), "png");
        store.setPreviewPath(goneEntry.getId(), preview.toString());

        assertEquals(1, store.removeIfMissing());
        assertTrue(store.findById(keptEntry.getId()).isPresent());
        assertFalse(store.findById(goneEntry.getId()).isPresent());
        assertFalse(Files.exists(preview));
    }

    @Test
    void testFailedWriteLeavesNoNewEntryBehind() throws Exception {
        Path main = tmp.resolve("apps/todo/app.py");
        // 临时文件位置被目录占住，写盘必然失败
        Path blocker = Files.createDirectories(tmp.resolve("data").resolve(JsonFileCatalogStore.FILE_NAME + ".tmp"));

        assertThrows(IllegalStateException.class, () -> store.upsert(candidate(EntryKind.EXECUTABLE, main, 1L)));
        assertTrue(store.getAll().isEmpty());

        Files.delete(blocker);
        CatalogEntry saved = store.upsert(candidate(EntryKind.EXECUTABLE, main, 1L));
        assertEquals("A001", saved.getShortId());
        assertEquals(1L, saved.getId());
        assertEquals(1, new JsonFileCatalogStore(props, new ObjectMapper()).getAll().size());
    }

    @Test
    void testRemoveIfMissingOnlyChecksGivenPaths() {
        Path a = tmp.resolve("apps/a.html");
        Path b = tmp.resolve("apps/b.html");
        CatalogEntry ea = store.upsert(candidate(EntryKind.STATIC, a, 1L));
        CatalogEntry eb = store.upsert(candidate(EntryKind.STATIC, b, 1L));

        assertEquals(1, store.removeIfMissing(List.of(a.toString())));
        assertFalse(store.findById(ea.getId()).isPresent());
        assertTrue(store.findById(eb.getId()).isPresent());
        assertEquals(0, store.removeIfMissing(List.of()));
    }

    @Test
    void testRemoveByFolderAndLookupByInterfacePath() {
        Path app = tmp.resolve("shared/app.py");
        CatalogEntry exec = candidate(EntryKind.EXECUTABLE, app, 1L);
        exec.setInterfaceFilePath(tmp.resolve("shared/templates/index.html").toString());
        CatalogEntry stored = store.upsert(exec);
        store.upsert(candidate(EntryKind.STATIC, tmp.resolve("other/page.html"), 1L));

        assertEquals(stored.getId(),
                store.getByPrimaryOrInterfacePath(tmp.resolve("shared/templates/index.html").toString()).orElseThrow().getId());
        assertEquals(1, store.removeByFolder(tmp.resolve("shared").toString()));
        assertEquals(1, store.getAll().size());
    }

    @Test
    void testMarkEnriched() {
        CatalogEntry a = store.upsert(candidate(EntryKind.EXECUTABLE, tmp.resolve("x/app.py"), 1L));
        EnrichmentData data = new EnrichmentData();
        data.setDescription("A todo list");
        data.setCategory("productivity");
        data.setTags(Arrays.asList("todo", "flask"));

        assertTrue(store.markEnriched(a.getId(), data));
        CatalogEntry back = store.findById(a.getId()).orElseThrow();
        assertTrue(back.isEnriched());
        assertEquals("productivity", back.getCategory());
        assertEquals(Arrays.asList("todo", "flask"), back.getTags());
        assertFalse(store.markEnriched(999L, data));
    }

    @Test
    void testConcurrentUpsertsGetDistinctShortIds() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<CatalogEntry>> jobs = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                Path main = tmp.resolve("c" + i).resolve("app.py");
                jobs.add(() -> store.upsert(candidate(EntryKind.EXECUTABLE, main, 1L)));
            }
            Set<String> shortIds = new HashSet<>();
            for (Future<CatalogEntry> f : pool.invokeAll(jobs)) {
                shortIds.add(f.get().getShortId());
            }
            assertEquals(40, shortIds.size());
            assertTrue(shortIds.contains("A001"));
            assertTrue(shortIds.contains("A040"));
        } finally {
            pool.shutdownNow();
        }
    }
}
