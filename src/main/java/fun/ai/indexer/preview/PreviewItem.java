package fun.ai.indexer.preview;

import fun.ai.indexer.catalog.CatalogEntry;
import fun.ai.indexer.catalog.EntryKind;
import fun.ai.indexer.scan.AppDescriptor;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 一个预览截图任务
 */
public final class PreviewItem {
    private final Long entryId;
    private final String shortId;
    private final EntryKind kind;
    private final String name;
    private final Path mainFile;
    private final Path interfaceFile;
    private final int port;

    public PreviewItem(Long entryId, String shortId, EntryKind kind, String name, Path mainFile, Path interfaceFile, int port) {
        this.entryId = entryId;
        this.shortId = shortId;
        this.kind = kind;
        this.name = name;
        this.mainFile = mainFile;
        this.interfaceFile = interfaceFile;
        this.port = port;
    }

    public static PreviewItem of(CatalogEntry e, int defaultPort) {
        return new PreviewItem(e.getId(), e.getShortId(), e.getKind(), e.getName(),
                e.getMainFilePath() == null ? null : Paths.get(e.getMainFilePath()),
                e.getInterfaceFilePath() == null ? null : Paths.get(e.getInterfaceFilePath()),
                e.getPort() == null ? defaultPort : e.getPort());
    }

    public static PreviewItem of(AppDescriptor d) {
        return new PreviewItem(d.getEntryId(), d.getShortId(), d.getKind(), d.getName(),
                d.getMainFile(), d.getInterfaceFile(), d.getPort());
    }

    public Long getEntryId() {
        return entryId;
    }

    public String getShortId() {
        return shortId;
    }

    public EntryKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public Path getMainFile() {
        return mainFile;
    }

    public Path getInterfaceFile() {
        return interfaceFile;
    }

    public int getPort() {
        return port;
    }

    /**
     * 结果表中的 key（同一批次内唯一）
     */
    public String key() {
        return (shortId == null ? "?" : shortId) + " " + name + " (" + mainFile + ")";
    }

    @Override
    public String toString() {
        return key();
    }
}
