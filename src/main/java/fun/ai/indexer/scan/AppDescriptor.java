package fun.ai.indexer.scan;

import fun.ai.indexer.catalog.EntryKind;

import java.nio.file.Path;

/**
 * 扫描阶段产出的候选应用。persist 阶段会把分配到的 id / shortId 回写到这里，供随后的预览任务直接使用。
 */
public class AppDescriptor {
    private final EntryKind kind;
    private final String name;
    private final Path mainFile;
    private final Path interfaceFile;
    private final int port;
    private final String appFramework;

    private volatile Long entryId;
    private volatile String shortId;

    public AppDescriptor(EntryKind kind, String name, Path mainFile, Path interfaceFile, int port, String appFramework) {
        this.kind = kind;
        this.name = name;
        this.mainFile = mainFile;
        this.interfaceFile = interfaceFile;
        this.port = port;
        this.appFramework = appFramework;
    }

    public static AppDescriptor executable(String name, Path script, Path page, int port, String framework) {
        return new AppDescriptor(EntryKind.EXECUTABLE, name, script, page, port, framework);
    }

    public static AppDescriptor page(String name, Path page) {
        return new AppDescriptor(EntryKind.STATIC, name, page, page, 0, null);
    }

    public AppDescriptor withInterface(Path page) {
        return new AppDescriptor(kind, name, mainFile, page, port, appFramework);
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

    /**
     * 条目所属目录：主文件所在目录
     */
    public Path getFolder() {
        return mainFile.getParent();
    }

    public int getPort() {
        return port;
    }

    public String getAppFramework() {
        return appFramework;
    }

    public Long getEntryId() {
        return entryId;
    }

    public String getShortId() {
        return shortId;
    }

    public void resolved(Long entryId, String shortId) {
        this.entryId = entryId;
        this.shortId = shortId;
    }

    /**
     * 进度结果表中的 key
     */
    public String key() {
        return kind.name().toLowerCase() + ":" + mainFile;
    }

    @Override
    public String toString() {
        return "AppDescriptor{" + kind + ", " + name + ", " + mainFile + (shortId == null ? "" : ", " + shortId) + "}";
    }
}
