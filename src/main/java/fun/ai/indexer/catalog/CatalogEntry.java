package fun.ai.indexer.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 目录条目（一个被发现的小应用）。(mainFilePath, folderPath) 唯一。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogEntry {
    private Long id;
    /**
     * A001 / B001
     */
    private String shortId;
    private EntryKind kind;
    private String name;
    private String folderPath;
    private String mainFilePath;
    /**
     * 可执行应用的配套页面；静态条目与 mainFilePath 相同
     */
    private String interfaceFilePath;
    private Integer port;
    /**
     * 预览图路径；null 表示待生成
     */
    private String previewPath;

    /**
     * flask / django / unknown（静态条目为 null）
     */
    private String appFramework;
    private Long fileSize;
    /**
     * 主文件 mtime（epoch ms），用于判断重扫时是否需要刷新元数据
     */
    private Long lastModified;
    private List<String> dependencies = new ArrayList<>();
    private boolean missingDependencies;

    private String description;
    private String shortDescription;
    private String techStack;
    private List<String> tags = new ArrayList<>();
    private String category;
    private boolean enriched;
    private boolean favourite;

    private Long createdAt;
    private Long lastScanned;
}
