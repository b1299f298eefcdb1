package fun.ai.indexer.catalog;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 目录记录存储。返回的对象都是快照副本，修改它们不会影响存储。
 */
public interface CatalogStore {

    /**
     * 按 (mainFilePath, folderPath) 插入或更新：
     * - 已存在且 mtime 变化：覆盖元数据字段 + lastScanned
     * - 已存在且 mtime 未变：只更新 lastScanned
     * - 不存在：分配 id 与 ShortId，createdAt = lastScanned = now
     *
     * @return 存储后的条目（含 id / shortId）
     */
    CatalogEntry upsert(CatalogEntry candidate);

    List<CatalogEntry> getAll();

    Optional<CatalogEntry> findById(long id);

    Optional<CatalogEntry> findByShortId(String shortId);

    Optional<CatalogEntry> getByPrimaryOrInterfacePath(String path);

    boolean setPreviewPath(long id, String previewPath);

    boolean clearPreviewPath(long id);

    /**
     * 预留并返回该类型的下一个 ShortId；预留过的序号即使未被使用也不会再分配
     */
    ShortId nextShortId(EntryKind kind);

    /**
     * 删除主文件已不在磁盘上的条目（连同预览图）
     *
     * @return 删除数量
     */
    int removeIfMissing();

    /**
     * 只检查给定的主文件路径：条目的主文件在这些路径之中且已不在磁盘上时删除
     *
     * @return 删除数量
     */
    int removeIfMissing(Collection<String> mainFilePaths);

    /**
     * 删除某个目录下发现的全部条目（连同预览图）
     */
    int removeByFolder(String folderPath);

    /**
     * 删除单个条目（连同预览图）
     */
    boolean removeById(long id);

    /**
     * 清空全部条目与预览图；ShortId 高水位保留，序号不会重新从 1 开始
     */
    int removeAll();

    boolean updateDescription(long id, String description);

    /**
     * @return 切换后的收藏状态；条目不存在返回 empty
     */
    Optional<Boolean> toggleFavourite(long id);

    boolean markEnriched(long id, EnrichmentData data);
}
