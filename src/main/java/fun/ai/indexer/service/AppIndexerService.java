package fun.ai.indexer.service;

import fun.ai.indexer.catalog.CatalogEntry;
import fun.ai.indexer.entity.response.FreeResourcesResponse;
import fun.ai.indexer.entity.response.LiveLaunchResponse;
import fun.ai.indexer.entity.response.LiveStatusResponse;
import fun.ai.indexer.entity.response.LiveStopResponse;
import fun.ai.indexer.entity.response.PreviewProgressResponse;
import fun.ai.indexer.entity.response.PreviewStartResponse;
import fun.ai.indexer.entity.response.ScanProgressResponse;
import fun.ai.indexer.entity.response.ScanStartResponse;

import java.nio.file.Path;
import java.util.List;

/**
 * 小应用目录：扫描、预览、在线启动、目录维护
 */
public interface AppIndexerService {

    /**
     * 入队一次扫描并立即返回
     */
    ScanStartResponse scanStart(String rootDir, boolean autoPreview);

    ScanProgressResponse scanProgress();

    /**
     * 为所有缺少预览图（未生成或文件已丢失）的条目生成预览
     */
    PreviewStartResponse previewRegenerate();

    PreviewStartResponse previewStart(List<Long> entryIds);

    PreviewProgressResponse previewProgress();

    /**
     * 可执行条目走前台槽位，静态条目走静态文件服务；返回可访问地址
     */
    LiveLaunchResponse liveLaunch(Long entryId, String shortId);

    LiveStopResponse liveStop();

    LiveStatusResponse liveStatus();

    /**
     * 停止前台应用和全部静态服务
     */
    FreeResourcesResponse freeAllResources();

    /**
     * 列表读取时顺带清理已丢失的预览图引用
     */
    List<CatalogEntry> listItems(String query, String category, Boolean favourite);

    CatalogEntry getItem(long id);

    Path previewImage(long id);

    boolean toggleFavourite(long id);

    void updateDescription(long id, String description);

    void removeItem(long id);

    int removeFolder(String folderPath);

    /**
     * 删除主文件已不存在的条目
     */
    int cleanup();

    int purge();

    boolean enrich(long id);
}
