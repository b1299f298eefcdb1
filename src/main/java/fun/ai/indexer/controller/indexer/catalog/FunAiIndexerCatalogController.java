package fun.ai.indexer.controller.indexer.catalog;

import fun.ai.indexer.catalog.CatalogEntry;
import fun.ai.indexer.common.Result;
import fun.ai.indexer.entity.request.RemoveFolderRequest;
import fun.ai.indexer.entity.request.UpdateDescriptionRequest;
import fun.ai.indexer.exception.CatalogEntryNotFoundException;
import fun.ai.indexer.service.AppIndexerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 目录维护：列表/详情/收藏/描述/删除/清理
 */
@RestController
@RequestMapping("/api/indexer/catalog")
@Tag(name = "Fun AI Indexer 目录", description = "已入库条目的查询与维护")
public class FunAiIndexerCatalogController {
    private static final Logger log = LoggerFactory.getLogger(FunAiIndexerCatalogController.class);

    private final AppIndexerService indexerService;
    private final Executor liveExecutor;

    public FunAiIndexerCatalogController(AppIndexerService indexerService,
                                         @Qualifier("liveExecutor") Executor liveExecutor) {
        this.indexerService = indexerService;
        this.liveExecutor = liveExecutor;
    }

    @GetMapping("/items")
    @Operation(summary = "条目列表", description = "按名称排序；q 匹配名称/描述/技术栈/标签，category 精确匹配（忽略大小写），favourite=true 仅返回收藏。")
    public Result<List<CatalogEntry>> list(
            @Parameter(description = "关键字") @RequestParam(required = false) String q,
            @Parameter(description = "分类") @RequestParam(required = false) String category,
            @Parameter(description = "仅收藏") @RequestParam(required = false) Boolean favourite
    ) {
        try {
            return Result.success(indexerService.listItems(q, category, favourite));
        } catch (Exception e) {
            log.error("list items failed: q={}, error={}", q, e.getMessage(), e);
            return Result.error("list items failed: " + e.getMessage());
        }
    }

    @GetMapping("/items/{id}")
    @Operation(summary = "条目详情")
    public Result<CatalogEntry> get(@Parameter(description = "条目ID", required = true) @PathVariable long id) {
        try {
            return Result.success(indexerService.getItem(id));
        } catch (CatalogEntryNotFoundException e) {
            return Result.error(404, e.getMessage());
        } catch (Exception e) {
            log.error("get item failed: id={}, error={}", id, e.getMessage(), e);
            return Result.error("get item failed: " + e.getMessage());
        }
    }

    @GetMapping("/items/{id}/preview")
    @Operation(summary = "预览图（PNG）", description = "未生成或文件已丢失时返回 404。")
    public ResponseEntity<byte[]> preview(@Parameter(description = "条目ID", required = true) @PathVariable long id) {
        try {
            Path image = indexerService.previewImage(id);
            if (image == null) {
                return ResponseEntity.notFound().build();
            }
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.IMAGE_PNG);
            headers.add(HttpHeaders.CACHE_CONTROL, "no-cache");
            return ResponseEntity.ok().headers(headers).body(Files.readAllBytes(image));
        } catch (CatalogEntryNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("read preview failed: id={}, error={}", id, e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/items/{id}/favourite")
    @Operation(summary = "切换收藏", description = "返回切换后的收藏状态。")
    public Result<Boolean> toggleFavourite(@Parameter(description = "条目ID", required = true) @PathVariable long id) {
        try {
            return Result.success(indexerService.toggleFavourite(id));
        } catch (CatalogEntryNotFoundException e) {
            return Result.error(404, e.getMessage());
        } catch (Exception e) {
            log.error("toggle favourite failed: id={}, error={}", id, e.getMessage(), e);
            return Result.error("toggle favourite failed: " + e.getMessage());
        }
    }

    @PutMapping("/items/{id}/description")
    @Operation(summary = "修改描述")
    public Result<String> updateDescription(@Parameter(description = "条目ID", required = true) @PathVariable long id,
                                            @RequestBody UpdateDescriptionRequest req) {
        try {
            indexerService.updateDescription(id, req == null ? null : req.getDescription());
            return Result.success("ok");
        } catch (CatalogEntryNotFoundException e) {
            return Result.error(404, e.getMessage());
        } catch (Exception e) {
            log.error("update description failed: id={}, error={}", id, e.getMessage(), e);
            return Result.error("update description failed: " + e.getMessage());
        }
    }

    @DeleteMapping("/items/{id}")
    @Operation(summary = "删除条目（异步返回）", description = "同时停止该条目的静态服务/前台进程，并删除预览图文件。")
    public CompletableFuture<Result<String>> remove(@Parameter(description = "条目ID", required = true) @PathVariable long id) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                indexerService.removeItem(id);
                return Result.success("ok");
            } catch (CatalogEntryNotFoundException e) {
                return Result.error(404, e.getMessage());
            } catch (Exception e) {
                log.error("remove item failed: id={}, error={}", id, e.getMessage(), e);
                return Result.error("remove item failed: " + e.getMessage());
            }
        }, liveExecutor);
    }

    @PostMapping("/remove-folder")
    @Operation(summary = "按目录删除", description = "删除所在目录等于 folderPath 的所有条目，返回删除数量。")
    public Result<Integer> removeFolder(@RequestBody RemoveFolderRequest req) {
        try {
            return Result.success(indexerService.removeFolder(req == null ? null : req.getFolderPath()));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("remove folder failed: folderPath={}, error={}", req == null ? null : req.getFolderPath(), e.getMessage(), e);
            return Result.error("remove folder failed: " + e.getMessage());
        }
    }

    @PostMapping("/cleanup")
    @Operation(summary = "清理失效条目", description = "删除主文件已不存在的条目，返回删除数量。")
    public Result<Integer> cleanup() {
        try {
            return Result.success(indexerService.cleanup());
        } catch (Exception e) {
            log.error("cleanup failed: error={}", e.getMessage(), e);
            return Result.error("cleanup failed: " + e.getMessage());
        }
    }

    @PostMapping("/purge")
    @Operation(summary = "清空目录", description = "删除所有条目；短ID 不会回收，后续新条目继续递增。")
    public Result<Integer> purge() {
        try {
            return Result.success(indexerService.purge());
        } catch (Exception e) {
            log.error("purge failed: error={}", e.getMessage(), e);
            return Result.error("purge failed: " + e.getMessage());
        }
    }

    @PostMapping("/items/{id}/enrich")
    @Operation(summary = "生成描述（外部服务）", description = "未启用外部服务时返回 false；启用时后台异步执行并返回 true。")
    public Result<Boolean> enrich(@Parameter(description = "条目ID", required = true) @PathVariable long id) {
        try {
            return Result.success(indexerService.enrich(id));
        } catch (CatalogEntryNotFoundException e) {
            return Result.error(404, e.getMessage());
        } catch (Exception e) {
            log.error("enrich failed: id={}, error={}", id, e.getMessage(), e);
            return Result.error("enrich failed: " + e.getMessage());
        }
    }
}
