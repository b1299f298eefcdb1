package fun.ai.indexer.controller.indexer.preview;

import fun.ai.indexer.common.Result;
import fun.ai.indexer.entity.request.PreviewStartRequest;
import fun.ai.indexer.entity.response.PreviewProgressResponse;
import fun.ai.indexer.entity.response.PreviewStartResponse;
import fun.ai.indexer.exception.CatalogEntryNotFoundException;
import fun.ai.indexer.service.AppIndexerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 预览图生成
 */
@RestController
@RequestMapping("/api/indexer/preview")
@Tag(name = "Fun AI Indexer 预览图", description = "后台逐个启动应用/打开页面并截图；与前台运行的应用互不干扰")
public class FunAiIndexerPreviewController {
    private static final Logger log = LoggerFactory.getLogger(FunAiIndexerPreviewController.class);

    private final AppIndexerService indexerService;

    public FunAiIndexerPreviewController(AppIndexerService indexerService) {
        this.indexerService = indexerService;
    }

    @PostMapping("/regenerate")
    @Operation(summary = "补齐缺失的预览图", description = "对预览图为空或文件已丢失的条目入队截图，返回入队数量。")
    public Result<PreviewStartResponse> regenerate() {
        try {
            return Result.success(indexerService.previewRegenerate());
        } catch (Exception e) {
            log.error("regenerate previews failed: error={}", e.getMessage(), e);
            return Result.error("regenerate previews failed: " + e.getMessage());
        }
    }

    @PostMapping("/start")
    @Operation(summary = "为指定条目生成预览图", description = "批次进行中再次提交会追加到当前批次。")
    public Result<PreviewStartResponse> start(@RequestBody PreviewStartRequest req) {
        try {
            return Result.success(indexerService.previewStart(req == null ? null : req.getEntryIds()));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (CatalogEntryNotFoundException e) {
            return Result.error(404, e.getMessage());
        } catch (Exception e) {
            log.error("start preview failed: error={}", e.getMessage(), e);
            return Result.error("start preview failed: " + e.getMessage());
        }
    }

    @GetMapping("/progress")
    @Operation(summary = "预览图进度", description = "含百分比、预计剩余时间（成功条目平均耗时 × 剩余数）、最近 5 条失败。")
    public Result<PreviewProgressResponse> progress() {
        try {
            return Result.success(indexerService.previewProgress());
        } catch (Exception e) {
            log.error("get preview progress failed: error={}", e.getMessage(), e);
            return Result.error("get preview progress failed: " + e.getMessage());
        }
    }
}
