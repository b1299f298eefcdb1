package fun.ai.indexer.controller.indexer.scan;

import fun.ai.indexer.common.Result;
import fun.ai.indexer.entity.request.ScanStartRequest;
import fun.ai.indexer.entity.response.ScanProgressResponse;
import fun.ai.indexer.entity.response.ScanStartResponse;
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
 * 目录扫描（发现小应用）
 */
@RestController
@RequestMapping("/api/indexer/scan")
@Tag(name = "Fun AI Indexer 扫描", description = "扫描目录：找可执行应用 -> 找独立页面 -> 入库（后台顺序执行，轮询进度）")
public class FunAiIndexerScanController {
    private static final Logger log = LoggerFactory.getLogger(FunAiIndexerScanController.class);

    private final AppIndexerService indexerService;

    public FunAiIndexerScanController(AppIndexerService indexerService) {
        this.indexerService = indexerService;
    }

    @PostMapping("/start")
    @Operation(summary = "开始扫描（非阻塞）", description = "入队三个阶段任务后立即返回 started；扫描失败只会体现在进度接口的 recentErrors 中。")
    public Result<ScanStartResponse> start(@RequestBody ScanStartRequest req) {
        try {
            if (req == null) {
                return Result.error("请求体不能为空");
            }
            return Result.success(indexerService.scanStart(req.getRootDir(), Boolean.TRUE.equals(req.getAutoPreview())));
        } catch (IllegalArgumentException e) {
            return Result.error(e.getMessage());
        } catch (Exception e) {
            log.error("start scan failed: rootDir={}, error={}", req == null ? null : req.getRootDir(), e.getMessage(), e);
            return Result.error("start scan failed: " + e.getMessage());
        }
    }

    @GetMapping("/progress")
    @Operation(summary = "扫描进度", description = "total 在找完独立页面后才确定（totalKnown=true），此前百分比为 0。")
    public Result<ScanProgressResponse> progress() {
        try {
            return Result.success(indexerService.scanProgress());
        } catch (Exception e) {
            log.error("get scan progress failed: error={}", e.getMessage(), e);
            return Result.error("get scan progress failed: " + e.getMessage());
        }
    }
}
