package fun.ai.indexer.controller.indexer.live;

import fun.ai.indexer.common.Result;
import fun.ai.indexer.entity.response.FreeResourcesResponse;
import fun.ai.indexer.entity.response.LiveLaunchResponse;
import fun.ai.indexer.entity.response.LiveStatusResponse;
import fun.ai.indexer.entity.response.LiveStopResponse;
import fun.ai.indexer.exception.CatalogEntryNotFoundException;
import fun.ai.indexer.launcher.LiveActivityTracker;
import fun.ai.indexer.service.AppIndexerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 在线运行：同一时刻只有一个前台可执行应用；静态页面每个文件一个本地 HTTP 服务。
 * 启动/停止会等待进程（settle、terminate-grace、kill-wait），统一放到 liveExecutor 上执行。
 */
@RestController
@RequestMapping("/api/indexer/live")
@Tag(name = "Fun AI Indexer 在线运行", description = "启动/停止前台应用、静态页面服务；启动新应用会先停掉旧的前台应用")
public class FunAiIndexerLiveController {
    private static final Logger log = LoggerFactory.getLogger(FunAiIndexerLiveController.class);

    private final AppIndexerService indexerService;
    private final LiveActivityTracker activityTracker;
    private final Executor liveExecutor;

    public FunAiIndexerLiveController(AppIndexerService indexerService,
                                      LiveActivityTracker activityTracker,
                                      @Qualifier("liveExecutor") Executor liveExecutor) {
        this.indexerService = indexerService;
        this.activityTracker = activityTracker;
        this.liveExecutor = liveExecutor;
    }

    @PostMapping("/launch")
    @Operation(
            summary = "启动条目（异步返回）",
            description = "可执行应用：停掉当前前台应用后启动，等待 settle 时间再返回 URL；同一应用已在运行则直接复用。" +
                    "静态页面：复用或新建本地文件服务。entryId 与 shortId 二选一。"
    )
    public CompletableFuture<Result<LiveLaunchResponse>> launch(
            @Parameter(description = "条目ID") @RequestParam(required = false) Long entryId,
            @Parameter(description = "短ID，例如 A001") @RequestParam(required = false) String shortId
    ) {
        activityTracker.touch();
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Result.success(indexerService.liveLaunch(entryId, shortId));
            } catch (IllegalArgumentException e) {
                return Result.error(e.getMessage());
            } catch (CatalogEntryNotFoundException e) {
                return Result.error(404, e.getMessage());
            } catch (Exception e) {
                log.error("live launch failed: entryId={}, shortId={}, error={}", entryId, shortId, e.getMessage(), e);
                return Result.error("live launch failed: " + e.getMessage());
            }
        }, liveExecutor);
    }

    @GetMapping("/open/{shortId}")
    @Operation(summary = "按短ID启动并跳转", description = "启动完成后 302 到应用地址；条目不存在返回 404。")
    public CompletableFuture<ResponseEntity<Void>> open(
            @Parameter(description = "短ID，例如 A001", required = true) @PathVariable String shortId
    ) {
        activityTracker.touch();
        return CompletableFuture.supplyAsync(() -> {
            try {
                LiveLaunchResponse resp = indexerService.liveLaunch(null, shortId);
                HttpHeaders headers = new HttpHeaders();
                headers.setLocation(URI.create(resp.getUrl()));
                return new ResponseEntity<Void>(headers, HttpStatus.FOUND);
            } catch (CatalogEntryNotFoundException e) {
                return ResponseEntity.notFound().<Void>build();
            } catch (Exception e) {
                log.error("live open failed: shortId={}, error={}", shortId, e.getMessage(), e);
                return ResponseEntity.internalServerError().<Void>build();
            }
        }, liveExecutor);
    }

    @PostMapping("/stop")
    @Operation(summary = "停止前台应用（异步返回）", description = "terminate -> 有界等待 -> kill；没有运行中的应用时返回 not_running。")
    public CompletableFuture<Result<LiveStopResponse>> stop() {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Result.success(indexerService.liveStop());
            } catch (Exception e) {
                log.error("live stop failed: error={}", e.getMessage(), e);
                return Result.error("live stop failed: " + e.getMessage());
            }
        }, liveExecutor);
    }

    @GetMapping("/status")
    @Operation(summary = "在线运行状态", description = "前台应用（路径/端口/pid）以及所有静态页面服务。")
    public Result<LiveStatusResponse> status() {
        try {
            activityTracker.touch();
            return Result.success(indexerService.liveStatus());
        } catch (Exception e) {
            log.error("live status failed: error={}", e.getMessage(), e);
            return Result.error("live status failed: " + e.getMessage());
        }
    }

    @PostMapping("/free")
    @Operation(summary = "释放全部在线资源（异步返回）", description = "停止前台应用与所有静态页面服务，返回停止数量。")
    public CompletableFuture<Result<FreeResourcesResponse>> free() {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Result.success(indexerService.freeAllResources());
            } catch (Exception e) {
                log.error("free live resources failed: error={}", e.getMessage(), e);
                return Result.error("free live resources failed: " + e.getMessage());
            }
        }, liveExecutor);
    }
}
