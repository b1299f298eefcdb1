package fun.ai.indexer.entity.response;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 前台应用状态 + 正在提供服务的静态页面
 */
@Data
public class LiveStatusResponse {
    private Boolean running;
    private String path;
    private String url;
    private Integer port;
    private Long pid;
    private Long startedAt;
    private List<StaticServerInfo> staticServers = new ArrayList<>();
    /**
     * 最近一次 live 操作时间（用于 idle 回收诊断）
     */
    private Long lastActiveAt;
}
