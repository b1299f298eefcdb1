package fun.ai.indexer.entity.response;

import lombok.Data;

@Data
public class StaticServerInfo {
    private String path;
    private Integer port;
    private String url;
    private Long startedAt;
}
