package fun.ai.indexer.entity.response;

import lombok.Data;

@Data
public class LiveLaunchResponse {
    private String url;
    /**
     * executable / static
     */
    private String kind;
    private String shortId;
    /**
     * running
     */
    private String status;
}
