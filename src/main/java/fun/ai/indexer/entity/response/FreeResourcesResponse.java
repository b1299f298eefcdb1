package fun.ai.indexer.entity.response;

import lombok.Data;

@Data
public class FreeResourcesResponse {
    private Integer stoppedCount;
}
