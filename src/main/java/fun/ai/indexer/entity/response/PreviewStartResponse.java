package fun.ai.indexer.entity.response;

import lombok.Data;

@Data
public class PreviewStartResponse {
    /**
     * started / nothing_to_do
     */
    private String status;
    private Integer count;
}
