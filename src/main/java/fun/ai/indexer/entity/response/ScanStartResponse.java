package fun.ai.indexer.entity.response;

import lombok.Data;

@Data
public class ScanStartResponse {
    /**
     * started
     */
    private String status;
    private Long batchId;
    private String rootDir;
    private Boolean autoPreview;
}
