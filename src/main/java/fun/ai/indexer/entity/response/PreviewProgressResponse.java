package fun.ai.indexer.entity.response;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class PreviewProgressResponse {
    private Integer total;
    private Integer completed;
    private Boolean processing;
    private Double progressPercentage;
    private String currentItem;
    private Integer queueSize;
    /**
     * 成功条目平均耗时 × 剩余条目数；尚无成功条目时为 0
     */
    private Long etaSeconds;
    private List<JobErrorItem> recentErrors = new ArrayList<>();
    private Double itemsPerMinute;
}
