package fun.ai.indexer.entity.response;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ScanProgressResponse {
    private Integer total;
    private Integer completed;
    /**
     * 第二阶段（find_static）结束前 total 未确定
     */
    private Boolean totalKnown;
    private Boolean scanning;
    private Double progressPercentage;
    /**
     * initializing / finding_executables / finding_static / saving_database / idle
     */
    private String phase;
    private String phaseDescription;
    private Integer queueSize;
    private List<JobErrorItem> recentErrors = new ArrayList<>();
    private Long startedAt;
}
