package fun.ai.indexer.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 外部描述生成服务返回的字段
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnrichmentData {
    private String description;
    private String shortDescription;
    private String techStack;
    private List<String> tags = new ArrayList<>();
    private String category;
}
