package fun.ai.indexer.entity.request;

import lombok.Data;

@Data
public class UpdateDescriptionRequest {
    private String description;
}
