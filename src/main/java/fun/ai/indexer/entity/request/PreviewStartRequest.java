package fun.ai.indexer.entity.request;

import lombok.Data;

import java.util.List;

@Data
public class PreviewStartRequest {
    private List<Long> entryIds;
}
