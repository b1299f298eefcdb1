package fun.ai.indexer.entity.request;

import lombok.Data;

@Data
public class RemoveFolderRequest {
    private String folderPath;
}
