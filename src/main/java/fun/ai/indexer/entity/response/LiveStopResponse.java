package fun.ai.indexer.entity.response;

import lombok.Data;

@Data
public class LiveStopResponse {
    /**
     * stopped / killed / nothing_running / survived
     */
    private String status;
    private String path;
}
