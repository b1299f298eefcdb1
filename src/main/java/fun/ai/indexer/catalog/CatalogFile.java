package fun.ai.indexer.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * catalog.json 的落盘结构
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogFile {
    private long lastId;
    /**
     * 每种类型已分配过的最大序号（删除后也不回退）
     */
    private Map<EntryKind, Long> highWater = new EnumMap<>(EntryKind.class);
    private List<CatalogEntry> entries = new ArrayList<>();
}
