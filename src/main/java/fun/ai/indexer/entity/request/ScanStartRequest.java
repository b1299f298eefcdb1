package fun.ai.indexer.entity.request;

import lombok.Data;

@Data
public class ScanStartRequest {
    /**
     * 要扫描的根目录（绝对路径）
     */
    private String rootDir;
    /**
     * 扫描入库后是否直接为本批次条目生成预览图
     */
    private Boolean autoPreview;
}
