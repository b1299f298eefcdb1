package fun.ai.indexer.entity.response;

import lombok.Data;

/**
 * 进度接口中的失败条目（error 超过 100 字符会被截断）
 */
@Data
public class JobErrorItem {
    private String item;
    private String error;
}
