package fun.ai.indexer.enrich;

/**
 * 外部描述生成服务（fire-and-forget）
 */
public interface EnrichmentClient {

    /**
     * 异步提交；结果写回目录记录。未启用时直接忽略。
     *
     * @return 是否已提交
     */
    boolean enrich(long entryId);
}
