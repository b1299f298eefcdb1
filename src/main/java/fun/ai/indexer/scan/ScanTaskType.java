package fun.ai.indexer.scan;

/**
 * 发现任务的三个阶段，必须按顺序执行
 */
public enum ScanTaskType {
    FIND_EXECUTABLES,
    FIND_STATIC,
    PERSIST
}
