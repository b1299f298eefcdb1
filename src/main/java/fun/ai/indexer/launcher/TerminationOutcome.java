package fun.ai.indexer.launcher;

public enum TerminationOutcome {
    /**
     * 软终止后在宽限期内退出
     */
    STOPPED,
    /**
     * 宽限期内未退出，已强制 kill
     */
    KILLED,
    NOT_RUNNING,
    /**
     * 强制 kill 后仍未确认退出
     */
    SURVIVED
}
