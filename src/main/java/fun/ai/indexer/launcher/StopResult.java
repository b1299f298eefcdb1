package fun.ai.indexer.launcher;

public final class StopResult {
    private final TerminationOutcome outcome;
    private final String path;

    public StopResult(TerminationOutcome outcome, String path) {
        this.outcome = outcome;
        this.path = path;
    }

    public static StopResult nothingRunning() {
        return new StopResult(TerminationOutcome.NOT_RUNNING, null);
    }

    public TerminationOutcome getOutcome() {
        return outcome;
    }

    public String getPath() {
        return path;
    }
}
