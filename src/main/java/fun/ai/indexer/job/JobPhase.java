package fun.ai.indexer.job;

public enum JobPhase {
    INITIALIZING("Initializing scan..."),
    FINDING_EXECUTABLES("Finding Python apps..."),
    FINDING_STATIC("Finding HTML files..."),
    SAVING_DATABASE("Saving to database..."),
    CAPTURING("Capturing previews..."),
    IDLE("Idle");

    private final String description;

    JobPhase(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
