package github.sarthakdev143.reel_factory.model;

public enum RenderJobState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
