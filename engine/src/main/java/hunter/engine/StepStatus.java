package hunter.engine;

public enum StepStatus {
    SCHEDULED,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isOutcome() {
        return this != SCHEDULED;
    }
}
