package hunter.engine;

public enum RunState {
    ACTIVE,
    COMPLETED,
    FAILED,
    ABANDONED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    static RunState of(Decision decision) {
        if (decision instanceof Decision.Complete) {
            return COMPLETED;
        }
        if (decision instanceof Decision.Fail) {
            return FAILED;
        }
        if (decision instanceof Decision.Abandon) {
            return ABANDONED;
        }
        return ACTIVE;
    }
}
