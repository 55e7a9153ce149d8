package hunter.engine;

public record AppendResult(boolean appended, StepRecord record, String conflictReason) {
    public static AppendResult appended(StepRecord record) {
        return new AppendResult(true, record, null);
    }

    public static AppendResult conflict(StepRecord rejected, String reason) {
        return new AppendResult(false, rejected, reason);
    }

    public boolean isConflict() {
        return !appended;
    }
}
