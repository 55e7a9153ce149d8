package hunter.engine;

public record WorkflowRunView(
        String runId,
        String accountId,
        RunState state,
        int stepCursor,
        Decision nextDecision,
        long createdAtMs,
        long updatedAtMs) {

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
