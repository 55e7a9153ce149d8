package hunter.engine;

import java.util.Objects;

public record WorkflowRunHeader(
        String runId,
        String workflowName,
        String accountId,
        long observedAtMs,
        String signalJson,
        long createdAtMs) {

    public WorkflowRunHeader {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(workflowName, "workflowName");
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(signalJson, "signalJson");
    }
}
