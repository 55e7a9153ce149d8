package hunter.engine;

import java.util.List;
import java.util.Objects;

public record RunHistory(WorkflowRunHeader header, List<StepRecord> records, Cancellation cancellation) {
    public RunHistory {
        Objects.requireNonNull(header, "header");
        records = List.copyOf(records);
    }

    public String runId() {
        return header.runId();
    }

    public boolean cancelRequested() {
        return cancellation != null;
    }
}
