package hunter.engine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingObservabilitySink implements ObservabilitySink {
    final List<StepRecord> appended = new CopyOnWriteArrayList<>();
    final List<Decision> terminated = new CopyOnWriteArrayList<>();
    final List<WorkflowRunView> terminatedRuns = new CopyOnWriteArrayList<>();

    @Override
    public void recordAppended(StepRecord record) {
        appended.add(record);
    }

    @Override
    public void runTerminated(WorkflowRunView run, Decision decision) {
        terminatedRuns.add(run);
        terminated.add(decision);
    }
}
