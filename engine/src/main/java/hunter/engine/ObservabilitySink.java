package hunter.engine;

/**
 * Receives step and run transitions. Called from scheduler threads; wrap slow
 * implementations in {@link AsyncObservabilitySink}.
 */
public interface ObservabilitySink {
    ObservabilitySink NONE = new ObservabilitySink() {
        @Override
        public void recordAppended(StepRecord record) {
        }

        @Override
        public void runTerminated(WorkflowRunView run, Decision decision) {
        }
    };

    void recordAppended(StepRecord record);

    /** Called once when a run reaches COMPLETED, FAILED or ABANDONED. */
    void runTerminated(WorkflowRunView run, Decision decision);
}
