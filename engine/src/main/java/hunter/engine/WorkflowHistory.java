package hunter.engine;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only log of workflow runs. This is the only persistence
 * boundary of the engine: the current state of a run is never stored, it is
 * derived by folding {@link #load(String)}.
 */
public interface WorkflowHistory {
    void initialize() throws SQLException;

    /**
     * Persists the header of a new run.
     *
     * @throws IllegalArgumentException if a run with the same id already exists
     */
    void createRun(WorkflowRunHeader header) throws SQLException;

    Optional<WorkflowRunHeader> findRun(String runId) throws SQLException;

    List<WorkflowRunHeader> listRuns() throws SQLException;

    List<WorkflowRunHeader> listRunsForAccount(String accountId) throws SQLException;

    default AppendResult append(StepRecord record) throws SQLException {
        return append(record, null);
    }

    /**
     * Atomically appends a record and assigns its sequence number. A second
     * scheduled record for a step that still has one outstanding, or an outcome
     * without a matching outstanding attempt, is rejected as a conflict; the
     * caller must reload and decide again.
     *
     * <p>A scheduled record may carry the lease of the worker that runs it. The
     * lease is stored in the same transaction, and only if the record is.
     *
     * @throws IllegalArgumentException if the lease is given for an outcome or
     *                                  does not match the record
     */
    AppendResult append(StepRecord record, AttemptLease lease) throws SQLException;

    /** Records of one run in the order they were appended. */
    List<StepRecord> load(String runId) throws SQLException;

    /**
     * Records a cancellation request. Returns false if the run already has one.
     *
     * @throws IllegalArgumentException if the run does not exist
     */
    boolean requestCancel(String runId, String reason) throws SQLException;

    Optional<RunHistory> loadRun(String runId) throws SQLException;

    Optional<AttemptLease> findLease(String runId, String stepName, int attempt) throws SQLException;

    /**
     * Moves the expiry of a lease held by {@code renewed.owner()}. Returns false
     * if the attempt has no lease or another owner holds it.
     */
    boolean renewLease(AttemptLease renewed) throws SQLException;
}
