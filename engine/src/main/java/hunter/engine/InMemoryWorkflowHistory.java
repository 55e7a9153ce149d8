package hunter.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local {@link WorkflowHistory}. Same append rules as the SQLite
 * history, nothing survives a restart.
 */
public final class InMemoryWorkflowHistory implements WorkflowHistory {
    private final Map<String, WorkflowRunHeader> runs = new LinkedHashMap<>();
    private final Map<String, List<StepRecord>> records = new LinkedHashMap<>();
    private final Map<String, Cancellation> cancellations = new LinkedHashMap<>();
    private final Map<String, AttemptLease> leases = new LinkedHashMap<>();

    @Override
    public void initialize() {
    }

    @Override
    public synchronized void createRun(WorkflowRunHeader header) {
        Objects.requireNonNull(header, "header");
        if (runs.containsKey(header.runId())) {
            throw new IllegalArgumentException("Run already exists: " + header.runId());
        }
        runs.put(header.runId(), header);
        records.put(header.runId(), new ArrayList<>());
    }

    @Override
    public synchronized Optional<WorkflowRunHeader> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized List<WorkflowRunHeader> listRuns() {
        return List.copyOf(runs.values());
    }

    @Override
    public synchronized List<WorkflowRunHeader> listRunsForAccount(String accountId) {
        return runs.values().stream()
                .filter(run -> run.accountId().equals(accountId))
                .toList();
    }

    @Override
    public synchronized AppendResult append(StepRecord record, AttemptLease lease) {
        Objects.requireNonNull(record, "record");
        AppendRules.checkLease(record, lease);
        List<StepRecord> runRecords = records.get(record.runId());
        if (runRecords == null) {
            return AppendResult.conflict(record, "unknown run " + record.runId());
        }
        List<StepRecord> stepRecords = runRecords.stream()
                .filter(existing -> existing.stepName().equals(record.stepName()))
                .toList();
        String conflict = AppendRules.conflictReason(stepRecords, record);
        if (conflict != null) {
            return AppendResult.conflict(record, conflict);
        }
        StepRecord stored = record.withSequence(runRecords.size() + 1L);
        runRecords.add(stored);
        if (lease != null) {
            leases.put(leaseKey(lease.runId(), lease.stepName(), lease.attempt()), lease);
        }
        return AppendResult.appended(stored);
    }

    @Override
    public synchronized List<StepRecord> load(String runId) {
        List<StepRecord> runRecords = records.get(runId);
        return runRecords == null ? List.of() : List.copyOf(runRecords);
    }

    @Override
    public synchronized boolean requestCancel(String runId, String reason) {
        if (!runs.containsKey(runId)) {
            throw new IllegalArgumentException("Unknown run: " + runId);
        }
        return cancellations.putIfAbsent(runId, new Cancellation(runId, reason, System.currentTimeMillis())) == null;
    }

    @Override
    public synchronized Optional<RunHistory> loadRun(String runId) {
        WorkflowRunHeader header = runs.get(runId);
        if (header == null) {
            return Optional.empty();
        }
        return Optional.of(new RunHistory(header, records.get(runId), cancellations.get(runId)));
    }

    @Override
    public synchronized Optional<AttemptLease> findLease(String runId, String stepName, int attempt) {
        return Optional.ofNullable(leases.get(leaseKey(runId, stepName, attempt)));
    }

    @Override
    public synchronized boolean renewLease(AttemptLease renewed) {
        String key = leaseKey(renewed.runId(), renewed.stepName(), renewed.attempt());
        AttemptLease current = leases.get(key);
        if (current == null || !current.owner().equals(renewed.owner())) {
            return false;
        }
        leases.put(key, current.extendedTo(Math.max(current.expiresAtMs(), renewed.expiresAtMs())));
        return true;
    }

    private static String leaseKey(String runId, String stepName, int attempt) {
        return runId + '/' + stepName + '#' + attempt;
    }
}
