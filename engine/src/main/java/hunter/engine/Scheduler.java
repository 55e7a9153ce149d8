package hunter.engine;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives runs forward.
 *
 * <p>Runs wait in a due-time queue. Each {@link #tick()} takes the runs that are
 * due, asks the engine for a decision and hands step attempts to a worker pool
 * of {@code maxConcurrency} threads. A run is owned by at most one thread at a
 * time: while an attempt is in flight the run is neither queued nor advanced,
 * and the worker puts it back in the queue when the outcome is recorded.
 * Retries wait in the queue until their due time instead of being polled.
 *
 * <p>Every attempt is scheduled under a lease of this scheduler's worker id,
 * renewed while the attempt runs. An attempt found in flight is closed as timed
 * out only if it has no lease, its lease went stale, or this worker holds the
 * lease but no local thread runs it. Attempts leased by a live worker elsewhere
 * are left alone, so schedulers in several processes can share one history.
 */
public final class Scheduler<K extends Enum<K> & StepKind> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 10L;

    private final WorkflowEngine<K> engine;
    private final WorkflowHistory history;
    private final ActivityExecutor<K> activityExecutor;
    private final ObservabilitySink sink;
    private final JsonCodec jsonCodec;
    private final SchedulerConfig config;
    private final Clock clock;

    private final PriorityQueue<DueRun> queue =
            new PriorityQueue<>(Comparator.comparingLong(DueRun::dueAtMs).thenComparingLong(DueRun::order));
    private final Map<String, Long> queuedDue = new HashMap<>();
    private long enqueueOrder;

    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
    private final Set<String> busyRuns = ConcurrentHashMap.newKeySet();
    private final Map<String, AttemptLease> heldLeases = new ConcurrentHashMap<>();
    private final Object tickLock = new Object();
    private final Object idleMonitor = new Object();
    private final Semaphore slots;
    private final ExecutorService workers;
    private final ScheduledExecutorService ticker;
    private final ScheduledExecutorService heartbeat;
    private volatile boolean started;

    public Scheduler(WorkflowEngine<K> engine,
                     WorkflowHistory history,
                     ActivityExecutor<K> activityExecutor,
                     ObservabilitySink sink,
                     JsonCodec jsonCodec,
                     SchedulerConfig config,
                     Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.history = Objects.requireNonNull(history, "history");
        this.activityExecutor = Objects.requireNonNull(activityExecutor, "activityExecutor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.slots = new Semaphore(config.maxConcurrency());
        this.workers = Executors.newFixedThreadPool(config.maxConcurrency(), new NamedThreadFactory("step-worker"));
        this.ticker = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("scheduler-tick"));
        this.heartbeat = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("lease-heartbeat"));
    }

    /** Starts ticking every {@code tickInterval}, and whenever new work is queued. */
    public void start() {
        if (started) {
            return;
        }
        started = true;
        long intervalMs = config.tickInterval().toMillis();
        ticker.scheduleWithFixedDelay(this::safeTick, 0L, intervalMs, TimeUnit.MILLISECONDS);
        long renewMs = config.leaseRenewInterval().toMillis();
        heartbeat.scheduleAtFixedRate(this::renewHeldLeases, renewMs, renewMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler started. workerId={}, maxConcurrency={}, tickIntervalMs={}, leaseMs={}",
                config.workerId(), config.maxConcurrency(), intervalMs, config.leaseDuration().toMillis());
    }

    /**
     * Re-queues every run that is not terminal. Attempts left in flight by a
     * previous process are closed as timed out once their lease is stale.
     */
    public int recover() throws SQLException {
        int resumed = 0;
        long now = clock.millis();
        for (WorkflowRunView run : engine.listRuns()) {
            if (run.isTerminal()) {
                continue;
            }
            activeRuns.add(run.runId());
            enqueue(run.runId(), now);
            resumed++;
        }
        log.info("Recovered active workflow runs. count={}", resumed);
        requestTick();
        return resumed;
    }

    /** Queues a newly created run for its first decision. */
    public void submit(String runId) {
        Objects.requireNonNull(runId, "runId");
        activeRuns.add(runId);
        enqueue(runId, clock.millis());
        requestTick();
    }

    public boolean cancel(String runId, String reason) throws SQLException {
        boolean recorded = engine.cancel(runId, reason);
        if (activeRuns.contains(runId)) {
            enqueue(runId, clock.millis());
            requestTick();
        }
        return recorded;
    }

    /**
     * Advances every run whose due time has passed.
     *
     * @return number of runs for which a decision was taken
     */
    public int tick() {
        synchronized (tickLock) {
            long now = clock.millis();
            int advanced = 0;
            for (String runId : pollDue(now)) {
                if (!busyRuns.add(runId)) {
                    // The owning worker re-queues the run when its attempt is recorded.
                    continue;
                }
                advanced++;
                boolean handedOff = false;
                try {
                    handedOff = advanceRun(runId, now);
                } catch (SQLException | RuntimeException e) {
                    log.error("Could not advance run, retrying later. runId={}", runId, e);
                    enqueue(runId, now + config.storageRetryDelay().toMillis());
                } finally {
                    if (!handedOff) {
                        busyRuns.remove(runId);
                    }
                }
            }
            return advanced;
        }
    }

    public int activeRunCount() {
        return activeRuns.size();
    }

    /** Waits until no active run is left. */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (!activeRuns.isEmpty()) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                idleMonitor.wait(Math.min(remainingMs, 50L));
            }
            return true;
        }
    }

    private boolean advanceRun(String runId, long now) throws SQLException {
        Optional<RunHistory> loaded = history.loadRun(runId);
        if (loaded.isEmpty()) {
            log.warn("Dropping unknown run from the queue. runId={}", runId);
            markInactive(runId);
            return false;
        }
        RunHistory run = loaded.get();
        Decision decision = engine.decide(run);

        if (decision.isTerminal()) {
            terminate(run, decision);
            return false;
        }
        if (decision instanceof Decision.ExecuteStep execute) {
            return dispatch(runId, execute, now);
        }
        if (decision instanceof Decision.AwaitRetry retry) {
            if (retry.dueAtMs() <= now) {
                return dispatch(runId, retry.toExecute(), now);
            }
            log.debug("Retry not due yet. runId={}, step={}, attempt={}, dueInMs={}",
                    runId, retry.stepName(), retry.nextAttempt(), retry.dueAtMs() - now);
            enqueue(runId, retry.dueAtMs());
            return false;
        }
        if (decision instanceof Decision.AwaitInFlight inFlight) {
            Optional<AttemptLease> lease = history.findLease(runId, inFlight.stepName(), inFlight.attempt());
            if (lease.isPresent() && isLiveElsewhere(lease.get(), now)) {
                long recheckAt = Math.min(lease.get().expiresAtMs(), now + config.leaseRenewInterval().toMillis());
                log.debug("Attempt leased by another worker. runId={}, step={}, attempt={}, owner={}",
                        runId, inFlight.stepName(), inFlight.attempt(), lease.get().owner());
                enqueue(runId, recheckAt);
                return false;
            }
            closeOrphanedAttempt(run, inFlight, lease.orElse(null), now);
            enqueue(runId, now);
            requestTick();
            return false;
        }
        throw new IllegalStateException("Unhandled decision " + decision);
    }

    private boolean dispatch(String runId, Decision.ExecuteStep execute, long now) {
        StepDefinition<K> step = engine.definition().step(execute.stepName())
                .orElseThrow(() -> new IllegalStateException("Unknown step " + execute.stepName()));
        if (!slots.tryAcquire()) {
            log.debug("All workers busy, run stays queued. runId={}, step={}", runId, execute.stepName());
            enqueue(runId, now);
            return false;
        }
        try {
            workers.execute(() -> runAttempt(runId, step, execute));
            return true;
        } catch (RejectedExecutionException e) {
            slots.release();
            log.warn("Worker pool rejected attempt, run stays queued. runId={}, step={}", runId, execute.stepName());
            enqueue(runId, now + config.storageRetryDelay().toMillis());
            return false;
        }
    }

    private void runAttempt(String runId, StepDefinition<K> step, Decision.ExecuteStep execute) {
        CrashConfig crash = config.crashConfig();
        try {
            long scheduledAt = clock.millis();
            StepRecord scheduled = StepRecord.scheduled(runId, step.stepName(), execute.attempt(),
                    execute.inputJson(), scheduledAt);
            AttemptLease lease = AttemptLease.forAttempt(scheduled, config.workerId(),
                    scheduledAt + config.leaseDuration().toMillis());
            AppendResult opened = history.append(scheduled, lease);
            if (opened.isConflict()) {
                log.warn("Attempt not scheduled, reloading run. runId={}, step={}, attempt={}, reason={}",
                        runId, step.stepName(), execute.attempt(), opened.conflictReason());
                return;
            }
            heldLeases.put(runId, lease);
            sink.recordAppended(opened.record());
            crash.maybeCrash(runId, step.stepName(), execute.attempt(), CrashPhase.BEFORE_EXECUTE);

            ActivityContext context = new ActivityContext(runId, step.stepName(), execute.attempt(),
                    execute.inputJson(), jsonCodec);
            ActivityOutcome outcome = activityExecutor.execute(step.kind(), context, step.timeout());
            crash.maybeCrash(runId, step.stepName(), execute.attempt(), CrashPhase.AFTER_EXECUTE_BEFORE_COMMIT);

            AppendResult closed = history.append(outcome.toRecord(opened.record(), clock.millis()));
            if (closed.isConflict()) {
                log.warn("Attempt outcome rejected, reloading run. runId={}, step={}, attempt={}, reason={}",
                        runId, step.stepName(), execute.attempt(), closed.conflictReason());
                return;
            }
            sink.recordAppended(closed.record());
            crash.maybeCrash(runId, step.stepName(), execute.attempt(), CrashPhase.AFTER_COMMIT);
        } catch (SQLException | RuntimeException e) {
            log.error("Attempt could not be recorded, run will be re-evaluated. runId={}, step={}, attempt={}",
                    runId, step.stepName(), execute.attempt(), e);
        } finally {
            heldLeases.remove(runId);
            busyRuns.remove(runId);
            slots.release();
            enqueue(runId, clock.millis());
            requestTick();
        }
    }

    private boolean isLiveElsewhere(AttemptLease lease, long now) {
        return !lease.owner().equals(config.workerId()) && !lease.isStale(now);
    }

    private void closeOrphanedAttempt(RunHistory run, Decision.AwaitInFlight inFlight, AttemptLease lease,
                                      long now) throws SQLException {
        StepRecord orphan = null;
        for (StepRecord record : run.records()) {
            if (record.stepName().equals(inFlight.stepName())
                    && record.attempt() == inFlight.attempt()
                    && record.status() == StepStatus.SCHEDULED) {
                orphan = record;
            }
        }
        if (orphan == null) {
            return;
        }
        String reason = lease == null || lease.owner().equals(config.workerId())
                ? "attempt orphaned: no live worker owned it"
                : "attempt orphaned: lease of " + lease.owner() + " expired";
        AppendResult result = history.append(orphan.timedOut(reason, now));
        if (result.isConflict()) {
            log.debug("Orphaned attempt already closed. runId={}, step={}, reason={}",
                    run.runId(), inFlight.stepName(), result.conflictReason());
            return;
        }
        log.warn("Closed orphaned attempt as timed out. runId={}, step={}, attempt={}, reason={}",
                run.runId(), inFlight.stepName(), inFlight.attempt(), reason);
        sink.recordAppended(result.record());
    }

    private void renewHeldLeases() {
        long expiresAt = clock.millis() + config.leaseDuration().toMillis();
        for (AttemptLease lease : heldLeases.values()) {
            try {
                if (!history.renewLease(lease.extendedTo(expiresAt))) {
                    log.warn("Lease lost, outcome may be rejected. runId={}, step={}, attempt={}",
                            lease.runId(), lease.stepName(), lease.attempt());
                }
            } catch (SQLException | RuntimeException e) {
                log.warn("Could not renew lease, will retry. runId={}, step={}, attempt={}",
                        lease.runId(), lease.stepName(), lease.attempt(), e);
            }
        }
    }

    private void terminate(RunHistory run, Decision decision) {
        if (activeRuns.contains(run.runId())) {
            sink.runTerminated(engine.view(run), decision);
        }
        markInactive(run.runId());
    }

    private void markInactive(String runId) {
        activeRuns.remove(runId);
        synchronized (idleMonitor) {
            idleMonitor.notifyAll();
        }
    }

    private void enqueue(String runId, long dueAtMs) {
        synchronized (queue) {
            Long existing = queuedDue.get(runId);
            if (existing != null && existing <= dueAtMs) {
                return;
            }
            if (existing != null) {
                queue.removeIf(entry -> entry.runId().equals(runId));
            }
            queue.add(new DueRun(runId, dueAtMs, enqueueOrder++));
            queuedDue.put(runId, dueAtMs);
        }
        long delayMs = dueAtMs - clock.millis();
        if (started && delayMs > 0) {
            try {
                ticker.schedule(this::safeTick, delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Scheduler is shutting down, timer for run {} not set", runId);
            }
        }
    }

    private List<String> pollDue(long now) {
        List<String> due = new ArrayList<>();
        synchronized (queue) {
            while (!queue.isEmpty() && queue.peek().dueAtMs() <= now) {
                DueRun entry = queue.poll();
                queuedDue.remove(entry.runId());
                due.add(entry.runId());
            }
        }
        return due;
    }

    private void requestTick() {
        if (!started) {
            return;
        }
        try {
            ticker.execute(this::safeTick);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler is shutting down, tick request ignored");
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    @Override
    public void close() {
        started = false;
        ticker.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Step workers still busy after {}s, interrupting", SHUTDOWN_GRACE_SECONDS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        heartbeat.shutdownNow();
        log.info("Scheduler stopped. activeRuns={}", activeRuns.size());
    }

    private record DueRun(String runId, long dueAtMs, long order) {
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
