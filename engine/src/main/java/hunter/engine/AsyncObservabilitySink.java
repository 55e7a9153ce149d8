package hunter.engine;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fire-and-forget wrapper: events are handed to a single background thread
 * through a bounded queue. When the queue is full the event is dropped and
 * counted; the caller is never blocked.
 */
public final class AsyncObservabilitySink implements ObservabilitySink, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncObservabilitySink.class);
    private static final int DEFAULT_CAPACITY = 1_024;

    private final ObservabilitySink delegate;
    private final ThreadPoolExecutor dispatcher;
    private final AtomicLong dropped = new AtomicLong();

    public AsyncObservabilitySink(ObservabilitySink delegate) {
        this(delegate, DEFAULT_CAPACITY);
    }

    public AsyncObservabilitySink(ObservabilitySink delegate, int capacity) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.dispatcher = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "observability-sink");
                    thread.setDaemon(true);
                    return thread;
                },
                (rejected, executor) -> {
                    long total = dropped.incrementAndGet();
                    if (total == 1 || total % 100 == 0) {
                        log.warn("Observability queue full, events dropped so far: {}", total);
                    }
                });
    }

    @Override
    public void recordAppended(StepRecord record) {
        dispatch(() -> delegate.recordAppended(record));
    }

    @Override
    public void runTerminated(WorkflowRunView run, Decision decision) {
        dispatch(() -> delegate.runTerminated(run, decision));
    }

    public long droppedEvents() {
        return dropped.get();
    }

    private void dispatch(Runnable event) {
        dispatcher.execute(() -> {
            try {
                event.run();
            } catch (RuntimeException e) {
                log.warn("Observability sink failed to handle event", e);
            }
        });
    }

    /** Delivers what is already queued, waiting at most a few seconds. */
    @Override
    public void close() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Observability sink did not drain in time, {} events left", dispatcher.getQueue().size());
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
    }
}
