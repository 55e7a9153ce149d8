package hunter.engine;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one attempt of one step against its handler.
 *
 * <p>Each call runs on its own thread so the wall-clock timeout can be enforced
 * without waiting for the collaborator: on expiry the call is interrupted and
 * {@link ActivityOutcome.TimedOut} is returned straight away, whatever the call
 * does afterwards is discarded. Failures are mapped through the
 * {@link ErrorClassifier}, so callers only ever see an {@link ErrorKind}.
 */
public final class ActivityExecutor<K extends Enum<K> & StepKind> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ActivityExecutor.class);

    private final EnumMap<K, Activity> handlers;
    private final ErrorClassifier errorClassifier;
    private final JsonCodec jsonCodec;
    private final ExecutorService callThreads;

    public ActivityExecutor(Class<K> kindType, Map<K, Activity> handlers, ErrorClassifier errorClassifier,
                            JsonCodec jsonCodec) {
        Objects.requireNonNull(kindType, "kindType");
        Objects.requireNonNull(handlers, "handlers");
        this.handlers = new EnumMap<>(kindType);
        this.handlers.putAll(handlers);
        for (K kind : kindType.getEnumConstants()) {
            if (this.handlers.get(kind) == null) {
                throw new IllegalStateException("No activity registered for step " + kind.stepName());
            }
        }
        this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.callThreads = Executors.newCachedThreadPool(new CallThreadFactory());
    }

    public ActivityOutcome execute(K kind, ActivityContext context, Duration timeout) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(timeout, "timeout");
        Activity activity = handlers.get(kind);

        Future<Object> call = callThreads.submit(() -> activity.execute(context));
        Object output;
        try {
            output = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Activity timed out. runId={}, step={}, attempt={}, timeoutMs={}",
                    context.runId(), context.stepName(), context.attempt(), timeout.toMillis());
            return new ActivityOutcome.TimedOut(timeout);
        } catch (ExecutionException e) {
            return failed(context, e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return new ActivityOutcome.Failed(ErrorKind.TRANSIENT, "interrupted while waiting for " + kind.stepName());
        }

        try {
            return new ActivityOutcome.Succeeded(jsonCodec.toJson(output));
        } catch (IllegalStateException e) {
            log.error("Activity output could not be serialized. runId={}, step={}",
                    context.runId(), context.stepName(), e);
            return new ActivityOutcome.Failed(ErrorKind.PERMANENT, describe(e));
        }
    }

    private ActivityOutcome failed(ActivityContext context, Throwable cause) {
        ErrorKind kind = errorClassifier.classify(cause);
        if (kind == ErrorKind.TIMEOUT) {
            kind = ErrorKind.TRANSIENT;
        }
        log.warn("Activity failed. runId={}, step={}, attempt={}, errorKind={}, error={}",
                context.runId(), context.stepName(), context.attempt(), kind, describe(cause));
        if (log.isDebugEnabled()) {
            log.debug("Activity failure detail. runId={}, step={}", context.runId(), context.stepName(), cause);
        }
        return new ActivityOutcome.Failed(kind, describe(cause));
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank()
                ? failure.getClass().getSimpleName()
                : failure.getClass().getSimpleName() + ": " + message;
    }

    @Override
    public void close() {
        callThreads.shutdownNow();
    }

    private static final class CallThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "activity-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
