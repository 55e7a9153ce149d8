package hunter.engine;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import java.io.IOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ActivityExecutorTest {
    private final JsonCodec jsonCodec = new JsonCodec();
    private ActivityExecutor<TestStep> executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    @Test
    void successIsSerializedToJson() {
        executor = executor(context -> Map.of("account", context.input(Map.class).get("account")),
                context -> "unused");

        ActivityOutcome outcome = executor.execute(TestStep.FETCH, context("{\"account\":\"acme\"}"),
                Duration.ofSeconds(5));

        ActivityOutcome.Succeeded succeeded = Assertions.assertInstanceOf(ActivityOutcome.Succeeded.class, outcome);
        Assertions.assertEquals("{\"account\":\"acme\"}", succeeded.outputJson());
    }

    @Test
    void failuresAreClassified() {
        executor = executor(
                context -> {
                    throw new ActivityException(ErrorKind.PERMANENT, "account deleted");
                },
                context -> {
                    throw new IOException("connection reset");
                });

        ActivityOutcome.Failed permanent = Assertions.assertInstanceOf(ActivityOutcome.Failed.class,
                executor.execute(TestStep.FETCH, context("{}"), Duration.ofSeconds(5)));
        ActivityOutcome.Failed transientFailure = Assertions.assertInstanceOf(ActivityOutcome.Failed.class,
                executor.execute(TestStep.PUBLISH, context("{}"), Duration.ofSeconds(5)));

        Assertions.assertEquals(ErrorKind.PERMANENT, permanent.errorKind());
        Assertions.assertEquals("ActivityException: account deleted", permanent.message());
        Assertions.assertEquals(ErrorKind.TRANSIENT, transientFailure.errorKind());
    }

    @Test
    void malformedInputIsNotRetryable() {
        executor = executor(context -> context.input(Map.class), context -> "unused");

        ActivityOutcome.Failed failed = Assertions.assertInstanceOf(ActivityOutcome.Failed.class,
                executor.execute(TestStep.FETCH, context("{not json"), Duration.ofSeconds(5)));

        Assertions.assertEquals(ErrorKind.MALFORMED_INPUT, failed.errorKind());
    }

    @Test
    void timeoutReturnsWithoutWaitingForTheCall() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        executor = executor(context -> {
            try {
                Thread.sleep(30_000L);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        }, context -> "unused");

        long started = System.nanoTime();
        ActivityOutcome outcome = executor.execute(TestStep.FETCH, context("{}"), Duration.ofMillis(100));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        Assertions.assertInstanceOf(ActivityOutcome.TimedOut.class, outcome);
        Assertions.assertTrue(elapsedMs < 5_000L, "waited " + elapsedMs + "ms");
        Assertions.assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    void everyStepNeedsAnActivity() {
        Map<TestStep, Activity> partial = new EnumMap<>(TestStep.class);
        partial.put(TestStep.FETCH, context -> "ok");

        Assertions.assertThrows(IllegalStateException.class,
                () -> new ActivityExecutor<>(TestStep.class, partial, new DefaultErrorClassifier(), jsonCodec));
    }

    @Test
    void defaultClassifierMapsCommonFailures() {
        DefaultErrorClassifier classifier = new DefaultErrorClassifier();

        Assertions.assertEquals(ErrorKind.MALFORMED_INPUT, classifier.classify(new IllegalArgumentException("x")));
        Assertions.assertEquals(ErrorKind.MALFORMED_INPUT,
                classifier.classify(new JsonParseException((JsonParser) null, "bad json")));
        Assertions.assertEquals(ErrorKind.PERMANENT, classifier.classify(new SecurityException("denied")));
        Assertions.assertEquals(ErrorKind.TRANSIENT, classifier.classify(new IllegalStateException("flaky")));
    }

    private ActivityExecutor<TestStep> executor(Activity fetch, Activity publish) {
        Map<TestStep, Activity> handlers = new EnumMap<>(TestStep.class);
        handlers.put(TestStep.FETCH, fetch);
        handlers.put(TestStep.PUBLISH, publish);
        return new ActivityExecutor<>(TestStep.class, handlers, new DefaultErrorClassifier(), jsonCodec);
    }

    private ActivityContext context(String inputJson) {
        return new ActivityContext("run-1", "fetch", 1, inputJson, jsonCodec);
    }
}
