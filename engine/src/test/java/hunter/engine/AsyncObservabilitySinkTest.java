package hunter.engine;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AsyncObservabilitySinkTest {

    @Test
    void deliversEventsOnBackgroundThread() {
        RecordingObservabilitySink delegate = new RecordingObservabilitySink();
        AsyncObservabilitySink sink = new AsyncObservabilitySink(delegate);

        sink.recordAppended(StepRecord.scheduled("run-1", "fetch", 1, "{}", 1L));
        sink.runTerminated(view(), new Decision.Complete("{}"));
        sink.close();

        Assertions.assertEquals(1, delegate.appended.size());
        Assertions.assertEquals(1, delegate.terminated.size());
        Assertions.assertEquals(0L, sink.droppedEvents());
    }

    @Test
    void dropsInsteadOfBlockingWhenQueueIsFull() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch blocked = new CountDownLatch(1);
        ObservabilitySink stuck = new ObservabilitySink() {
            @Override
            public void recordAppended(StepRecord record) {
                blocked.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public void runTerminated(WorkflowRunView run, Decision decision) {
            }
        };
        AsyncObservabilitySink sink = new AsyncObservabilitySink(stuck, 2);
        StepRecord record = StepRecord.scheduled("run-1", "fetch", 1, "{}", 1L);

        sink.recordAppended(record);
        Assertions.assertTrue(blocked.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 10; i++) {
            sink.recordAppended(record);
        }

        Assertions.assertEquals(8L, sink.droppedEvents());
        release.countDown();
        sink.close();
    }

    @Test
    void failingDelegateDoesNotStopDelivery() {
        RecordingObservabilitySink recording = new RecordingObservabilitySink();
        ObservabilitySink flaky = new ObservabilitySink() {
            @Override
            public void recordAppended(StepRecord record) {
                if (record.attempt() == 1) {
                    throw new IllegalStateException("sink down");
                }
                recording.recordAppended(record);
            }

            @Override
            public void runTerminated(WorkflowRunView run, Decision decision) {
            }
        };
        AsyncObservabilitySink sink = new AsyncObservabilitySink(flaky);

        sink.recordAppended(StepRecord.scheduled("run-1", "fetch", 1, "{}", 1L));
        sink.recordAppended(StepRecord.scheduled("run-1", "fetch", 2, "{}", 1L));
        sink.close();

        Assertions.assertEquals(1, recording.appended.size());
    }

    private static WorkflowRunView view() {
        return new WorkflowRunView("run-1", "acme", RunState.COMPLETED, 2, new Decision.Complete("{}"), 1L, 2L);
    }
}
