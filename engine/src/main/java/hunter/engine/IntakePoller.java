package hunter.engine;

import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Feeds polled signals through {@link SignalIntakeService}. Safe to run on a fixed-rate executor. */
public final class IntakePoller implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(IntakePoller.class);

    private final SignalIntake intake;
    private final SignalIntakeService intakeService;

    public IntakePoller(SignalIntake intake, SignalIntakeService intakeService) {
        this.intake = Objects.requireNonNull(intake, "intake");
        this.intakeService = Objects.requireNonNull(intakeService, "intakeService");
    }

    /** Polls once and returns the result for every signal received. */
    public List<IntakeResult> pollOnce() throws IOException, SQLException {
        List<Signal> signals = intake.poll();
        List<IntakeResult> results = new ArrayList<>(signals.size());
        int started = 0;
        for (Signal signal : signals) {
            IntakeResult result = intakeService.onSignal(signal);
            if (result.started()) {
                started++;
            }
            results.add(result);
        }
        if (!signals.isEmpty()) {
            log.info("Signal poll finished. received={}, started={}", signals.size(), started);
        }
        return results;
    }

    @Override
    public void run() {
        try {
            pollOnce();
        } catch (IOException | SQLException | RuntimeException e) {
            // Thrown out of a scheduled task this would cancel later polls.
            log.error("Signal poll failed, will retry on the next interval", e);
        }
    }
}
