package hunter.engine;

import java.util.List;

final class AppendRules {
    private AppendRules() {
    }

    static void checkLease(StepRecord record, AttemptLease lease) {
        if (lease == null) {
            return;
        }
        if (record.status() != StepStatus.SCHEDULED) {
            throw new IllegalArgumentException("Only a scheduled record can carry a lease, not " + record.status());
        }
        if (!lease.covers(record)) {
            throw new IllegalArgumentException("Lease " + lease + " does not cover attempt "
                    + record.attempt() + " of " + record.stepName());
        }
    }

    /**
     * Returns why {@code candidate} may not follow {@code stepRecords} (the
     * records already appended for the same run and step), or null if it may.
     */
    static String conflictReason(List<StepRecord> stepRecords, StepRecord candidate) {
        StepRecord last = stepRecords.isEmpty() ? null : stepRecords.get(stepRecords.size() - 1);
        boolean outstanding = last != null && last.status() == StepStatus.SCHEDULED;

        if (candidate.status() == StepStatus.SCHEDULED) {
            if (outstanding) {
                return "attempt " + last.attempt() + " of " + candidate.stepName() + " is still in flight";
            }
            if (last != null && last.status() == StepStatus.SUCCEEDED) {
                return candidate.stepName() + " already succeeded";
            }
            int expected = last == null ? 1 : last.attempt() + 1;
            if (candidate.attempt() != expected) {
                return "expected attempt " + expected + " of " + candidate.stepName()
                        + " but got " + candidate.attempt();
            }
            return null;
        }

        if (!outstanding) {
            return "no outstanding attempt of " + candidate.stepName() + " to record an outcome for";
        }
        if (last.attempt() != candidate.attempt()) {
            return "outstanding attempt of " + candidate.stepName() + " is " + last.attempt()
                    + ", not " + candidate.attempt();
        }
        return null;
    }
}
