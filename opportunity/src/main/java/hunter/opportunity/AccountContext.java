package hunter.opportunity;

import hunter.engine.Signal;
import hunter.engine.SignalEvent;
import java.util.List;

/**
 * What the analysis step knows about an account: the signal attributes in
 * typed form plus the observed events, oldest first.
 */
public record AccountContext(
        String accountId,
        String companyName,
        String industry,
        Integer employeeCount,
        String revenue,
        int intentScore,
        List<SignalEvent> events) {

    public AccountContext {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId must not be blank");
        }
        if (intentScore < 0 || intentScore > 100) {
            throw new IllegalArgumentException("intentScore must be within 0..100 but was " + intentScore);
        }
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static AccountContext from(Signal signal) {
        String employees = signal.attribute(Signal.EMPLOYEE_COUNT);
        Integer employeeCount;
        try {
            employeeCount = employees == null || employees.isBlank() ? null : Integer.valueOf(employees.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("employee_count is not a number for " + signal.accountId()
                    + ": " + employees, e);
        }
        String companyName = signal.attribute(Signal.COMPANY_NAME);
        return new AccountContext(
                signal.accountId(),
                companyName == null || companyName.isBlank() ? "Unknown Company" : companyName,
                orUnknown(signal.attribute(Signal.INDUSTRY)),
                employeeCount,
                orUnknown(signal.attribute(Signal.REVENUE)),
                signal.intentScore(),
                signal.observedMetrics());
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "Unknown" : value;
    }
}
