package hunter.engine;

import java.util.Objects;

/**
 * Thrown by activity adapters that already know how a failure should be
 * treated by the retry policy.
 */
public class ActivityException extends Exception {
    private final ErrorKind errorKind;

    public ActivityException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
    }

    public ActivityException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
    }

    public ErrorKind errorKind() {
        return errorKind;
    }
}
