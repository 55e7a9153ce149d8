package hunter.opportunity;

import hunter.engine.ActivityException;
import hunter.engine.ErrorKind;

/** Failure of an analysis or delivery collaborator. */
public class OpportunityServiceException extends ActivityException {

    public OpportunityServiceException(String message, boolean retryable) {
        super(retryable ? ErrorKind.TRANSIENT : ErrorKind.PERMANENT, message);
    }

    public OpportunityServiceException(String message, boolean retryable, Throwable cause) {
        super(retryable ? ErrorKind.TRANSIENT : ErrorKind.PERMANENT, message, cause);
    }

    public boolean retryable() {
        return errorKind() == ErrorKind.TRANSIENT;
    }
}
