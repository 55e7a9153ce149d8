package hunter.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.sql.SQLNonTransientException;

/**
 * Baseline classification. Anything it does not recognise is treated as
 * transient, so unknown failures are retried up to the policy's limit.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    @Override
    public ErrorKind classify(Throwable failure) {
        if (failure instanceof ActivityException activityException) {
            return activityException.errorKind() == ErrorKind.TIMEOUT
                    ? ErrorKind.TRANSIENT
                    : activityException.errorKind();
        }
        if (failure instanceof IllegalArgumentException || failure instanceof JsonProcessingException) {
            return ErrorKind.MALFORMED_INPUT;
        }
        if (failure instanceof SecurityException || failure instanceof SQLNonTransientException) {
            return ErrorKind.PERMANENT;
        }
        // I/O, transient SQL and interruption land here too.
        return ErrorKind.TRANSIENT;
    }
}
