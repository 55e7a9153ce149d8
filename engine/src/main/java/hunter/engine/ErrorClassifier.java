package hunter.engine;

/**
 * Maps a collaborator's native failure onto {@link ErrorKind}. Never returns
 * {@link ErrorKind#TIMEOUT}; timeouts are detected by the executor.
 */
@FunctionalInterface
public interface ErrorClassifier {
    ErrorKind classify(Throwable failure);
}
