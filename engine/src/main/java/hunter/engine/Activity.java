package hunter.engine;

/**
 * Adapter around one call to an external collaborator. Implementations must be
 * safe to call again with the same context: a retry after a timeout may
 * overlap with a late original call.
 */
@FunctionalInterface
public interface Activity {
    Object execute(ActivityContext context) throws Exception;
}
