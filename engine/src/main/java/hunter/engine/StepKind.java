package hunter.engine;

/**
 * Implemented by the enum that lists the steps of one workflow. The step name is
 * what gets persisted in {@link StepRecord#stepName()}, so it must stay stable
 * across releases.
 */
public interface StepKind {
    String stepName();
}
