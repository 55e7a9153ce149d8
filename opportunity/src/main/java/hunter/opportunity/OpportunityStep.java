package hunter.opportunity;

import hunter.engine.StepKind;

public enum OpportunityStep implements StepKind {
    ANALYZE_ACCOUNT("analyze-account"),
    DELIVER_BRIEF("deliver-brief");

    private final String stepName;

    OpportunityStep(String stepName) {
        this.stepName = stepName;
    }

    @Override
    public String stepName() {
        return stepName;
    }
}
