package hunter.engine;

enum TestStep implements StepKind {
    FETCH("fetch"),
    PUBLISH("publish");

    private final String stepName;

    TestStep(String stepName) {
        this.stepName = stepName;
    }

    @Override
    public String stepName() {
        return stepName;
    }
}
