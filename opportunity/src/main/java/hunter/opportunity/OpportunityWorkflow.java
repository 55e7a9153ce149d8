package hunter.opportunity;

import hunter.engine.Activity;
import hunter.engine.Signal;
import hunter.engine.WorkflowDefinition;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Analyze the account, then deliver the brief. Delivery uses the run id as
 * idempotency key, so a replayed delivery never posts twice.
 */
public final class OpportunityWorkflow {
    public static final String NAME = "opportunity";

    private OpportunityWorkflow() {
    }

    public static WorkflowDefinition<OpportunityStep> definition(OpportunitySettings settings) {
        return WorkflowDefinition.builder(NAME, OpportunityStep.class)
                .step(OpportunityStep.ANALYZE_ACCOUNT, settings.analysisRetry(), settings.analysisTimeout())
                .step(OpportunityStep.DELIVER_BRIEF, settings.deliveryRetry(), settings.deliveryTimeout())
                .build();
    }

    public static Map<OpportunityStep, Activity> activities(AnalysisService analysis, DeliveryService delivery,
                                                            String channel) {
        Objects.requireNonNull(analysis, "analysis");
        Objects.requireNonNull(delivery, "delivery");
        Map<OpportunityStep, Activity> activities = new EnumMap<>(OpportunityStep.class);
        activities.put(OpportunityStep.ANALYZE_ACCOUNT,
                context -> analysis.analyze(AccountContext.from(context.input(Signal.class))));
        activities.put(OpportunityStep.DELIVER_BRIEF,
                context -> delivery.deliver(context.input(OpportunityBrief.class), channel,
                        context.idempotencyKey()));
        return activities;
    }
}
