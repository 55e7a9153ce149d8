package hunter.opportunity;

import java.util.List;

public record OpportunityBrief(
        String accountId,
        String companyName,
        int intentScore,
        String intentLabel,
        String strategyType,
        String primaryFocus,
        String signalSummary,
        List<String> nextActions,
        List<String> recommendedActions,
        String urgency,
        String briefText,
        long generatedAtMs) {

    public OpportunityBrief {
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
    }
}
