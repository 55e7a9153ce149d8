package hunter.opportunity;

import hunter.engine.SignalEvent;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-based analysis: picks a sales playbook from the account's industry and
 * activity, and rates urgency from pricing and demo events. Deterministic for
 * a given account apart from the generation timestamp.
 */
public final class PlaybookAnalysisService implements AnalysisService {
    private static final Logger log = LoggerFactory.getLogger(PlaybookAnalysisService.class);

    static final String ENTERPRISE_SECURITY = "enterprise_security";
    static final String SAAS_GROWTH = "saas_growth";
    static final String DIGITAL_TRANSFORMATION = "enterprise_digital_transformation";
    static final String GENERAL_ENTERPRISE = "general_enterprise";

    private static final Map<String, String> PRIMARY_FOCUS = Map.of(
            ENTERPRISE_SECURITY, "Compliance & Security Operations",
            SAAS_GROWTH, "Scaling & Engineering Efficiency",
            DIGITAL_TRANSFORMATION, "Digital Transformation & ROI",
            GENERAL_ENTERPRISE, "Operational Excellence");

    private static final List<String> RECOMMENDED_ACTIONS = List.of(
            "Schedule discovery call",
            "Send relevant case studies",
            "Prepare demo environment",
            "Connect with industry references",
            "Develop custom ROI projection");

    private final BriefFormatter formatter;
    private final Clock clock;

    public PlaybookAnalysisService(BriefFormatter formatter) {
        this(formatter, Clock.systemUTC());
    }

    public PlaybookAnalysisService(BriefFormatter formatter, Clock clock) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public OpportunityBrief analyze(AccountContext account) {
        Objects.requireNonNull(account, "account");
        String strategyType = strategyType(account);
        OpportunityBrief draft = new OpportunityBrief(
                account.accountId(),
                account.companyName(),
                account.intentScore(),
                intentLabel(account.intentScore()),
                strategyType,
                PRIMARY_FOCUS.getOrDefault(strategyType, "Custom Enterprise Solution"),
                summarizeSignals(account.events()),
                nextActions(strategyType),
                RECOMMENDED_ACTIONS,
                urgency(account.events()),
                null,
                clock.millis());
        OpportunityBrief brief = withText(draft, formatter.briefText(draft, account));
        log.info("Account analyzed. accountId={}, strategy={}, urgency={}",
                account.accountId(), strategyType, brief.urgency());
        return brief;
    }

    static String intentLabel(int score) {
        if (score >= 90) {
            return "VERY HIGH";
        }
        if (score >= 80) {
            return "HIGH";
        }
        if (score >= 70) {
            return "MEDIUM-HIGH";
        }
        if (score >= 60) {
            return "MEDIUM";
        }
        return "LOW";
    }

    static String strategyType(AccountContext account) {
        String industry = account.industry().toLowerCase(Locale.ROOT);
        String context = describe(account).toLowerCase(Locale.ROOT);
        if (industry.contains("financial") || context.contains("security")) {
            return ENTERPRISE_SECURITY;
        }
        if (industry.contains("saas") || context.contains("startup")) {
            return SAAS_GROWTH;
        }
        if (context.contains("enterprise") || industry.contains("manufacturing")) {
            return DIGITAL_TRANSFORMATION;
        }
        return GENERAL_ENTERPRISE;
    }

    static String urgency(List<SignalEvent> events) {
        if (events.isEmpty()) {
            return "LOW";
        }
        long pricing = events.stream().filter(event -> typeOf(event).contains("pricing")).count();
        long demo = events.stream().filter(event -> typeOf(event).contains("demo")).count();
        if (demo > 0 || pricing >= 2) {
            return "URGENT (Contact within 24hrs)";
        }
        if (pricing > 0) {
            return "HIGH (Contact within 48hrs)";
        }
        return "MEDIUM (Contact within 1 week)";
    }

    static String summarizeSignals(List<SignalEvent> events) {
        if (events.isEmpty()) {
            return "No recent activity";
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SignalEvent event : events) {
            counts.merge(titleCase(event.type() == null ? "unknown" : event.type()), 1, Integer::sum);
        }
        List<String> parts = new ArrayList<>();
        counts.forEach((type, count) -> parts.add(count > 1 ? count + "x " + type : type));
        return String.join(", ", parts);
    }

    static String titleCase(String value) {
        StringBuilder builder = new StringBuilder();
        for (String word : value.replace('_', ' ').trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return builder.toString();
    }

    private static List<String> nextActions(String strategyType) {
        List<String> actions = new ArrayList<>(List.of(
                "Schedule discovery call within 24 hours",
                "Send relevant case study and ROI calculator",
                "Prepare industry-specific demo scenario"));
        switch (strategyType) {
            case ENTERPRISE_SECURITY -> actions.add("Include compliance gap assessment offer");
            case SAAS_GROWTH -> actions.add("Offer 14-day free trial setup");
            case DIGITAL_TRANSFORMATION -> actions.add("Schedule executive briefing session");
            default -> {
            }
        }
        return actions;
    }

    private static String describe(AccountContext account) {
        StringBuilder context = new StringBuilder()
                .append("Company: ").append(account.companyName()).append('\n')
                .append("Industry: ").append(account.industry()).append('\n')
                .append("Revenue: ").append(account.revenue()).append('\n');
        for (SignalEvent event : account.events()) {
            context.append(titleCase(typeOf(event))).append(" by ")
                    .append(event.actor() == null ? "Unknown Role" : event.actor()).append('\n');
        }
        return context.toString();
    }

    private static String typeOf(SignalEvent event) {
        return event.type() == null ? "" : event.type().toLowerCase(Locale.ROOT);
    }

    private static OpportunityBrief withText(OpportunityBrief brief, String text) {
        return new OpportunityBrief(brief.accountId(), brief.companyName(), brief.intentScore(),
                brief.intentLabel(), brief.strategyType(), brief.primaryFocus(), brief.signalSummary(),
                brief.nextActions(), brief.recommendedActions(), brief.urgency(), text, brief.generatedAtMs());
    }
}
