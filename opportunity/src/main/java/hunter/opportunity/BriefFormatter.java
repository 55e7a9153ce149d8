package hunter.opportunity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/** Renders briefs as markdown text and as Slack-style block messages. */
public final class BriefFormatter {
    private final ObjectMapper mapper;

    public BriefFormatter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String briefText(OpportunityBrief brief, AccountContext account) {
        StringBuilder text = new StringBuilder()
                .append("*OPPORTUNITY BRIEF: ").append(brief.companyName()).append("*\n\n")
                .append("*Intent Analysis*\n")
                .append("- Intent Score: ").append(brief.intentScore()).append("/100 (")
                .append(brief.intentLabel()).append(")\n")
                .append("- Key Signals: ").append(brief.signalSummary()).append("\n\n")
                .append("*Company Profile*\n")
                .append("- Industry: ").append(account.industry()).append('\n')
                .append("- Size: ").append(account.employeeCount() == null ? "Unknown" : account.employeeCount())
                .append(" employees\n")
                .append("- Revenue: ").append(account.revenue()).append("\n\n")
                .append("*Recommended Approach*\n")
                .append("- Strategy Type: ").append(PlaybookAnalysisService.titleCase(brief.strategyType()))
                .append('\n')
                .append("- Primary Focus: ").append(brief.primaryFocus()).append("\n\n")
                .append("*Next Actions*\n");
        List<String> actions = brief.nextActions();
        for (int i = 0; i < actions.size(); i++) {
            text.append(i + 1).append(". ").append(actions.get(i)).append('\n');
        }
        text.append("\n*Urgency Level: ").append(brief.urgency()).append('*');
        return text.toString();
    }

    /** Channel message for {@code brief}, as JSON. */
    public String channelMessage(OpportunityBrief brief, String channel) {
        ObjectNode message = mapper.createObjectNode();
        message.put("channel", channel);
        message.put("text", "New opportunity: " + brief.companyName() + " (Intent: " + brief.intentScore() + "/100)");

        ArrayNode blocks = message.putArray("blocks");
        ObjectNode header = blocks.addObject().put("type", "header");
        header.putObject("text").put("type", "plain_text")
                .put("text", "New High-Intent Opportunity: " + brief.companyName());

        ObjectNode body = blocks.addObject().put("type", "section");
        body.putObject("text").put("type", "mrkdwn").put("text", brief.briefText());

        ArrayNode fields = blocks.addObject().put("type", "section").putArray("fields");
        fields.addObject().put("type", "mrkdwn").put("text", "*Intent Score:*\n" + brief.intentScore() + "/100");
        fields.addObject().put("type", "mrkdwn").put("text", "*Urgency:*\n" + brief.urgency());

        message.put("unfurl_links", false);
        message.put("unfurl_media", false);
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render channel message for " + brief.accountId(), e);
        }
    }
}
