package com.pagepilot.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.Observation;
import com.pagepilot.models.PageElement;
import com.pagepilot.models.Session;
import com.pagepilot.util.Values;

import java.util.List;

/**
 * Builds the planner system prompt and the per-step observation prompt.
 */
public class DecisionPromptBuilder {

    public static final int TEXT_SNIPPET_LIMIT = 1200;
    public static final int ELEMENT_LIMIT = 40;

    private static final String[] SCHEMA_AND_RULES = {
        "Return strict JSON only.",
        "Schema:",
        "{",
        "  \"reasoning\": \"string\",",
        "  \"action\": {",
        "    \"type\": \"click|click_at|type|scroll|keypress|navigate|new_tab|wait|finish\",",
        "    \"target\": { \"element_id\": \"e_1\", \"selector\": \"optional css selector\" },",
        "    \"args\": { \"text\": \"for type\", \"key\": \"for keypress\", \"dy\": 800, \"url\": \"for navigate/new_tab\", \"ms\": 1000, \"x\": 0.5, \"y\": 0.7, \"normalized\": true }",
        "  },",
        "  \"success_criteria\": [{\"type\":\"url_contains|text_visible|title_contains\",\"value\":\"...\"}],",
        "  \"fallback_action\": {\"type\":\"scroll\",\"args\":{\"dy\":500}},",
        "  \"final_answer\": \"optional for finish\"",
        "}",
        "",
        "Rules:",
        "1. Use element_id when possible.",
        "2. Choose one action only.",
        "3. If goal is already achieved, use finish.",
        "4. Do not include markdown fences.",
        "5. For scroll-down, prefer large movement (roughly 75-90% of viewport) to reduce overlap.",
        "6. If scroll is already at bottom/top and no progress, do not keep scrolling forever."
    };

    private final ObjectMapper mapper;

    public DecisionPromptBuilder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String systemPrompt(String responseLanguage) {
        String language = responseLanguage == null || responseLanguage.isBlank()
            ? AgentConfig.DEFAULT_RESPONSE_LANGUAGE
            : Values.truncate(responseLanguage.trim(), 40);
        return String.join(" ",
            "You are a browser automation planner.",
            "You must return strict JSON only.",
            "Think about the current page and choose one next action.",
            "Use safe, reversible actions first.",
            "When the goal appears completed, return action.type=finish.",
            "Write reasoning and final_answer in " + language + ".");
    }

    /**
     * Observation payload the model sees: page summary, loop state and queued user instructions.
     */
    public ObjectNode buildPromptData(Session session, Observation observation, List<String> instructions) {
        ObjectNode data = mapper.createObjectNode();
        data.put("goal", session.getGoal());
        data.put("step", session.getStep());
        data.put("response_language", session.getConfig().getResponseLanguage());
        data.put("current_url", observation.getUrl());
        data.put("page_title", observation.getTitle());

        ObjectNode viewport = data.putObject("viewport");
        viewport.put("width", observation.getViewportWidth());
        viewport.put("height", observation.getViewportHeight());

        ObjectNode scroll = data.putObject("scroll");
        scroll.put("x", observation.getScrollX());
        scroll.put("y", observation.getScrollY());
        scroll.put("maxY", observation.getMaxScrollY());
        scroll.put("atTop", observation.isAtTop());
        scroll.put("atBottom", observation.isAtBottom());

        if (session.getLastAction() != null) {
            data.set("last_action", mapper.valueToTree(session.getLastAction()));
        } else {
            data.putNull("last_action");
        }
        String summary = session.getLastChangeSummary();
        if (summary == null || summary.isEmpty()) {
            data.putNull("last_change_summary");
        } else {
            data.put("last_change_summary", summary);
        }

        ArrayNode pending = data.putArray("pending_user_instructions");
        if (instructions != null) {
            instructions.forEach(pending::add);
        }

        String snippet = observation.getTextSnippet();
        data.put("text_snippet", snippet.length() > TEXT_SNIPPET_LIMIT ? snippet.substring(0, TEXT_SNIPPET_LIMIT) : snippet);

        ArrayNode elements = data.putArray("elements");
        List<PageElement> observed = observation.getElements();
        for (int i = 0; i < Math.min(ELEMENT_LIMIT, observed.size()); i++) {
            PageElement element = observed.get(i);
            ObjectNode node = elements.addObject();
            putIfPresent(node, "id", element.getId());
            putIfPresent(node, "tag", element.getTag());
            putIfPresent(node, "type", element.getType());
            putIfPresent(node, "label", element.getLabel());
            putIfPresent(node, "text", element.getText());
            putIfPresent(node, "placeholder", element.getPlaceholder());
            putIfPresent(node, "ariaLabel", element.getAriaLabel());
        }
        return data;
    }

    public String buildPromptText(ObjectNode promptData, String responseLanguage, String retryHint)
        throws JsonProcessingException {
        StringBuilder sb = new StringBuilder();
        for (String line : SCHEMA_AND_RULES) {
            sb.append(line).append('\n');
        }
        sb.append("7. Write reasoning and final_answer in ").append(responseLanguage).append(".\n");
        sb.append("8. If the target is visible in screenshot but not reliably present in elements, ")
            .append("use click_at with normalized coordinates (0 to 1).\n");
        sb.append("9. Use new_tab when the user asks to open a page in a new tab.\n");

        if (retryHint != null && !retryHint.isEmpty()) {
            sb.append('\n').append("Retry correction:").append('\n').append(retryHint).append('\n');
        }

        sb.append('\n').append("Current observation JSON:").append('\n');
        sb.append(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(promptData));
        return sb.toString();
    }

    public String retryHint(DecisionParseException error) {
        StringBuilder sb = new StringBuilder()
            .append("The previous response was invalid.\n")
            .append("Return exactly one JSON object and include action.\n")
            .append("Do not add markdown, prose, or code fences.");
        String snippet = error != null && error.getRawSnippet() != null ? error.getRawSnippet().trim() : "";
        if (!snippet.isEmpty()) {
            sb.append("\nPrevious invalid output (truncated): ").append(snippet);
        }
        return sb.toString();
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
