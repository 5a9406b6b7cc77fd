package com.jdocs.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form model text into a {@link Directive}.
 *
 * <p>Extraction order is fixed: a {@code ```json} fence holding an object, then any fence
 * holding an object, then the whole trimmed reply.
 */
public class ResponseInterpreter {

    private static final Logger log = LoggerFactory.getLogger(ResponseInterpreter.class);

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*(\\{.*\\})\\s*```", Pattern.DOTALL);
    private static final Pattern ANY_FENCE = Pattern.compile("```\\s*(\\{.*\\})\\s*```", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    static final String TOOL_KEY = "tool";
    static final String ARGUMENTS_KEY = "arguments";
    static final String ANSWER_KEY = "answer";

    private final ObjectMapper mapper;
    private final ArgumentAliasTable aliases;

    public ResponseInterpreter(ArgumentAliasTable aliases) {
        this(new ObjectMapper(), aliases);
    }

    public ResponseInterpreter(ObjectMapper mapper, ArgumentAliasTable aliases) {
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.aliases = aliases;
    }

    /**
     * Pull the JSON candidate out of a reply: fenced body if any, trimmed reply otherwise.
     */
    public static String extractJson(String rawText) {
        String stripped = rawText.strip();

        Matcher m = JSON_FENCE.matcher(stripped);
        if (m.find()) {
            return m.group(1).strip();
        }
        m = ANY_FENCE.matcher(stripped);
        if (m.find()) {
            return m.group(1).strip();
        }
        return stripped;
    }

    public Directive interpret(String rawText, Set<String> toolNames) {
        String candidate = extractJson(rawText);

        JsonNode value;
        try {
            value = mapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            log.debug("Reply is not JSON: {}", e.getOriginalMessage());
            return new Directive.Malformed(rawText, candidate);
        }
        if (value == null || value.isMissingNode()) {
            return new Directive.Malformed(rawText, candidate);
        }

        if (!value.isObject()) {
            return new Directive.Unrecognized(rawText, value);
        }
        if (value.has(ANSWER_KEY) && !value.has(TOOL_KEY)) {
            return new Directive.Answer(text(value.get(ANSWER_KEY)));
        }
        if (value.has(TOOL_KEY)) {
            String name = text(value.get(TOOL_KEY));
            if (!toolNames.contains(name)) {
                log.debug("Model asked for tool '{}' which is not in the catalog {}", name, toolNames);
            }
            Map<String, Object> arguments = aliases.normalize(name, arguments(value.get(ARGUMENTS_KEY)));
            return new Directive.ToolCall(name, arguments);
        }
        return new Directive.Unrecognized(rawText, value);
    }

    private Map<String, Object> arguments(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) return "";
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
