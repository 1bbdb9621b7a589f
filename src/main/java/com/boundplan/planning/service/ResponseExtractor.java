package com.boundplan.planning.service;

import static com.boundplan.planning.PlanningConstants.*;

import com.boundplan.planning.model.BlockerType;
import com.boundplan.planning.model.PlanReadiness;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a JSON document from free-form generation output. Tries a fenced block first,
 * then the first balanced object anywhere in the text, then the whole text. Never throws:
 * unrecoverable output yields the canonical degraded plan.
 */
@Service
@Slf4j
public class ResponseExtractor {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*\\n?(.*?)\\n?```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ResponseExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonNode parse(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("Empty generation response; returning degraded plan.");
            return degraded();
        }

        Matcher fenced = FENCED_BLOCK.matcher(raw);
        if (fenced.find()) {
            String block = fenced.group(1).strip();
            JsonNode parsed = tryParse(block);
            if (parsed != null) {
                log.debug("Parsed response from fenced block.");
                return parsed;
            }
            parsed = tryParse(extractBalancedObject(block));
            if (parsed != null) {
                log.debug("Parsed balanced object inside fenced block.");
                return parsed;
            }
        }

        JsonNode parsed = tryParse(extractBalancedObject(raw));
        if (parsed != null) {
            log.debug("Parsed balanced object from full response.");
            return parsed;
        }

        parsed = tryParse(raw.strip());
        if (parsed != null) {
            log.debug("Parsed full response directly.");
            return parsed;
        }

        log.warn("All parsing strategies failed. Snippet: {}", JsonProcessingService.truncate(raw, 240));
        return degraded();
    }

    /**
     * Returns the substring from the first '{' to its matching '}', or null if the braces
     * never balance.
     */
    @Nullable
    static String extractBalancedObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }

    @Nullable
    private JsonNode tryParse(@Nullable String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        try {
            JsonNode node = strictReader.readTree(candidate);
            // scalars and empty input are not plans
            return node != null && node.isContainerNode() ? node : null;
        } catch (Exception ex) {
            log.debug("Candidate is not valid JSON: {}", ex.getMessage());
            return null;
        }
    }

    public ObjectNode degraded() {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode meta = root.putObject("meta");
        meta.put("plan_id", UNKNOWN);
        meta.put("workflow", UNKNOWN);
        meta.put("phase", PHASE_BOUND);
        meta.put("schema_version", SCHEMA_VERSION);
        root.putArray("steps");
        ArrayNode blockers = root.putArray("blockers");
        ObjectNode blocker = blockers.addObject();
        blocker.put("type", BlockerType.MISSING_INFORMATION.value());
        blocker.putNull("step_id");
        blocker.put("message", PARSE_FAILURE_MESSAGE);
        blocker.put("priority", BlockerType.MISSING_INFORMATION.rank());
        root.put("plan_readiness", PlanReadiness.BLOCKED.name());
        root.putNull("next_input_request");
        return root;
    }
}
