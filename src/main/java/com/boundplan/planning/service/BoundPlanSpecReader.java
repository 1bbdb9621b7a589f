package com.boundplan.planning.service;

import static com.boundplan.planning.PlanningConstants.PHASE_BOUND;
import static com.boundplan.planning.PlanningConstants.UNKNOWN;

import com.boundplan.planning.model.Blocker;
import com.boundplan.planning.model.BlockerType;
import com.boundplan.planning.model.BoundPlanSpec;
import com.boundplan.planning.model.BoundStep;
import com.boundplan.planning.model.PlanMeta;
import com.boundplan.planning.model.PlanReadiness;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads an extracted JSON tree into a {@link BoundPlanSpec}, tolerating missing or mistyped
 * members. Readiness and the next input request are recomputed downstream, so the values
 * found in the tree are kept only as hints.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BoundPlanSpecReader {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ResponseExtractor responseExtractor;

    public BoundPlanSpec read(@Nullable JsonNode root) {
        if (root == null || !root.isObject()) {
            log.warn("Generated plan is not a JSON object; using degraded plan.");
            root = responseExtractor.degraded();
        }
        return new BoundPlanSpec(
                readMeta(root.path("meta")),
                readSteps(root.path("steps")),
                readBlockers(root.path("blockers")),
                readReadiness(root.path("plan_readiness")),
                null);
    }

    private PlanMeta readMeta(JsonNode meta) {
        if (!meta.isObject()) {
            return PlanMeta.unknown();
        }
        return new PlanMeta(
                text(meta, "plan_id", UNKNOWN),
                text(meta, "workflow", UNKNOWN),
                text(meta, "phase", PHASE_BOUND),
                text(meta, "schema_version", null));
    }

    private List<BoundStep> readSteps(JsonNode steps) {
        List<BoundStep> result = new ArrayList<>();
        if (!steps.isArray()) {
            return result;
        }
        int index = 0;
        for (JsonNode step : steps) {
            index++;
            if (!step.isObject()) {
                continue;
            }
            Map<String, Object> parameters = step.path("tool_parameters").isObject()
                    ? objectMapper.convertValue(step.get("tool_parameters"), MAP_TYPE)
                    : new LinkedHashMap<>();
            result.add(new BoundStep(
                    text(step, "id", "step_" + index),
                    text(step, "description", ""),
                    text(step, "selected_tool", null),
                    parameters,
                    strings(step.path("depends_on"))));
        }
        return result;
    }

    private List<Blocker> readBlockers(JsonNode blockers) {
        List<Blocker> result = new ArrayList<>();
        if (!blockers.isArray()) {
            return result;
        }
        for (JsonNode blocker : blockers) {
            if (!blocker.isObject()) {
                continue;
            }
            BlockerType type = BlockerType.fromValue(text(blocker, "type", null));
            JsonNode priority = blocker.path("priority");
            result.add(new Blocker(
                    type,
                    text(blocker, "step_id", null),
                    text(blocker, "message", null),
                    priority.isNumber() ? priority.numberValue() : type.rank(),
                    strings(blocker.path("writes_to"))));
        }
        return result;
    }

    @Nullable
    private PlanReadiness readReadiness(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        try {
            return PlanReadiness.valueOf(node.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                if (item.isValueNode() && !item.isNull()) {
                    values.add(item.asText());
                }
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText());
        }
        return values;
    }

    private static String text(JsonNode node, String field, @Nullable String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return fallback;
        }
        String text = value.asText();
        return text.isBlank() ? fallback : text;
    }
}
