package com.boundplan.planning.service;

import static com.boundplan.planning.PlanningConstants.*;

import com.boundplan.planning.api.GenerationProvider;
import com.boundplan.planning.model.Blocker;
import com.boundplan.planning.model.BlockerType;
import com.boundplan.planning.model.BoundPlanSpec;
import com.boundplan.planning.model.BoundStep;
import com.boundplan.planning.model.PromptTemplate;
import com.boundplan.planning.model.ToolSelection;
import com.boundplan.tools.ToolCapabilityRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs a tie-break generation round for steps whose tool match is ambiguous.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolAmbiguityResolver {

    private final GenerationProvider generationProvider;
    private final PlanningPromptService promptService;
    private final ResponseExtractor responseExtractor;
    private final JsonProcessingService jsonProcessingService;
    private final GenerationAuditService auditService;

    /**
     * Returns the plan with tie-break selections applied. Selections naming tools outside
     * the registry are ignored. Never throws; on any failure the input plan is returned.
     */
    public BoundPlanSpec resolve(String sessionId, BoundPlanSpec spec, ToolCapabilityRegistry registry) {
        List<Blocker> ambiguous = spec.blockersOfType(BlockerType.TOOL_AMBIGUITY);
        if (ambiguous.isEmpty()) {
            return spec;
        }
        log.debug("Resolving {} tool ambiguity blocker(s) for session {}", ambiguous.size(), sessionId);
        try {
            Optional<PromptTemplate> template = promptService.templateFor(sessionId, STEP_TIEBREAKER);
            if (template.isEmpty()) {
                return spec;
            }
            Map<String, String> context = new LinkedHashMap<>();
            context.put("BOUND_PLAN_SPEC", jsonProcessingService.toJson(spec));
            context.put("TOOL_AMBIGUITY_BLOCKERS", jsonProcessingService.toJson(ambiguous));
            context.put("TOOL_REGISTRY", jsonProcessingService.toJson(registry.descriptors()));
            String systemPrompt = promptService.systemPrompt(template.get(), context);

            String response = generationProvider.generate(TIEBREAK_USER_PROMPT, systemPrompt,
                    template.get().generation());
            auditService.record(sessionId, PURPOSE_TIEBREAK, template.get().key().asString(),
                    systemPrompt, TIEBREAK_USER_PROMPT, response);

            List<ToolSelection> selections = readSelections(responseExtractor.parse(response), registry);
            return apply(spec, selections);
        } catch (Exception ex) {
            log.error("Tool ambiguity resolution failed for session {}: {}", sessionId, ex.getMessage(), ex);
            return spec;
        }
    }

    private List<ToolSelection> readSelections(JsonNode root, ToolCapabilityRegistry registry) {
        List<ToolSelection> selections = new ArrayList<>();
        JsonNode items = root.path("tool_selections");
        if (!items.isArray()) {
            return selections;
        }
        for (JsonNode item : items) {
            String stepId = item.path("step_id").asText(null);
            String tool = item.path("selected_tool").asText(null);
            if (!StringUtils.hasText(stepId) || !StringUtils.hasText(tool)) {
                continue;
            }
            if (!registry.contains(tool)) {
                log.warn("Tie-break selected unknown tool {} for step {}; ignored.", tool, stepId);
                continue;
            }
            selections.add(new ToolSelection(stepId, tool));
        }
        return selections;
    }

    private BoundPlanSpec apply(BoundPlanSpec spec, List<ToolSelection> selections) {
        if (selections.isEmpty()) {
            return spec;
        }
        Map<String, String> byStep = new LinkedHashMap<>();
        selections.forEach(s -> byStep.put(s.stepId(), s.selectedTool()));

        Set<String> bound = new HashSet<>();
        List<BoundStep> steps = new ArrayList<>();
        for (BoundStep step : spec.steps()) {
            String tool = byStep.get(step.id());
            if (tool != null) {
                steps.add(step.withSelectedTool(tool));
                bound.add(step.id());
                log.debug("Tie-break bound step {} to {}", step.id(), tool);
            } else {
                steps.add(step);
            }
        }
        List<Blocker> blockers = spec.blockers().stream()
                .filter(b -> !(b.type() == BlockerType.TOOL_AMBIGUITY && b.stepId() != null && bound.contains(b.stepId())))
                .toList();
        return spec.withSteps(steps).withBlockers(blockers);
    }
}
