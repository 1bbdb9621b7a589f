package com.boundplan.planning.service;

import static com.boundplan.planning.PlanningConstants.*;

import com.boundplan.planning.api.GenerationProvider;
import com.boundplan.planning.model.Blocker;
import com.boundplan.planning.model.BlockerType;
import com.boundplan.planning.model.BoundPlanSpec;
import com.boundplan.planning.model.BoundStep;
import com.boundplan.planning.model.DevelopmentOutcome;
import com.boundplan.planning.model.DraftPlan;
import com.boundplan.planning.model.NextInputRequest;
import com.boundplan.planning.model.PlanMeta;
import com.boundplan.planning.model.PlanReadiness;
import com.boundplan.planning.model.PromptTemplate;
import com.boundplan.planning.model.SessionState;
import com.boundplan.tools.ToolCapabilityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Develops the bound plan for one turn: one generation round over the draft plan and the
 * session state, followed by validation, tie-breaking and readiness classification.
 * Generation failures propagate to the caller; everything downstream degrades instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanDeveloper {

    private final GenerationProvider generationProvider;
    private final PlanningPromptService promptService;
    private final ResponseExtractor responseExtractor;
    private final BoundPlanSpecReader specReader;
    private final ToolAmbiguityResolver ambiguityResolver;
    private final BlockerCatalog blockerCatalog;
    private final PriorityResolver priorityResolver;
    private final JsonProcessingService jsonProcessingService;
    private final GenerationAuditService auditService;

    public DevelopmentOutcome develop(SessionState state, DraftPlan draftPlan, Map<String, Object> taskCatalog,
                                      ToolCapabilityRegistry registry) {
        log.debug("Developing bound plan for session {} (draft steps={}, tools={}, known fields={})",
                state.getSessionId(), draftPlan.totalSteps(), registry.size(), state.getKnownFields().size());

        Optional<PromptTemplate> template = promptService.templateFor(state.getSessionId(), STEP_BUILDER);
        if (template.isEmpty()) {
            log.warn("Builder template missing for session {}; deriving plan from draft.", state.getSessionId());
            return finish(fallbackSpec(draftPlan, state));
        }

        String systemPrompt = promptService.systemPrompt(template.get(), developContext(state, draftPlan, taskCatalog, registry));
        String response = generationProvider.generate(DEVELOP_USER_PROMPT, systemPrompt, template.get().generation());
        auditService.record(state.getSessionId(), PURPOSE_DEVELOP, template.get().key().asString(),
                systemPrompt, DEVELOP_USER_PROMPT, response);
        log.debug("Builder response for session {}: {}", state.getSessionId(), JsonProcessingService.truncate(response, 100));

        BoundPlanSpec spec = validate(specReader.read(responseExtractor.parse(response)), registry);
        spec = ambiguityResolver.resolve(state.getSessionId(), spec, registry);
        return finish(spec);
    }

    private Map<String, String> developContext(SessionState state, DraftPlan draftPlan, Map<String, Object> taskCatalog,
                                               ToolCapabilityRegistry registry) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("DRAFT_PLAN", jsonProcessingService.toJson(draftPlan));
        context.put("TASK_CATALOG", jsonProcessingService.toJson(taskCatalog));
        context.put("TOOL_REGISTRY", jsonProcessingService.toJson(registry.descriptors()));
        context.put("KNOWN_FIELDS", jsonProcessingService.toJson(state.getKnownFields()));
        context.put("KNOWN_CONTEXT", jsonProcessingService.toJson(state.getKnownContext()));
        context.put("USER_PREFERENCES", jsonProcessingService.toJson(state.getUserPreferences()));
        context.put("GRANTED_PERMISSIONS", jsonProcessingService.toJson(state.getGrantedPermissions()));
        context.put("LAST_BOUND_PLAN_SPEC", jsonProcessingService.toJson(state.getLastBoundPlanSpec()));
        context.put("LAST_NEXT_INPUT_REQUEST", jsonProcessingService.toJson(state.getLastNextInputRequest()));
        return context;
    }

    BoundPlanSpec validate(BoundPlanSpec spec, ToolCapabilityRegistry registry) {
        if (!spec.meta().hasCanonicalSchema()) {
            log.warn("Generated plan declared schema_version={}; coercing to {}", spec.meta().schemaVersion(), SCHEMA_VERSION);
            spec = spec.withMeta(spec.meta().withCanonicalSchema());
        }
        List<BoundStep> steps = new ArrayList<>();
        for (BoundStep step : spec.steps()) {
            if (step.selectedTool() != null && !registry.contains(step.selectedTool())) {
                log.warn("Step {} selected unknown tool {}; cleared.", step.id(), step.selectedTool());
                steps.add(step.withSelectedTool(null));
            } else {
                steps.add(step);
            }
        }
        return spec.withSteps(steps);
    }

    BoundPlanSpec fallbackSpec(DraftPlan draftPlan, SessionState state) {
        List<BoundStep> steps = new ArrayList<>();
        List<Blocker> blockers = new ArrayList<>();
        for (DraftPlan.Gate gate : draftPlan.gates()) {
            for (DraftPlan.Step step : gate.steps()) {
                String stepId = StringUtils.hasText(step.id()) ? step.id() : "step_" + (steps.size() + 1);
                steps.add(BoundStep.unbound(stepId, step.description(), step.dependsOn()));

                List<String> missing = step.inputs().stream()
                        .filter(input -> !state.getKnownFields().contains(input))
                        .toList();
                if (!missing.isEmpty()) {
                    blockers.add(new Blocker(BlockerType.MISSING_INFORMATION, stepId,
                            MISSING_INFORMATION_PREFIX + String.join(", ", missing),
                            BlockerType.MISSING_INFORMATION.rank(), missing));
                }
            }
        }
        PlanMeta meta = PlanMeta.bound(
                StringUtils.hasText(draftPlan.name()) ? draftPlan.name() : UNKNOWN,
                StringUtils.hasText(draftPlan.goal()) ? draftPlan.goal() : UNKNOWN);
        log.debug("Fallback plan: steps={}, blockers={}", steps.size(), blockers.size());
        return new BoundPlanSpec(meta, steps, blockers, null, null);
    }

    private DevelopmentOutcome finish(BoundPlanSpec spec) {
        PlanReadiness readiness = blockerCatalog.readiness(spec.blockers());
        NextInputRequest request = priorityResolver.nextRequest(spec.blockers()).orElse(null);
        log.debug("Plan {} readiness={} next request={}", spec.meta().planId(), readiness,
                request != null ? request.blockerType().value() : "none");
        BoundPlanSpec finished = spec.withOutcome(readiness, request);
        return new DevelopmentOutcome(finished, readiness, request);
    }
}
