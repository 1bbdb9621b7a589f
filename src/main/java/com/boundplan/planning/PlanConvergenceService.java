package com.boundplan.planning;

import static com.boundplan.planning.PlanningConstants.*;

import com.boundplan.config.BoundPlanProperties;
import com.boundplan.planning.api.SessionStateStore;
import com.boundplan.planning.model.BlockerType;
import com.boundplan.planning.model.DevelopmentOutcome;
import com.boundplan.planning.model.DraftPlan;
import com.boundplan.planning.model.NextInputRequest;
import com.boundplan.planning.model.PresentedMessage;
import com.boundplan.planning.model.SessionState;
import com.boundplan.planning.model.TurnResult;
import com.boundplan.planning.service.FieldExtractor;
import com.boundplan.planning.service.PlanDeveloper;
import com.boundplan.planning.service.PlanPresenter;
import com.boundplan.planning.service.ProfileEnricher;
import com.boundplan.tools.ToolCapabilityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for the bound planning phase. Each call is one turn: the session is loaded,
 * developed once, and persisted before returning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanConvergenceService {

    private final SessionStateStore sessionStateStore;
    private final PlanDeveloper planDeveloper;
    private final PlanPresenter planPresenter;
    private final FieldExtractor fieldExtractor;
    private final ProfileEnricher profileEnricher;
    private final ToolCapabilityRegistry toolCapabilityRegistry;
    private final BoundPlanProperties properties;

    public SessionState startSession(String sessionId, DraftPlan draftPlan, Map<String, Object> taskCatalog,
                                     Set<String> initialKnownFields) {
        log.info("Starting bound planning session {}", sessionId);
        SessionState state = sessionStateStore.create(sessionId, initialKnownFields);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("gates_count", draftPlan.gates().size());
        summary.put("total_steps", draftPlan.totalSteps());
        state.getKnownContext().put(CONTEXT_DRAFT_PLAN_SUMMARY, summary);

        DevelopmentOutcome outcome = planDeveloper.develop(state, draftPlan, taskCatalog, toolCapabilityRegistry);
        state.setLastBoundPlanSpec(outcome.boundPlanSpec());
        state.setLastNextInputRequest(outcome.nextInputRequest());
        sessionStateStore.persist(sessionId, state);
        log.info("Session {} started with readiness {}", sessionId, outcome.planReadiness());
        return state;
    }

    public TurnResult handleUserMessage(String sessionId, String message, DraftPlan draftPlan,
                                        Map<String, Object> taskCatalog) {
        SessionState state = sessionStateStore.load(sessionId);
        log.debug("Handling message for session {} (known fields={})", sessionId, state.getKnownFields().size());

        Map<String, String> extracted = fieldExtractor.extract(message, state.getLastNextInputRequest());
        if (!extracted.isEmpty()) {
            state.rememberAll(extracted);
            NextInputRequest answered = state.getLastNextInputRequest();
            if (answered != null && answered.blockerType() == BlockerType.MISSING_PREFERENCE) {
                recordPreferences(state, extracted);
            }
            log.debug("Session {} learned fields {}", sessionId, extracted.keySet());
        }
        if (properties.getProfiles().isEnrichmentEnabled()) {
            fieldExtractor.enrichmentIdentifier(extracted, message)
                    .ifPresent(identifier -> enrich(state, identifier));
        }

        DevelopmentOutcome outcome = planDeveloper.develop(state, draftPlan, taskCatalog, toolCapabilityRegistry);
        PresentedMessage presented = planPresenter.present(sessionId, outcome.boundPlanSpec());

        state.setLastBoundPlanSpec(outcome.boundPlanSpec());
        state.setLastNextInputRequest(outcome.nextInputRequest());
        sessionStateStore.persist(sessionId, state);

        log.debug("Session {} turn complete: readiness={}, question={}", sessionId, outcome.planReadiness(),
                presented.question() != null);
        return new TurnResult(presented.message(), presented.question(), outcome.planReadiness(), outcome.boundPlanSpec());
    }

    private void recordPreferences(SessionState state, Map<String, String> extracted) {
        Map<String, Object> preferences = state.getUserPreferences() != null
                ? new LinkedHashMap<>(state.getUserPreferences())
                : new LinkedHashMap<>();
        preferences.putAll(extracted);
        state.setUserPreferences(preferences);
    }

    private void enrich(SessionState state, String identifier) {
        try {
            Map<String, Object> profile = profileEnricher.fetch(identifier);
            if (profile == null) {
                log.debug("No profile found for session {}", state.getSessionId());
                return;
            }
            int before = state.getKnownFields().size();
            profile.forEach((field, value) -> {
                if (ProfileEnricher.isPresent(value)) {
                    state.remember(field, value);
                }
            });
            state.getKnownContext().put(CONTEXT_PROFILE_SUMMARY, profileSummary(profile));
            log.debug("Profile added {} field(s) to session {}", state.getKnownFields().size() - before,
                    state.getSessionId());
        } catch (Exception ex) {
            log.warn("Profile enrichment failed for session {}: {}", state.getSessionId(), ex.getMessage(), ex);
        }
    }

    private Map<String, Object> profileSummary(Map<String, Object> profile) {
        Map<String, Object> record = profile.get(FIELD_PROFILE) instanceof Map<?, ?> raw
                ? new LinkedHashMap<>(castRecord(raw))
                : Map.of();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("patient_id", Optional.ofNullable(profile.get("patient_id")).orElse(record.get("patient_id")));
        summary.put("has_emr_data", ProfileEnricher.isPresent(record.get(ProfileEnricher.EMR_DATA)));
        summary.put("has_system_data", ProfileEnricher.isPresent(record.get(ProfileEnricher.SYSTEM_DATA)));
        summary.put("has_health_plan_data", ProfileEnricher.isPresent(record.get(ProfileEnricher.HEALTH_PLAN_DATA)));
        return summary;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castRecord(Map<?, ?> raw) {
        return (Map<String, Object>) raw;
    }
}
