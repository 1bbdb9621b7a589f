package com.boundplan.planning;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.boundplan.config.BoundPlanProperties;
import com.boundplan.planning.api.GenerationException;
import com.boundplan.planning.api.SessionStateStore;
import com.boundplan.planning.model.BlockerType;
import com.boundplan.planning.model.BoundPlanSpec;
import com.boundplan.planning.model.DevelopmentOutcome;
import com.boundplan.planning.model.DraftPlan;
import com.boundplan.planning.model.NextInputRequest;
import com.boundplan.planning.model.PlanMeta;
import com.boundplan.planning.model.PlanReadiness;
import com.boundplan.planning.model.PresentedMessage;
import com.boundplan.planning.model.SessionState;
import com.boundplan.planning.model.TurnResult;
import com.boundplan.planning.service.FieldExtractor;
import com.boundplan.planning.service.PlanDeveloper;
import com.boundplan.planning.service.PlanPresenter;
import com.boundplan.planning.service.ProfileEnricher;
import com.boundplan.tools.ToolCapabilityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@ExtendWith(MockitoExtension.class)
class PlanConvergenceServiceTest {

    private static final String SESSION_ID = "session-1";

    @Mock
    private SessionStateStore sessionStateStore;

    @Mock
    private PlanDeveloper planDeveloper;

    @Mock
    private PlanPresenter planPresenter;

    @Mock
    private ProfileEnricher profileEnricher;

    private final BoundPlanProperties properties = new BoundPlanProperties();
    private final ToolCapabilityRegistry registry = ToolCapabilityRegistry.of();
    private final DraftPlan draftPlan = new DraftPlan("intake", "verify", List.of(new DraftPlan.Gate("g1", List.of(
            new DraftPlan.Step("s1", "Greet", List.of(), List.of()),
            new DraftPlan.Step("s2", "Look up", List.of("patient_name"), List.of("s1"))))));
    private PlanConvergenceService service;

    @BeforeEach
    void setUp() {
        service = new PlanConvergenceService(sessionStateStore, planDeveloper, planPresenter, new FieldExtractor(),
                profileEnricher, registry, properties);
    }

    private static DevelopmentOutcome readyOutcome() {
        BoundPlanSpec spec = new BoundPlanSpec(PlanMeta.bound("intake", "verify"), List.of(), List.of(),
                PlanReadiness.READY_FOR_COMPILATION, null);
        return new DevelopmentOutcome(spec, PlanReadiness.READY_FOR_COMPILATION, null);
    }

    private static SessionState awaitingPatientName() {
        SessionState state = new SessionState(SESSION_ID);
        state.setLastNextInputRequest(new NextInputRequest(BlockerType.MISSING_INFORMATION, "s2",
                "Missing information: patient_name", List.of("patient_name")));
        return state;
    }

    @Test
    @SuppressWarnings("unchecked")
    void testStartSession() {
        SessionState created = new SessionState(SESSION_ID);
        when(sessionStateStore.create(SESSION_ID, Set.of("member_id"))).thenReturn(created);
        when(planDeveloper.develop(eq(created), eq(draftPlan), anyMap(), eq(registry))).thenReturn(readyOutcome());

        SessionState state = service.startSession(SESSION_ID, draftPlan, Map.of(), Set.of("member_id"));

        Map<String, Object> summary = (Map<String, Object>) state.getKnownContext().get("draft_plan_summary");
        assertEquals(1, summary.get("gates_count"));
        assertEquals(2, summary.get("total_steps"));
        assertNotNull(state.getLastBoundPlanSpec());
        assertNull(state.getLastNextInputRequest());
        verify(sessionStateStore).persist(SESSION_ID, state);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testTurnExtractsEnrichesAndDevelops() {
        SessionState state = awaitingPatientName();
        when(sessionStateStore.load(SESSION_ID)).thenReturn(state);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("patient_id", "P-1");
        record.put("emr_data", Map.of("allergies", List.of()));
        Map<String, Object> profile = new HashMap<>();
        profile.put("patient_id", "P-1");
        profile.put("patient_name", "John Doe");
        profile.put("email", "");
        profile.put("phone", null);
        profile.put("patient_profile", record);
        when(profileEnricher.fetch("John Doe")).thenReturn(profile);
        DevelopmentOutcome outcome = readyOutcome();
        when(planDeveloper.develop(eq(state), eq(draftPlan), anyMap(), eq(registry))).thenReturn(outcome);
        when(planPresenter.present(SESSION_ID, outcome.boundPlanSpec()))
                .thenReturn(new PresentedMessage("All set.", null));

        TurnResult result = service.handleUserMessage(SESSION_ID, "patient_name: John Doe", draftPlan, Map.of());

        assertEquals("All set.", result.message());
        assertNull(result.question());
        assertEquals(PlanReadiness.READY_FOR_COMPILATION, result.planReadiness());
        assertTrue(state.getKnownFields().containsAll(Set.of("patient_name", "patient_id", "patient_profile")));
        assertFalse(state.getKnownFields().contains("email"));
        assertFalse(state.getKnownFields().contains("phone"));
        Map<String, Object> summary = (Map<String, Object>) state.getKnownContext().get("patient_profile_summary");
        assertEquals("P-1", summary.get("patient_id"));
        assertEquals(true, summary.get("has_emr_data"));
        assertEquals(false, summary.get("has_system_data"));
        assertEquals(false, summary.get("has_health_plan_data"));
        assertSame(outcome.boundPlanSpec(), state.getLastBoundPlanSpec());

        InOrder order = inOrder(profileEnricher, planDeveloper, planPresenter, sessionStateStore);
        order.verify(profileEnricher).fetch("John Doe");
        order.verify(planDeveloper).develop(eq(state), eq(draftPlan), anyMap(), eq(registry));
        order.verify(planPresenter).present(SESSION_ID, outcome.boundPlanSpec());
        order.verify(sessionStateStore).persist(SESSION_ID, state);
    }

    @Test
    void testEnrichmentFailureDoesNotFailTurn() {
        SessionState state = awaitingPatientName();
        when(sessionStateStore.load(SESSION_ID)).thenReturn(state);
        when(profileEnricher.fetch("Jane")).thenThrow(new IllegalStateException("directory down"));
        DevelopmentOutcome outcome = readyOutcome();
        when(planDeveloper.develop(eq(state), eq(draftPlan), anyMap(), eq(registry))).thenReturn(outcome);
        when(planPresenter.present(SESSION_ID, outcome.boundPlanSpec())).thenReturn(new PresentedMessage("ok", null));

        TurnResult result = service.handleUserMessage(SESSION_ID, "Jane", draftPlan, Map.of());

        assertEquals("ok", result.message());
        assertFalse(state.getKnownContext().containsKey("patient_profile_summary"));
        verify(sessionStateStore).persist(SESSION_ID, state);
    }

    @Test
    void testEnrichmentDisabled() {
        properties.getProfiles().setEnrichmentEnabled(false);
        SessionState state = awaitingPatientName();
        when(sessionStateStore.load(SESSION_ID)).thenReturn(state);
        DevelopmentOutcome outcome = readyOutcome();
        when(planDeveloper.develop(eq(state), eq(draftPlan), anyMap(), eq(registry))).thenReturn(outcome);
        when(planPresenter.present(SESSION_ID, outcome.boundPlanSpec())).thenReturn(new PresentedMessage("ok", null));

        service.handleUserMessage(SESSION_ID, "patient_name: John Doe", draftPlan, Map.of());

        assertEquals("John Doe", state.getKnownContext().get("patient_name"));
        verifyNoInteractions(profileEnricher);
    }

    @Test
    void testAnsweredPreferenceIsRecordedAsUserPreference() {
        properties.getProfiles().setEnrichmentEnabled(false);
        SessionState state = new SessionState(SESSION_ID);
        state.setUserPreferences(Map.of("language", "en"));
        state.setLastNextInputRequest(new NextInputRequest(BlockerType.MISSING_PREFERENCE, "s1",
                "How should we contact the patient?", List.of("contact_channel")));
        when(sessionStateStore.load(SESSION_ID)).thenReturn(state);
        DevelopmentOutcome outcome = readyOutcome();
        when(planDeveloper.develop(eq(state), eq(draftPlan), anyMap(), eq(registry))).thenReturn(outcome);
        when(planPresenter.present(SESSION_ID, outcome.boundPlanSpec())).thenReturn(new PresentedMessage("ok", null));

        service.handleUserMessage(SESSION_ID, "contact_channel: sms", draftPlan, Map.of());

        assertEquals(Map.of("language", "en", "contact_channel", "sms"), state.getUserPreferences());
        assertEquals("sms", state.getKnownContext().get("contact_channel"));
    }

    @Test
    void testAnsweredInformationIsNotAPreference() {
        properties.getProfiles().setEnrichmentEnabled(false);
        SessionState state = awaitingPatientName();
        when(sessionStateStore.load(SESSION_ID)).thenReturn(state);
        DevelopmentOutcome outcome = readyOutcome();
        when(planDeveloper.develop(eq(state), eq(draftPlan), anyMap(), eq(registry))).thenReturn(outcome);
        when(planPresenter.present(SESSION_ID, outcome.boundPlanSpec())).thenReturn(new PresentedMessage("ok", null));

        service.handleUserMessage(SESSION_ID, "patient_name: John Doe", draftPlan, Map.of());

        assertNull(state.getUserPreferences());
    }

    @Test
    void testLongMessageWithoutIdentifierSkipsEnrichment() {
        SessionState state = new SessionState(SESSION_ID);
        when(sessionStateStore.load(SESSION_ID)).thenReturn(state);
        DevelopmentOutcome outcome = readyOutcome();
        when(planDeveloper.develop(eq(state), eq(draftPlan), anyMap(), eq(registry))).thenReturn(outcome);
        when(planPresenter.present(SESSION_ID, outcome.boundPlanSpec())).thenReturn(new PresentedMessage("ok", null));

        service.handleUserMessage(SESSION_ID, "please continue with the plan as it is", draftPlan, Map.of());

        verifyNoInteractions(profileEnricher);
    }

    @Test
    void testGenerationFailurePropagatesWithoutPersisting() {
        SessionState state = new SessionState(SESSION_ID);
        when(sessionStateStore.load(SESSION_ID)).thenReturn(state);
        when(planDeveloper.develop(any(), any(), anyMap(), any())).thenThrow(new GenerationException("provider down"));

        assertThrows(GenerationException.class,
                () -> service.handleUserMessage(SESSION_ID, "continue with the next step please", draftPlan, Map.of()));
        verify(sessionStateStore, never()).persist(anyString(), any());
    }
}
