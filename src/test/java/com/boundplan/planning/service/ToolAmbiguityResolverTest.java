package com.boundplan.planning.service;

import static com.boundplan.planning.PlanningConstants.STEP_TIEBREAKER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.boundplan.planning.api.GenerationException;
import com.boundplan.planning.api.GenerationProvider;
import com.boundplan.planning.model.Blocker;
import com.boundplan.planning.model.BlockerType;
import com.boundplan.planning.model.BoundPlanSpec;
import com.boundplan.planning.model.BoundStep;
import com.boundplan.planning.model.GenerationSettings;
import com.boundplan.planning.model.PlanMeta;
import com.boundplan.planning.model.PromptKey;
import com.boundplan.planning.model.PromptTemplate;
import com.boundplan.tools.ToolCapabilityRegistry;
import com.boundplan.tools.ToolDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@ExtendWith(MockitoExtension.class)
class ToolAmbiguityResolverTest {

    private static final String SESSION_ID = "session-1";

    @Mock
    private GenerationProvider generationProvider;

    @Mock
    private PlanningPromptService promptService;

    @Mock
    private GenerationAuditService auditService;

    private ToolAmbiguityResolver resolver;
    private final ToolCapabilityRegistry registry = ToolCapabilityRegistry.of(
            new ToolDescriptor("eligibility_check", "Checks eligibility", Map.of()),
            new ToolDescriptor("benefits_check", "Checks benefits", Map.of()));
    private final PromptTemplate template = new PromptTemplate(
            new PromptKey("workflow", "eligibility", "TABULA_RASA", STEP_TIEBREAKER),
            "tie-breaker", null, null, List.of(), null, GenerationSettings.defaults());

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        resolver = new ToolAmbiguityResolver(generationProvider, promptService,
                new ResponseExtractor(objectMapper), new JsonProcessingService(objectMapper), auditService);
    }

    private static BoundPlanSpec ambiguousSpec() {
        return new BoundPlanSpec(PlanMeta.bound("p-1", "eligibility"),
                List.of(BoundStep.unbound("s1", "Check coverage", List.of()),
                        BoundStep.unbound("s2", "Check benefits", List.of("s1"))),
                List.of(Blocker.of(BlockerType.TOOL_AMBIGUITY, "s1", "Two tools fit s1"),
                        Blocker.of(BlockerType.TOOL_AMBIGUITY, "s2", "Two tools fit s2"),
                        Blocker.of(BlockerType.MISSING_INFORMATION, "s2", "Need member id")),
                null, null);
    }

    @Test
    void testSelectionsPatchSteps() {
        when(promptService.templateFor(SESSION_ID, STEP_TIEBREAKER)).thenReturn(Optional.of(template));
        when(promptService.systemPrompt(eq(template), anyMap())).thenReturn("system");
        when(generationProvider.generate(anyString(), anyString(), any(GenerationSettings.class))).thenReturn("""
                {"tool_selections": [{"step_id": "s1", "selected_tool": "eligibility_check"},
                                     {"step_id": "s2", "selected_tool": "made_up_tool"}]}
                """);

        BoundPlanSpec resolved = resolver.resolve(SESSION_ID, ambiguousSpec(), registry);

        assertEquals("eligibility_check", resolved.steps().get(0).selectedTool());
        assertNull(resolved.steps().get(1).selectedTool());
        List<Blocker> ambiguity = resolved.blockersOfType(BlockerType.TOOL_AMBIGUITY);
        assertEquals(1, ambiguity.size());
        assertEquals("s2", ambiguity.get(0).stepId());
        assertEquals(1, resolved.blockersOfType(BlockerType.MISSING_INFORMATION).size());
        verify(auditService).record(eq(SESSION_ID), eq("tool-tiebreak"), anyString(), eq("system"), anyString(), anyString());
    }

    @Test
    void testNoAmbiguityNoGeneration() {
        BoundPlanSpec spec = new BoundPlanSpec(PlanMeta.unknown(), List.of(), List.of(), null, null);
        assertSame(spec, resolver.resolve(SESSION_ID, spec, registry));
        verifyNoInteractions(promptService, generationProvider);
    }

    @Test
    void testMissingTemplateLeavesSpecUnchanged() {
        when(promptService.templateFor(SESSION_ID, STEP_TIEBREAKER)).thenReturn(Optional.empty());
        BoundPlanSpec spec = ambiguousSpec();

        assertSame(spec, resolver.resolve(SESSION_ID, spec, registry));
        verify(generationProvider, never()).generate(anyString(), anyString(), any());
    }

    @Test
    void testGenerationFailureLeavesSpecUnchanged() {
        when(promptService.templateFor(SESSION_ID, STEP_TIEBREAKER)).thenReturn(Optional.of(template));
        when(promptService.systemPrompt(eq(template), anyMap())).thenReturn("system");
        when(generationProvider.generate(anyString(), anyString(), any(GenerationSettings.class)))
                .thenThrow(new GenerationException("timeout"));
        BoundPlanSpec spec = ambiguousSpec();

        assertSame(spec, resolver.resolve(SESSION_ID, spec, registry));
    }

    @Test
    void testUnparseableSelectionsLeaveSpecUnchanged() {
        when(promptService.templateFor(SESSION_ID, STEP_TIEBREAKER)).thenReturn(Optional.of(template));
        when(promptService.systemPrompt(eq(template), anyMap())).thenReturn("system");
        when(generationProvider.generate(anyString(), anyString(), any(GenerationSettings.class))).thenReturn("no idea");
        BoundPlanSpec spec = ambiguousSpec();

        assertSame(spec, resolver.resolve(SESSION_ID, spec, registry));
    }
}
