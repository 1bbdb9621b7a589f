package com.boundplan.planning.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

import com.boundplan.config.BoundPlanProperties;
import com.boundplan.planning.api.PromptCatalog;
import com.boundplan.planning.model.GenerationSettings;
import com.boundplan.planning.model.PromptKey;
import com.boundplan.planning.model.PromptTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ExtendWith(MockitoExtension.class)
class PlanningPromptServiceTest {

    @Mock
    private PromptCatalog promptCatalog;

    @Mock
    private ConvergenceModeResolver modeResolver;

    private PlanningPromptService service;

    @BeforeEach
    void setUp() {
        service = new PlanningPromptService(new BoundPlanProperties(), promptCatalog, modeResolver);
    }

    @Test
    void testTemplateKeyUsesSessionMode() {
        PromptKey key = new PromptKey("workflow", "eligibility", "EXPERT", "bounded_plan_builder");
        PromptTemplate template = new PromptTemplate(key, "role", null, null, List.of(), null, null);
        when(modeResolver.resolve("s-1")).thenReturn("EXPERT");
        when(promptCatalog.find(key)).thenReturn(Optional.of(template));

        assertEquals(Optional.of(template), service.templateFor("s-1", "bounded_plan_builder"));
        assertEquals("workflow:eligibility:EXPERT:bounded_plan_builder", key.asString());
    }

    @Test
    void testMissingTemplate() {
        when(modeResolver.resolve("s-1")).thenReturn("TABULA_RASA");
        assertEquals(Optional.empty(), service.templateFor("s-1", "tool_tiebreaker"));
    }

    @Test
    void testSystemPromptSections() {
        PromptTemplate template = new PromptTemplate(
                new PromptKey("workflow", "eligibility", "TABULA_RASA", "bounded_plan_builder"),
                "You bind plans.", "Eligibility domain.", "Build the plan.",
                List.of("Use only registered tools.", "Do not guess."), "Return JSON.", GenerationSettings.defaults());
        Map<String, String> context = new LinkedHashMap<>();
        context.put("DRAFT_PLAN", "{}");
        context.put("KNOWN_FIELDS", "[]");

        String prompt = service.systemPrompt(template, context);

        assertTrue(prompt.startsWith("### ROLE\nYou bind plans."));
        assertTrue(prompt.contains("### CONTEXT_DATA\nEligibility domain."));
        assertTrue(prompt.contains("--- DRAFT_PLAN ---\n{}"));
        assertTrue(prompt.indexOf("--- DRAFT_PLAN ---") < prompt.indexOf("--- KNOWN_FIELDS ---"));
        assertTrue(prompt.contains("### CONSTRAINTS\n- Use only registered tools.\n- Do not guess."));
        assertTrue(prompt.contains("### OUTPUT_FORMAT\nReturn JSON."));
        assertTrue(prompt.endsWith("### CURRENT_TASK\nBuild the plan."));
    }

    @Test
    void testSystemPromptDefaults() {
        PromptTemplate template = new PromptTemplate(
                new PromptKey("workflow", "eligibility", "TABULA_RASA", "bounded_plan_presenter"),
                null, null, null, null, null, null);

        String prompt = service.systemPrompt(template, Map.of());

        assertEquals("### ROLE\nYou are a workflow planning assistant.", prompt);
    }
}
