package com.boundplan.planning.service;

import static com.boundplan.planning.PlanningConstants.*;

import com.boundplan.planning.api.GenerationProvider;
import com.boundplan.planning.model.BoundPlanSpec;
import com.boundplan.planning.model.NextInputRequest;
import com.boundplan.planning.model.PresentedMessage;
import com.boundplan.planning.model.PromptTemplate;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the user-facing message for a turn. Falls back to a generic message built from
 * the next input request when no template is configured or generation fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanPresenter {

    private final GenerationProvider generationProvider;
    private final PlanningPromptService promptService;
    private final ResponseExtractor responseExtractor;
    private final JsonProcessingService jsonProcessingService;
    private final GenerationAuditService auditService;

    public PresentedMessage present(String sessionId, BoundPlanSpec spec) {
        NextInputRequest request = spec.nextInputRequest();
        try {
            Optional<PromptTemplate> template = promptService.templateFor(sessionId, STEP_PRESENTER);
            if (template.isEmpty()) {
                return fallback(request);
            }
            Map<String, String> context = new LinkedHashMap<>();
            context.put("BOUND_PLAN_SPEC", jsonProcessingService.toJson(spec));
            context.put("BLOCKERS", jsonProcessingService.toJson(spec.blockers()));
            context.put("NEXT_INPUT_REQUEST", jsonProcessingService.toJson(request));
            String systemPrompt = promptService.systemPrompt(template.get(), context);

            String response = generationProvider.generate(PRESENT_USER_PROMPT, systemPrompt, template.get().generation());
            auditService.record(sessionId, PURPOSE_PRESENT, template.get().key().asString(),
                    systemPrompt, PRESENT_USER_PROMPT, response);

            JsonNode parsed = responseExtractor.parse(response);
            String message = parsed.path("message").asText(null);
            String question = parsed.path("question").asText(null);
            return new PresentedMessage(
                    StringUtils.hasText(message) ? message : PRESENTER_DEFAULT_MESSAGE,
                    StringUtils.hasText(question) ? question : null);
        } catch (Exception ex) {
            log.error("Presenter failed for session {}: {}", sessionId, ex.getMessage(), ex);
            return new PresentedMessage(PRESENTER_FALLBACK_PREFIX + PRESENTER_FALLBACK_REQUEST,
                    request != null ? request.message() : null);
        }
    }

    private PresentedMessage fallback(NextInputRequest request) {
        if (request == null) {
            return new PresentedMessage(PRESENTER_FALLBACK_PREFIX + PRESENTER_IDLE_MESSAGE, null);
        }
        String requested = StringUtils.hasText(request.message()) ? request.message() : PRESENTER_FALLBACK_REQUEST;
        return new PresentedMessage(PRESENTER_FALLBACK_PREFIX + requested, request.message());
    }
}
