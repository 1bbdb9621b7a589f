package com.boundplan.planning.service;

import com.boundplan.config.BoundPlanProperties;
import com.boundplan.planning.api.PromptCatalog;
import com.boundplan.planning.model.PromptKey;
import com.boundplan.planning.model.PromptTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlanningPromptService {

    private static final String DEFAULT_ROLE = "You are a workflow planning assistant.";

    private final BoundPlanProperties properties;
    private final PromptCatalog promptCatalog;
    private final ConvergenceModeResolver modeResolver;

    public Optional<PromptTemplate> templateFor(String sessionId, String step) {
        PromptKey key = new PromptKey(properties.getModule(), properties.getDomain(),
                modeResolver.resolve(sessionId), step);
        Optional<PromptTemplate> template = promptCatalog.find(key);
        if (template.isEmpty()) {
            log.warn("No prompt template for {} (session {}).", key, sessionId);
        }
        return template;
    }

    /**
     * Assembles the system prompt. Context sections keep their insertion order and are
     * labeled by their map key.
     */
    public String systemPrompt(PromptTemplate template, Map<String, String> contextSections) {
        StringBuilder sb = new StringBuilder();
        sb.append("### ROLE\n")
                .append(StringUtils.hasText(template.role()) ? template.role().trim() : DEFAULT_ROLE);

        boolean hasTemplateContext = StringUtils.hasText(template.context());
        if (hasTemplateContext || !contextSections.isEmpty()) {
            sb.append("\n\n### CONTEXT_DATA");
            if (hasTemplateContext) {
                sb.append("\n").append(template.context().trim());
            }
            contextSections.forEach((label, content) ->
                    sb.append("\n\n--- ").append(label).append(" ---\n").append(content));
        }

        if (!template.constraints().isEmpty()) {
            sb.append("\n\n### CONSTRAINTS");
            template.constraints().forEach(c -> sb.append("\n- ").append(c));
        }
        if (StringUtils.hasText(template.outputFormat())) {
            sb.append("\n\n### OUTPUT_FORMAT\n").append(template.outputFormat().trim());
        }
        if (StringUtils.hasText(template.analysis())) {
            sb.append("\n\n### CURRENT_TASK\n").append(template.analysis().trim());
        }
        return sb.toString();
    }
}
