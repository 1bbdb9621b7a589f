package com.boundplan.planning.service;

import com.boundplan.config.BoundPlanProperties;
import com.boundplan.planning.api.PromptCatalog;
import com.boundplan.planning.model.GenerationSettings;
import com.boundplan.planning.model.PromptKey;
import com.boundplan.planning.model.PromptTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Prompt catalog backed by the {@code boundplan.prompts} configuration list. Inactive
 * entries are not served.
 */
@Service
@Slf4j
public class PropertiesPromptCatalog implements PromptCatalog {

    private final Map<String, PromptTemplate> templates;

    public PropertiesPromptCatalog(BoundPlanProperties properties) {
        Map<String, PromptTemplate> index = new LinkedHashMap<>();
        for (BoundPlanProperties.PromptConfig config : properties.getPrompts()) {
            if (!config.isActive() || !StringUtils.hasText(config.getStep())) {
                continue;
            }
            PromptKey key = new PromptKey(config.getModule(), config.getDomain(), config.getMode(), config.getStep());
            PromptTemplate template = new PromptTemplate(
                    key,
                    config.getRole(),
                    config.getContext(),
                    config.getAnalysis(),
                    config.getConstraints(),
                    config.getOutputFormat(),
                    new GenerationSettings(config.getTemperature(), config.getMaxOutputTokens(),
                            config.getTopP(), config.getTopK()));
            if (index.putIfAbsent(key.asString(), template) != null) {
                log.warn("Duplicate prompt template {} ignored.", key);
            }
        }
        this.templates = Collections.unmodifiableMap(index);
        log.info("Prompt catalog loaded {} active templates.", templates.size());
    }

    @Override
    public Optional<PromptTemplate> find(PromptKey key) {
        return Optional.ofNullable(templates.get(key.asString()));
    }
}
