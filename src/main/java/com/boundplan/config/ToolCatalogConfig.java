package com.boundplan.config;

import com.boundplan.tools.ToolCapabilityRegistry;
import com.boundplan.tools.ToolDescriptor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the tool catalog once at startup from configured descriptors and from any tool
 * callbacks exposed by connected MCP servers. Configured entries win on name clashes.
 */
@Configuration
@Slf4j
public class ToolCatalogConfig {

    private static final TypeReference<Map<String, Object>> SCHEMA_TYPE = new TypeReference<>() {};

    @Bean
    public ToolCapabilityRegistry toolCapabilityRegistry(BoundPlanProperties properties,
                                                         ObjectProvider<ToolCallbackProvider> callbackProviders,
                                                         ObjectMapper objectMapper) {
        List<ToolDescriptor> descriptors = new ArrayList<>();
        for (BoundPlanProperties.ToolConfig tool : properties.getTools()) {
            if (!StringUtils.hasText(tool.getName())) {
                continue;
            }
            String name = tool.getName().trim();
            descriptors.add(new ToolDescriptor(name, tool.getDescription(),
                    parseSchema(objectMapper, name, tool.getInputSchema())));
        }
        callbackProviders.orderedStream().forEach(provider -> {
            for (ToolCallback callback : provider.getToolCallbacks()) {
                ToolDefinition definition = callback.getToolDefinition();
                descriptors.add(new ToolDescriptor(definition.name(), definition.description(),
                        parseSchema(objectMapper, definition.name(), definition.inputSchema())));
            }
        });
        ToolCapabilityRegistry registry = new ToolCapabilityRegistry(descriptors);
        log.info("Tool catalog initialized with {} tools.", registry.size());
        return registry;
    }

    private Map<String, Object> parseSchema(ObjectMapper objectMapper, String toolName, String inputSchema) {
        if (!StringUtils.hasText(inputSchema)) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(inputSchema, SCHEMA_TYPE);
        } catch (Exception ex) {
            log.warn("Unreadable input schema for tool {}: {}", toolName, ex.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
