package com.boundplan.planning.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BoundStep(
        String id,
        String description,
        @Nullable String selectedTool,
        Map<String, Object> toolParameters,
        List<String> dependsOn
) {

    public BoundStep {
        description = description != null ? description : "";
        toolParameters = toolParameters != null ? new LinkedHashMap<>(toolParameters) : new LinkedHashMap<>();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    public static BoundStep unbound(String id, String description, List<String> dependsOn) {
        return new BoundStep(id, description, null, Map.of(), dependsOn);
    }

    public BoundStep withSelectedTool(@Nullable String tool) {
        return new BoundStep(id, description, tool, toolParameters, dependsOn);
    }
}
