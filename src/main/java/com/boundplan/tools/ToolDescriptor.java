package com.boundplan.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes a deterministic tool a bound step may select.
 */
public record ToolDescriptor(
        String name,
        String description,
        @JsonProperty("parameters") Map<String, Object> parameterSchema
) {

    public ToolDescriptor {
        description = description != null ? description : "";
        parameterSchema = parameterSchema != null ? new LinkedHashMap<>(parameterSchema) : new LinkedHashMap<>();
    }
}
