package com.boundplan.planning.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Draft plan produced by the gate stage: named gates, each carrying unbound steps.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DraftPlan(
        @Nullable String name,
        @Nullable String goal,
        List<Gate> gates
) {

    public DraftPlan {
        gates = gates != null ? List.copyOf(gates) : List.of();
    }

    public int totalSteps() {
        return gates.stream().mapToInt(g -> g.steps().size()).sum();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Gate(@Nullable String name, List<Step> steps) {
        public Gate {
            steps = steps != null ? List.copyOf(steps) : List.of();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Step(
            @Nullable String id,
            @Nullable String description,
            List<String> inputs,
            List<String> dependsOn
    ) {
        public Step {
            inputs = inputs != null ? List.copyOf(inputs) : List.of();
            dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        }
    }
}
