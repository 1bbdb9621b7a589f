package com.boundplan.planning.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DevelopmentOutcome(
        BoundPlanSpec boundPlanSpec,
        PlanReadiness planReadiness,
        @Nullable NextInputRequest nextInputRequest
) {
}
