package com.boundplan.planning.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NextInputRequest(
        BlockerType blockerType,
        @Nullable String stepId,
        String message,
        List<String> writesTo
) {

    public NextInputRequest {
        writesTo = writesTo != null ? List.copyOf(writesTo) : List.of();
    }
}
