package com.boundplan.planning.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Blocker(
        BlockerType type,
        @Nullable String stepId,
        @Nullable String message,
        Number priority,
        List<String> writesTo
) {

    public Blocker {
        type = type != null ? type : BlockerType.OTHER;
        priority = priority != null ? priority : type.rank();
        writesTo = writesTo != null ? List.copyOf(writesTo) : List.of();
    }

    public static Blocker of(BlockerType type, @Nullable String stepId, String message) {
        return new Blocker(type, stepId, message, type.rank(), List.of());
    }
}
