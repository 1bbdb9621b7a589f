package com.boundplan.planning.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * A resolved generation template. Sections mirror the layout of the assembled system prompt.
 */
public record PromptTemplate(
        PromptKey key,
        @Nullable String role,
        @Nullable String context,
        @Nullable String analysis,
        List<String> constraints,
        @Nullable String outputFormat,
        GenerationSettings generation
) {

    public PromptTemplate {
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        generation = generation != null ? generation : GenerationSettings.defaults();
    }
}
