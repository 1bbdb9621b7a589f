package com.boundplan.planning.model;

import org.springframework.lang.Nullable;

/**
 * Sampling parameters passed through to the generation provider. Unset values keep the
 * provider defaults.
 */
public record GenerationSettings(
        @Nullable Double temperature,
        @Nullable Integer maxOutputTokens,
        @Nullable Double topP,
        @Nullable Integer topK
) {

    public static GenerationSettings defaults() {
        return new GenerationSettings(null, null, null, null);
    }
}
