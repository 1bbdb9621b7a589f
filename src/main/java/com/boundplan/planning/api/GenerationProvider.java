package com.boundplan.planning.api;

import com.boundplan.planning.model.GenerationSettings;

/**
 * Text-generation collaborator. Output is free text and may be malformed.
 */
public interface GenerationProvider {

    /**
     * Generates text for a prompt.
     *
     * @param prompt The user-turn prompt.
     * @param instructions The system instructions.
     * @param settings Sampling parameters for this call.
     * @return The raw generated text.
     * @throws GenerationException if the provider call fails.
     */
    String generate(String prompt, String instructions, GenerationSettings settings);
}
