package com.boundplan.planning.model;

/**
 * Identifies a generation template as {@code module:domain:mode:step}.
 */
public record PromptKey(String module, String domain, String mode, String step) {

    public String asString() {
        return module + ":" + domain + ":" + mode + ":" + step;
    }

    @Override
    public String toString() {
        return asString();
    }
}
