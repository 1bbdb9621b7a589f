package com.boundplan.planning.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Reasons a bound plan cannot proceed yet. The rank orders the questions asked of the user,
 * lowest first.
 */
public enum BlockerType {
    MISSING_PREFERENCE("missing_preference", 1),
    MISSING_PERMISSION("missing_permission", 2),
    TOOL_GAP("tool_gap", 3),
    TOOL_AMBIGUITY("tool_ambiguity", 4),
    MISSING_INFORMATION("missing_information", 5),
    TIMELINE_RISK("timeline_risk", 6),
    HUMAN_REQUIRED("human_required", 7),
    OTHER("other", 8),
    POLICY_CONFLICT("policy_conflict", 8);

    private final String value;
    private final int rank;

    BlockerType(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    /**
     * Tool gaps and policy conflicts need resolution outside the conversation.
     */
    public boolean isHardStop() {
        return this == TOOL_GAP || this == POLICY_CONFLICT;
    }

    @JsonCreator
    public static BlockerType fromValue(String raw) {
        if (raw == null) {
            return OTHER;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (BlockerType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
