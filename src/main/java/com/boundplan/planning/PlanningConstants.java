package com.boundplan.planning;

import java.util.List;

public final class PlanningConstants {

    private PlanningConstants() {
        // Private constructor to prevent instantiation
    }

    // Contract constants
    public static final String SCHEMA_VERSION = "BoundPlanSpec_v1";
    public static final String PHASE_BOUND = "BOUND";
    public static final String UNKNOWN = "unknown";

    // Prompt key steps
    public static final String STEP_BUILDER = "bounded_plan_builder";
    public static final String STEP_TIEBREAKER = "tool_tiebreaker";
    public static final String STEP_PRESENTER = "bounded_plan_presenter";

    // Generation purposes
    public static final String PURPOSE_DEVELOP = "develop";
    public static final String PURPOSE_TIEBREAK = "tool-tiebreak";
    public static final String PURPOSE_PRESENT = "present";

    // Known context keys
    public static final String CONTEXT_DRAFT_PLAN_SUMMARY = "draft_plan_summary";
    public static final String CONTEXT_PROFILE_SUMMARY = "patient_profile_summary";
    public static final String FIELD_PROFILE = "patient_profile";

    // Default messages
    public static final String DEFAULT_REQUEST_MESSAGE = "Please provide additional information";
    public static final String PARSE_FAILURE_MESSAGE = "Failed to parse response";
    public static final String MISSING_INFORMATION_PREFIX = "Missing information: ";
    public static final String PRESENTER_FALLBACK_PREFIX = "I'm working on your workflow plan. ";
    public static final String PRESENTER_FALLBACK_REQUEST = "Please provide the requested information.";
    public static final String PRESENTER_IDLE_MESSAGE = "Processing...";
    public static final String PRESENTER_DEFAULT_MESSAGE = "Processing your request...";

    // Extracted fields that name a person
    public static final List<String> IDENTIFIER_FIELDS = List.of(
            "patient_name",
            "patient_id",
            "name",
            "user_name",
            "member_id"
    );

    public static final int SHORT_MESSAGE_MAX_WORDS = 3;

    // User prompts
    public static final String DEVELOP_USER_PROMPT =
            "Generate a BoundPlanSpec based on the draft plan and current session state.";
    public static final String TIEBREAK_USER_PROMPT =
            "Resolve tool ambiguity by selecting the most appropriate tool for each ambiguous step.";
    public static final String PRESENT_USER_PROMPT =
            "Generate a user-friendly message and question based on the current bound plan spec.";
}
