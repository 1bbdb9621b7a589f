package com.boundplan.planning.model;

public enum PlanReadiness {
    BLOCKED,
    NEEDS_INPUT,
    READY_FOR_COMPILATION
}
