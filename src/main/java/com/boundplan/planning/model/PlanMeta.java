package com.boundplan.planning.model;

import static com.boundplan.planning.PlanningConstants.PHASE_BOUND;
import static com.boundplan.planning.PlanningConstants.SCHEMA_VERSION;
import static com.boundplan.planning.PlanningConstants.UNKNOWN;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlanMeta(
        String planId,
        String workflow,
        String phase,
        String schemaVersion
) {

    public static PlanMeta bound(String planId, String workflow) {
        return new PlanMeta(planId, workflow, PHASE_BOUND, SCHEMA_VERSION);
    }

    public static PlanMeta unknown() {
        return bound(UNKNOWN, UNKNOWN);
    }

    public boolean hasCanonicalSchema() {
        return SCHEMA_VERSION.equals(schemaVersion);
    }

    public PlanMeta withCanonicalSchema() {
        return new PlanMeta(planId, workflow, phase, SCHEMA_VERSION);
    }
}
