package com.boundplan.planning.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * The bound plan handed to downstream compilation. Field names and value spellings are
 * part of the wire contract.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record BoundPlanSpec(
        PlanMeta meta,
        List<BoundStep> steps,
        List<Blocker> blockers,
        @Nullable PlanReadiness planReadiness,
        @Nullable NextInputRequest nextInputRequest
) {

    public BoundPlanSpec {
        meta = meta != null ? meta : PlanMeta.unknown();
        steps = steps != null ? List.copyOf(steps) : List.of();
        blockers = blockers != null ? List.copyOf(blockers) : List.of();
    }

    public List<Blocker> blockersOfType(BlockerType type) {
        return blockers.stream().filter(b -> b.type() == type).toList();
    }

    public BoundPlanSpec withMeta(PlanMeta newMeta) {
        return new BoundPlanSpec(newMeta, steps, blockers, planReadiness, nextInputRequest);
    }

    public BoundPlanSpec withSteps(List<BoundStep> newSteps) {
        return new BoundPlanSpec(meta, newSteps, blockers, planReadiness, nextInputRequest);
    }

    public BoundPlanSpec withBlockers(List<Blocker> newBlockers) {
        return new BoundPlanSpec(meta, steps, newBlockers, planReadiness, nextInputRequest);
    }

    public BoundPlanSpec withOutcome(PlanReadiness readiness, @Nullable NextInputRequest request) {
        return new BoundPlanSpec(meta, steps, blockers, readiness, request);
    }
}
