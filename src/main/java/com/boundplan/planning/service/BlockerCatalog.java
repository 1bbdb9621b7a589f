package com.boundplan.planning.service;

import com.boundplan.planning.model.Blocker;
import com.boundplan.planning.model.PlanReadiness;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BlockerCatalog {

    private final PriorityResolver priorityResolver;

    public PlanReadiness readiness(List<Blocker> blockers) {
        if (blockers == null || blockers.isEmpty()) {
            return PlanReadiness.READY_FOR_COMPILATION;
        }
        if (blockers.stream().anyMatch(b -> b.type().isHardStop())) {
            return PlanReadiness.BLOCKED;
        }
        return priorityResolver.nextRequest(blockers).isPresent()
                ? PlanReadiness.NEEDS_INPUT
                : PlanReadiness.READY_FOR_COMPILATION;
    }
}
