package com.boundplan.planning.service;

import com.boundplan.planning.model.Blocker;
import com.boundplan.planning.model.BlockerType;
import com.boundplan.planning.model.PlanReadiness;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockerCatalogTest {

    private final BlockerCatalog catalog = new BlockerCatalog(new PriorityResolver());

    @Test
    void testNoBlockersIsReady() {
        assertEquals(PlanReadiness.READY_FOR_COMPILATION, catalog.readiness(List.of()));
        assertEquals(PlanReadiness.READY_FOR_COMPILATION, catalog.readiness(null));
    }

    @Test
    void testToolGapBlocks() {
        List<Blocker> blockers = List.of(
                Blocker.of(BlockerType.MISSING_PREFERENCE, "s1", "preference"),
                Blocker.of(BlockerType.TOOL_GAP, "s2", "no tool"));
        assertEquals(PlanReadiness.BLOCKED, catalog.readiness(blockers));
    }

    @Test
    void testPolicyConflictBlocks() {
        assertEquals(PlanReadiness.BLOCKED,
                catalog.readiness(List.of(Blocker.of(BlockerType.POLICY_CONFLICT, null, "policy"))));
    }

    @Test
    void testAnswerableBlockersNeedInput() {
        assertEquals(PlanReadiness.NEEDS_INPUT,
                catalog.readiness(List.of(Blocker.of(BlockerType.MISSING_INFORMATION, "s1", "info"))));
        assertEquals(PlanReadiness.NEEDS_INPUT,
                catalog.readiness(List.of(Blocker.of(BlockerType.TOOL_AMBIGUITY, "s1", "two tools fit"))));
    }
}
