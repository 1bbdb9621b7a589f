package com.boundplan.planning.service;

import static com.boundplan.planning.PlanningConstants.DEFAULT_REQUEST_MESSAGE;

import com.boundplan.planning.model.Blocker;
import com.boundplan.planning.model.NextInputRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the single question to ask next: the blocker whose type ranks lowest, keeping
 * the generated order among equal ranks.
 */
@Service
@Slf4j
public class PriorityResolver {

    public Optional<NextInputRequest> nextRequest(List<Blocker> blockers) {
        if (blockers == null || blockers.isEmpty()) {
            return Optional.empty();
        }
        List<Blocker> sorted = new ArrayList<>(blockers);
        sorted.sort(Comparator.comparingInt(b -> b.type().rank()));
        Blocker first = sorted.get(0);
        log.debug("Next input request from blocker type={} step={}", first.type().value(), first.stepId());
        return Optional.of(new NextInputRequest(
                first.type(),
                first.stepId(),
                StringUtils.hasText(first.message()) ? first.message() : DEFAULT_REQUEST_MESSAGE,
                first.writesTo()));
    }
}
