package com.boundplan.planning.service;

import com.boundplan.config.BoundPlanProperties;
import com.boundplan.entity.BoundPlanSession;
import com.boundplan.repository.BoundPlanSessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Resolves the convergence mode used to select prompt templates for a session.
 */
@Service
@RequiredArgsConstructor
public class ConvergenceModeResolver {

    private final BoundPlanSessionRepository sessionRepository;
    private final BoundPlanProperties properties;

    public String resolve(String sessionId) {
        return sessionRepository.findById(sessionId)
                .map(BoundPlanSession::getStrategy)
                .filter(StringUtils::hasText)
                .orElse(properties.getDefaultStrategy());
    }
}
