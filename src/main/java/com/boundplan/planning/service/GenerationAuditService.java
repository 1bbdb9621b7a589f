package com.boundplan.planning.service;

import com.boundplan.entity.GenerationLog;
import com.boundplan.repository.GenerationLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Records every generation call. Audit failures never reach the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationAuditService {

    private final GenerationLogRepository generationLogRepository;

    public void record(String sessionId, String purpose, @Nullable String promptKey,
                       @Nullable String systemPrompt, @Nullable String userPrompt, @Nullable String response) {
        try {
            generationLogRepository.save(GenerationLog.builder()
                    .sessionId(sessionId)
                    .purpose(purpose)
                    .promptKey(promptKey)
                    .systemPrompt(systemPrompt)
                    .userPrompt(userPrompt)
                    .fullResponse(response)
                    .build());
        } catch (Exception ex) {
            log.debug("Failed to log generation {} for session {}: {}", purpose, sessionId, ex.getMessage());
        }
    }
}
