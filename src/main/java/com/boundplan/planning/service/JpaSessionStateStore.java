package com.boundplan.planning.service;

import com.boundplan.config.BoundPlanProperties;
import com.boundplan.entity.BoundPlanSession;
import com.boundplan.planning.api.SessionAlreadyExistsException;
import com.boundplan.planning.api.SessionNotFoundException;
import com.boundplan.planning.api.SessionStateStore;
import com.boundplan.planning.api.StaleSessionStateException;
import com.boundplan.planning.model.BoundPlanSpec;
import com.boundplan.planning.model.SessionState;
import com.boundplan.repository.BoundPlanSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSessionStateStore implements SessionStateStore {

    private final BoundPlanSessionRepository sessionRepository;
    private final JsonProcessingService jsonProcessingService;
    private final BoundPlanProperties properties;

    @Override
    @Transactional
    public SessionState create(String sessionId, Set<String> initialKnownFields) {
        if (sessionRepository.existsById(sessionId)) {
            throw new SessionAlreadyExistsException(sessionId);
        }
        SessionState state = new SessionState(sessionId);
        if (initialKnownFields != null) {
            state.getKnownFields().addAll(initialKnownFields);
        }
        sessionRepository.save(BoundPlanSession.builder()
                .sessionId(sessionId)
                .strategy(properties.getDefaultStrategy())
                .stateJson(jsonProcessingService.write(state))
                .revision(state.getRevision())
                .build());
        log.debug("Created planning session {} with {} known field(s)", sessionId, state.getKnownFields().size());
        return state;
    }

    @Override
    @Transactional
    public void persist(String sessionId, SessionState state) {
        long loadedRevision = state.getRevision();
        long nextRevision = loadedRevision + 1;
        state.setRevision(nextRevision);
        int updated;
        try {
            BoundPlanSpec spec = state.getLastBoundPlanSpec();
            updated = sessionRepository.updateIfRevisionMatches(sessionId, loadedRevision, nextRevision,
                    jsonProcessingService.write(state),
                    spec != null ? jsonProcessingService.write(spec) : null,
                    spec != null && spec.planReadiness() != null ? spec.planReadiness().name() : null,
                    OffsetDateTime.now());
        } catch (RuntimeException ex) {
            state.setRevision(loadedRevision);
            throw ex;
        }
        if (updated == 0) {
            state.setRevision(loadedRevision);
            long storedRevision = sessionRepository.findRevisionBySessionId(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            throw new StaleSessionStateException(sessionId, loadedRevision, storedRevision);
        }
        log.debug("Persisted session {} at revision {}", sessionId, nextRevision);
    }

    @Override
    @Transactional(readOnly = true)
    public SessionState load(String sessionId) {
        BoundPlanSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        SessionState state = jsonProcessingService.read(session.getStateJson(), SessionState.class);
        // the row is authoritative for the revision
        state.setRevision(session.getRevision());
        return state;
    }
}
