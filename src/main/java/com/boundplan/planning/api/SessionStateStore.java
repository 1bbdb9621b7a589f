package com.boundplan.planning.api;

import com.boundplan.planning.model.SessionState;

import java.util.Set;

/**
 * Service interface for storing the convergence state of planning sessions. Each session
 * is a single record that is overwritten after every turn.
 */
public interface SessionStateStore {

    /**
     * Creates and stores the initial state of a session.
     *
     * @param sessionId The session identifier.
     * @param initialKnownFields Field names already known when the session starts.
     * @return The newly created {@link SessionState}, owning its own collections.
     * @throws SessionAlreadyExistsException if a session with this id is already stored.
     */
    SessionState create(String sessionId, Set<String> initialKnownFields);

    /**
     * Overwrites the stored state of a session. The write is conditional on the stored
     * revision, so two turns that loaded the same revision cannot both succeed.
     *
     * @param sessionId The session identifier.
     * @param state The state to store. Its revision must match the stored revision.
     * @throws StaleSessionStateException if another turn persisted the session in between.
     * @throws SessionNotFoundException if the session was never created.
     */
    void persist(String sessionId, SessionState state);

    /**
     * Loads the stored state of a session.
     *
     * @param sessionId The session identifier.
     * @return The stored {@link SessionState}.
     * @throws SessionNotFoundException if the session was never created.
     */
    SessionState load(String sessionId);
}
