package com.boundplan.planning.api;

/**
 * Thrown when a session is persisted from a state that was loaded before another turn
 * wrote the same session.
 */
public class StaleSessionStateException extends RuntimeException {

    private final String sessionId;
    private final long expectedRevision;
    private final long actualRevision;

    public StaleSessionStateException(String sessionId, long expectedRevision, long actualRevision) {
        super("Session " + sessionId + " was modified concurrently (state revision "
                + expectedRevision + ", stored revision " + actualRevision + ")");
        this.sessionId = sessionId;
        this.expectedRevision = expectedRevision;
        this.actualRevision = actualRevision;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getExpectedRevision() {
        return expectedRevision;
    }

    public long getActualRevision() {
        return actualRevision;
    }
}
