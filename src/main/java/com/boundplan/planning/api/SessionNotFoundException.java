package com.boundplan.planning.api;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Planning session not found: " + sessionId);
    }
}
