package com.boundplan.planning.api;

public class SessionAlreadyExistsException extends RuntimeException {

    public SessionAlreadyExistsException(String sessionId) {
        super("Planning session already exists: " + sessionId);
    }
}
