package com.talent.sourcing.session;

import com.talent.sourcing.SourcingException;

public class SessionNotFoundException extends SourcingException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
