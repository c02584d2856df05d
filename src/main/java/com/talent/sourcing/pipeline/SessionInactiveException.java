package com.talent.sourcing.pipeline;

import com.talent.sourcing.SourcingException;

/**
 * The session has been cleared and accepts no further work.
 */
public class SessionInactiveException extends SourcingException {

    private final String sessionId;

    public SessionInactiveException(String sessionId) {
        super("Session is no longer active: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
