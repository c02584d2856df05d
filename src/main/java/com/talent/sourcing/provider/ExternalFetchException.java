package com.talent.sourcing.provider;

import com.talent.sourcing.SourcingException;

/**
 * An external provider call failed.
 */
public class ExternalFetchException extends SourcingException {

    private final int statusCode;

    public ExternalFetchException(String message) {
        this(message, -1, null);
    }

    public ExternalFetchException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ExternalFetchException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or -1 when the call never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
