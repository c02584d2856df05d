package com.talent.sourcing.pipeline;

/**
 * A candidate that could not be processed after its retry.
 *
 * @param candidateId the candidate id
 * @param index       position in the session's candidate ids, -1 when not applicable
 * @param errorType   simple class name of the final exception
 * @param message     the final exception's message
 */
public record ItemFailure(String candidateId, int index, String errorType, String message) {

    public static ItemFailure of(String candidateId, int index, Throwable error) {
        return new ItemFailure(candidateId, index, error.getClass().getSimpleName(), error.getMessage());
    }
}
