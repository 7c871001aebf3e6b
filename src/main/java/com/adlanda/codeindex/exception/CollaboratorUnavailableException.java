package com.adlanda.codeindex.exception;

/**
 * The remote repository host could not be reached or answered with an error
 * while an indexing run was being planned. Aborts the whole run.
 */
public class CollaboratorUnavailableException extends RuntimeException {

    private final int statusCode;

    public CollaboratorUnavailableException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public CollaboratorUnavailableException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the remote host, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
