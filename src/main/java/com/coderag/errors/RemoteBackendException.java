package com.coderag.errors;

/**
 * RemoteBackendException - A remote embedding or index service answered with an error
 * payload, a non-success status, or could not be reached.
 */
public class RemoteBackendException extends RagException {

    private final int statusCode;

    public RemoteBackendException(String message) {
        this(message, -1, null);
    }

    public RemoteBackendException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public RemoteBackendException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public RemoteBackendException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status of the failed call, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
