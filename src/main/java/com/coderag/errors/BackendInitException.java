package com.coderag.errors;

/**
 * BackendInitException - An embedding or index backend could not be brought up.
 * Callers react by switching to their fallback backend.
 */
public class BackendInitException extends RagException {

    public BackendInitException(String message) {
        super(message);
    }

    public BackendInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
