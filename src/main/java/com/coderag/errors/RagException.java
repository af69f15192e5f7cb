package com.coderag.errors;

/**
 * RagException - Base of all recoverable failures raised by the indexing core
 */
public class RagException extends Exception {

    public RagException(String message) {
        super(message);
    }

    public RagException(String message, Throwable cause) {
        super(message, cause);
    }
}
