package com.coderag.errors;

/**
 * PersistenceException - Reading or writing an on-disk index artifact failed
 */
public class PersistenceException extends RagException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
