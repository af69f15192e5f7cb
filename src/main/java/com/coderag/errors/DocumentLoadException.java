package com.coderag.errors;

import java.nio.file.Path;

/**
 * DocumentLoadException - A single file could not be loaded (unreadable, too large, bad encoding).
 * Non-fatal: the loader logs it and moves on to the next file.
 */
public class DocumentLoadException extends RagException {

    private final Path path;

    public DocumentLoadException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
