package com.coderag.errors;

import java.nio.file.Path;

/**
 * ManifestMissingException - Verification was requested but no index has been built yet
 */
public class ManifestMissingException extends RagException {

    public ManifestMissingException(Path manifestPath) {
        super("Index manifest not found at " + manifestPath + ". Run the index command first.");
    }
}
