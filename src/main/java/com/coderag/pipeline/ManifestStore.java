package com.coderag.pipeline;

import com.coderag.errors.ManifestMissingException;
import com.coderag.errors.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * ManifestStore - Reads and writes the pretty-printed manifest file
 */
public class ManifestStore {

    private final Path manifestPath;
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public ManifestStore(Path manifestPath) {
        this.manifestPath = manifestPath;
    }

    public void write(Manifest manifest) throws PersistenceException {
        try {
            Path dir = manifestPath.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            jsonMapper.writerWithDefaultPrettyPrinter().writeValue(manifestPath.toFile(), manifest);
        } catch (IOException e) {
            throw new PersistenceException("Could not write manifest " + manifestPath + ": " + e.getMessage(), e);
        }
    }

    public Manifest read() throws ManifestMissingException, PersistenceException {
        if (!Files.exists(manifestPath)) {
            throw new ManifestMissingException(manifestPath);
        }
        try {
            return jsonMapper.readValue(manifestPath.toFile(), Manifest.class);
        } catch (IOException e) {
            throw new PersistenceException("Could not read manifest " + manifestPath + ": " + e.getMessage(), e);
        }
    }

    public Path getManifestPath() {
        return manifestPath;
    }
}
