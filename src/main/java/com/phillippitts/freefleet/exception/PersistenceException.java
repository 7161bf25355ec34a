package com.phillippitts.freefleet.exception;

import java.nio.file.Path;

/**
 * Thrown when a cache, policy, metrics or audit file cannot be written.
 * Callers log it as a warning and carry on; cache correctness is an optimization.
 */
public class PersistenceException extends FreeFleetException {

    private final Path path;

    public PersistenceException(Path path, Throwable cause) {
        super("Failed to persist " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
