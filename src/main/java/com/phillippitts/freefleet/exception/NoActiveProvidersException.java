package com.phillippitts.freefleet.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when discovery finds no provider in the host configuration.
 * This is the one discovery failure that aborts the pass and needs operator action.
 */
public class NoActiveProvidersException extends FreeFleetException {

    private final Path configPath;
    private final List<String> errors;

    public NoActiveProvidersException(Path configPath, List<String> errors) {
        super("No active providers detected in " + configPath
                + (errors.isEmpty() ? "" : ": " + String.join("; ", errors)));
        this.configPath = configPath;
        this.errors = List.copyOf(errors);
    }

    public Path getConfigPath() {
        return configPath;
    }

    public List<String> getErrors() {
        return errors;
    }
}
