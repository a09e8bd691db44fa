package io.harrier.api.project;

import java.util.List;

/**
 * Raised before any test is scheduled when the project configuration cannot be used.
 * The run is aborted and the process should exit with a non-zero code.
 */
public class ConfigInvalidException extends RuntimeException {

    private final List<String> problems;

    public ConfigInvalidException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
