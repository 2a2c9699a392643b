package org.processdiagram.converter.config;

import java.util.List;

/**
 * Configuration could not be read or does not match the configuration schema.
 */
public class ConfigurationException extends RuntimeException {
    private final List<String> problems;

    public ConfigurationException(String message, List<String> problems) {
        super(message + (problems.isEmpty() ? "" : ": " + String.join("; ", problems)));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of();
    }

    public List<String> getProblems() {
        return problems;
    }
}
