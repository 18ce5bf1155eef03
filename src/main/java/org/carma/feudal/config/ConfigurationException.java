package org.carma.feudal.config;

import java.util.Collections;
import java.util.List;

/**
 * A configuration file is missing, unreadable or describes an impossible economy.
 * Always fatal at startup.
 */
public class ConfigurationException extends Exception {

    private final List<String> errors;

    public ConfigurationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public ConfigurationException(String source, List<String> errors) {
        super(source + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }
}
