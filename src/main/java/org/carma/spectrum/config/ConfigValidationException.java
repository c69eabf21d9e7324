package org.carma.spectrum.config;

import java.util.List;

/**
 * Thrown when a static configuration is invalid. Carries every problem found,
 * not only the first.
 */
public class ConfigValidationException extends RuntimeException {

    private final String source;
    private final List<String> errors;

    public ConfigValidationException(String source, List<String> errors) {
        super("Configuration '" + source + "' failed validation: " + errors);
        this.source = source;
        this.errors = List.copyOf(errors);
    }

    public String getSource() { return source; }
    public List<String> getErrors() { return errors; }
}
