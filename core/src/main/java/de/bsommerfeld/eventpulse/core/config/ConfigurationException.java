package de.bsommerfeld.eventpulse.core.config;

import java.util.List;

/**
 * Thrown when the worker cannot start because required settings are missing
 * or malformed. The message names every offending variable so the operator
 * can fix all of them in one go.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> missing;
    private final List<String> invalid;

    public ConfigurationException(List<String> missing, List<String> invalid) {
        super(buildMessage(missing, invalid));
        this.missing = List.copyOf(missing);
        this.invalid = List.copyOf(invalid);
    }

    /** Names of required variables that were not set. */
    public List<String> getMissing() {
        return missing;
    }

    /** Descriptions of variables that were set but could not be parsed. */
    public List<String> getInvalid() {
        return invalid;
    }

    private static String buildMessage(List<String> missing, List<String> invalid) {
        StringBuilder sb = new StringBuilder("Invalid worker configuration.");
        if (!missing.isEmpty()) {
            sb.append(" Missing required variables: ").append(String.join(", ", missing)).append('.');
        }
        if (!invalid.isEmpty()) {
            sb.append(" Malformed values: ").append(String.join("; ", invalid)).append('.');
        }
        return sb.toString();
    }
}
