package de.bsommerfeld.triage.core.config;

/**
 * Raised when the configuration cannot produce a well-defined engine:
 * an unreadable file, an empty taxonomy, a missing fallback category or an
 * invalid rule.
 */
public class TriageConfigurationException extends RuntimeException {

    public TriageConfigurationException(String message) {
        super(message);
    }

    public TriageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
