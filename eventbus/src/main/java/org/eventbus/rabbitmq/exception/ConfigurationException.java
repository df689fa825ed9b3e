package org.eventbus.rabbitmq.exception;

/**
 * A required setting is missing, or a feature was enabled without the
 * collaborator it needs. Raised at startup or first use and never retried.
 */
public class ConfigurationException extends EventBusException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
