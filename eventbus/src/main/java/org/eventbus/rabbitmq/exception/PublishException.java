package org.eventbus.rabbitmq.exception;

/**
 * Publishing an event failed while resolving its settings, acquiring a
 * channel or writing to the broker.
 */
public class PublishException extends EventBusException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
