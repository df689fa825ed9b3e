package org.eventbus.rabbitmq.exception;

/**
 * The broker connection could not be opened after exhausting the connect
 * retries, or a channel could not be created on it.
 */
public class ConnectionException extends EventBusException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
