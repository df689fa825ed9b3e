package org.eventbus.rabbitmq.exception;

/**
 * A consumer channel failed and could not be rebuilt.
 */
public class ChannelException extends EventBusException {

    public ChannelException(String message) {
        super(message);
    }

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
