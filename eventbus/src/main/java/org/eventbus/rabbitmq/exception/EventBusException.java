package org.eventbus.rabbitmq.exception;

/**
 * Base class of all errors raised by the event bus.
 *
 * <p>All event bus errors are unchecked. Transport level {@code IOException}s
 * and {@code TimeoutException}s are translated into a subclass of this type
 * at the boundary where they occur.</p>
 */
public class EventBusException extends RuntimeException {

    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
