package org.eventbus.rabbitmq.subscriber;

/**
 * Handles one received event type.
 *
 * <p>Handlers of the same message run one after another on the delivering thread,
 * in registration order. A thrown exception leaves the message unacknowledged.</p>
 */
@FunctionalInterface
public interface EventHandler<T extends SubscribeEvent> {

    void handle(T event) throws Exception;
}
