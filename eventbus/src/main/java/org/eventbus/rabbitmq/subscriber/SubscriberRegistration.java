package org.eventbus.rabbitmq.subscriber;

/**
 * One handler of one event class. Equal pairs are registered only once.
 */
public record SubscriberRegistration(Class<? extends SubscribeEvent> eventType,
                                     Class<? extends EventHandler<?>> handlerType) {
}
