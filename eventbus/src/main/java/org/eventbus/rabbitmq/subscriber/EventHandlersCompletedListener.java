package org.eventbus.rabbitmq.subscriber;

import org.eventbus.rabbitmq.inbox.EventProviderType;

/**
 * Called once every handler of a received event has completed.
 */
@FunctionalInterface
public interface EventHandlersCompletedListener {

    void onCompleted(String eventTypeName, EventProviderType providerType);
}
