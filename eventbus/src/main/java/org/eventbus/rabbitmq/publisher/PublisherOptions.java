package org.eventbus.rabbitmq.publisher;

import org.eventbus.rabbitmq.config.EventOptions;

/**
 * Options of one published event type.
 */
public class PublisherOptions extends EventOptions {

    @Override
    public String toString() {
        return "PublisherOptions{eventTypeName='" + getEventTypeName() + "', routingKey='" + getRoutingKey()
                + "', virtualHostKey='" + getVirtualHostKey() + "'}";
    }
}
