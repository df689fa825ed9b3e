package org.eventbus.rabbitmq.publisher;

import org.eventbus.rabbitmq.exception.EventBusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of an outbox: publishes an event the outbox stored earlier.
 */
public class MessageBrokerEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(MessageBrokerEventPublisher.class);

    private final EventPublisher publisher;

    /**
     * @param publisher {@code null} when the event bus is disabled
     */
    public MessageBrokerEventPublisher(EventPublisher publisher) {
        this.publisher = publisher;
    }

    /**
     * @param eventPath outbox path of the event, only logged
     * @throws EventBusException if the event bus is disabled
     */
    public void publish(PublishEvent event, String eventPath) {
        if (publisher == null) {
            throw new EventBusException("There is an outbox event ready to be published through the message broker, "
                    + "but RabbitMQ is not enabled.");
        }
        log.debug("Publishing outbox event {} ({})", event.getEventId(), eventPath);
        publisher.publish(event);
    }
}
