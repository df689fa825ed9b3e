package org.eventbus.rabbitmq.subscriber;

import org.eventbus.rabbitmq.config.EventOptions;
import org.eventbus.rabbitmq.config.HostSettings;

/**
 * Options of one subscribed event type.
 */
public class SubscriberOptions extends EventOptions {

    /**
     * Queue to consume from. Defaults to the host's queue name, then to the exchange name.
     */
    private String queueName;

    @Override
    protected void completeFrom(HostSettings settings) {
        if (queueName == null || queueName.isEmpty()) {
            String hostQueue = settings.getQueueName();
            queueName = hostQueue == null || hostQueue.isEmpty() ? settings.getExchangeName() : hostQueue;
        }
    }

    /**
     * Key of the consumer group this event is multiplexed onto: {@code virtualHost-queueName}.
     */
    public String consumerGroupKey() {
        HostSettings settings = getVirtualHostSettings();
        if (settings == null) {
            throw new IllegalStateException("Subscriber options of '" + getEventTypeName() + "' are not resolved");
        }
        return settings.getVirtualHost() + "-" + queueName;
    }

    public String getQueueName() { return queueName; }
    public void setQueueName(String queueName) { this.queueName = queueName; }

    @Override
    public String toString() {
        return "SubscriberOptions{eventTypeName='" + getEventTypeName() + "', routingKey='" + getRoutingKey()
                + "', queueName='" + queueName + "', virtualHostKey='" + getVirtualHostKey() + "'}";
    }
}
