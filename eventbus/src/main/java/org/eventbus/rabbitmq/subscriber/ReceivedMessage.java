package org.eventbus.rabbitmq.subscriber;

import java.util.Map;

/**
 * A delivery as handed over by the consumer, detached from the client library.
 *
 * @param type        value of the type property, may be {@code null}
 * @param messageId   value of the message id property, may be {@code null}
 * @param headers     raw AMQP headers, may be {@code null}
 * @param virtualHost virtual host the message was consumed from
 */
public record ReceivedMessage(byte[] body,
                              String type,
                              String routingKey,
                              String messageId,
                              Map<String, Object> headers,
                              long deliveryTag,
                              String virtualHost) {
}
