package org.eventbus.rabbitmq.subscriber;

import java.io.IOException;

@FunctionalInterface
public interface Acknowledger {

    void ack(long deliveryTag) throws IOException;
}
