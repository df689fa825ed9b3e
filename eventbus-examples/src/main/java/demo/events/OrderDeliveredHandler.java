package demo.events;

import org.eventbus.rabbitmq.subscriber.EventHandler;

public class OrderDeliveredHandler implements EventHandler<OrderDelivered> {

    @Override
    public void handle(OrderDelivered event) {
        System.out.printf("[orders] %s delivered by %s%n", event.getOrderId(), event.getDeliveredBy());
    }
}
