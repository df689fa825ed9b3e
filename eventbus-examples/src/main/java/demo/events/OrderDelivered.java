package demo.events;

import org.eventbus.rabbitmq.subscriber.SubscribeEvent;

public class OrderDelivered extends SubscribeEvent {

    private String orderId;
    private String deliveredBy;

    public String getOrderId() { return orderId; }
    public void setOrderId(String orderId) { this.orderId = orderId; }

    public String getDeliveredBy() { return deliveredBy; }
    public void setDeliveredBy(String deliveredBy) { this.deliveredBy = deliveredBy; }
}
