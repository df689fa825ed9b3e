package org.eventbus.rabbitmq.publisher;

public class OrderSubmitted extends PublishEvent {

    private String orderId;

    public OrderSubmitted() {
    }

    public OrderSubmitted(String orderId) {
        this.orderId = orderId;
    }

    public String getOrderId() { return orderId; }
    public void setOrderId(String orderId) { this.orderId = orderId; }
}
