package demo.events;

import org.eventbus.rabbitmq.publisher.PublishEvent;

import java.math.BigDecimal;

public class OrderSubmitted extends PublishEvent {

    private String orderId;
    private String userId;
    private BigDecimal totalAmount;

    public OrderSubmitted() {
    }

    public OrderSubmitted(String orderId, String userId, BigDecimal totalAmount) {
        this.orderId = orderId;
        this.userId = userId;
        this.totalAmount = totalAmount;
    }

    public String getOrderId() { return orderId; }
    public void setOrderId(String orderId) { this.orderId = orderId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public BigDecimal getTotalAmount() { return totalAmount; }
    public void setTotalAmount(BigDecimal totalAmount) { this.totalAmount = totalAmount; }
}
