package demo;

import demo.events.OrderDelivered;
import demo.events.OrderDeliveredHandler;
import demo.events.OrderSubmitted;
import demo.events.UserCreated;
import demo.events.UserCreatedHandler;
import org.eventbus.rabbitmq.RabbitMqEventBus;
import org.eventbus.rabbitmq.config.NamingPolicyType;
import org.eventbus.rabbitmq.subscriber.HandlerResolver;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 纯代码配置，不需要 YAML 文件。
 * 展示多个 virtual host、命名策略以及 collect/flush 发布。
 */
public class ProgrammaticExample {

    public static void main(String[] args) throws InterruptedException {

        // ========== 1. 纯代码构建配置 ==========

        var bus = RabbitMqEventBus.builder()
                .defaultSettings(s -> {
                    s.setHostName("localhost");
                    s.setExchangeName("Orders");
                    s.setQueueName("orders-service");
                    s.setRetryConnectionCount(5);
                })
                // users 服务使用独立的 virtual host，snake_case 属性名
                .virtualHost("users", s -> {
                    s.setVirtualHost("users");
                    s.setExchangeName("Users");
                    s.setPropertyNamingPolicy(NamingPolicyType.SNAKE_CASE_LOWER);
                    s.setQueueArguments(Map.of("x-queue-type", "quorum"));
                })
                .publisher(OrderSubmitted.class, o -> o.setRoutingKey("orders.submitted"))
                .subscriber(UserCreated.class, UserCreatedHandler.class, o -> o.setVirtualHostKey("users"))
                .subscriber(OrderDelivered.class, OrderDeliveredHandler.class)
                .handlerResolver(HandlerResolver.of(new UserCreatedHandler(), new OrderDeliveredHandler()))
                .onEventHandlersCompleted((eventType, provider) ->
                        System.out.printf("all handlers of %s completed (%s)%n", eventType, provider))
                .build();

        // ========== 2. 启动 ==========

        bus.start();
        bus.getSubscriberManager().getGroups()
                .forEach(group -> System.out.println("Consumer group: " + group.getKey()));

        // ========== 3. collect + flush：事务提交后再统一发布 ==========

        var publisher = bus.createPublisher();
        var order = new OrderSubmitted("order-1", "user-1", new BigDecimal("10.00"));
        publisher.collect(order);
        publisher.collect(order); // 同一个 eventId 只会发布一次
        publisher.collect(new OrderSubmitted("order-2", "user-2", new BigDecimal("99.90")));
        publisher.flush();

        // ========== 4. 运行一段时间后关闭 ==========

        Thread.sleep(60_000);
        publisher.close();
        bus.close();
    }
}
