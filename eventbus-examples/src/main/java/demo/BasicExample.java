package demo;

import demo.events.OrderDelivered;
import demo.events.OrderDeliveredHandler;
import demo.events.OrderSubmitted;
import demo.events.UserCreated;
import demo.events.UserCreatedHandler;
import demo.events.WelcomeMailHandler;
import org.eventbus.rabbitmq.RabbitMqEventBus;
import org.eventbus.rabbitmq.subscriber.HandlerResolver;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.UUID;

/**
 * 最简单的用法：YAML 配置 + main 方法。
 *
 * 运行: java -cp "lib/*" demo.BasicExample eventbus.yml
 */
public class BasicExample {

    public static void main(String[] args) {
        // 1. 从 YAML 加载配置，注册发布者和订阅者
        var builder = args.length > 0
                ? RabbitMqEventBus.fromYaml(Path.of(args[0]))
                : RabbitMqEventBus.fromClasspath("eventbus.yml");

        var bus = builder
                .publisher(OrderSubmitted.class)
                .subscriber(UserCreated.class, UserCreatedHandler.class)
                .subscriber(UserCreated.class, WelcomeMailHandler.class)
                .subscriber(OrderDelivered.class, OrderDeliveredHandler.class)
                .handlerResolver(HandlerResolver.instantiating())
                .onEventSubscribed((event, systemName) ->
                        System.out.printf("-> %s from %s%n", event.getClass().getSimpleName(), systemName))
                .build();

        // 2. 启动（声明 exchange/queue/binding，开始消费）
        bus.start();

        // 3. 发布一个事件
        try (var publisher = bus.createPublisher()) {
            publisher.publish(new OrderSubmitted(UUID.randomUUID().toString(), "user-1", new BigDecimal("42.50")));
        }

        // 4. 保持运行，Ctrl+C 退出
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            bus.close();
        }));

        System.out.println("Listening for events... (Ctrl+C to stop)");

        // 阻塞主线程
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
