package org.eventbus.rabbitmq.subscriber;

import org.eventbus.rabbitmq.connection.ConnectionRegistry;
import org.eventbus.rabbitmq.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Groups subscribed events by {@code virtualHost-queueName} into {@link ConsumerGroup}s
 * and runs them.
 */
public class SubscriberManager implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SubscriberManager.class);

    private final SubscriberRegistry registry;
    private final ConnectionRegistry connections;
    private final MessageDispatcher dispatcher;
    private final Duration reconnectInterval;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    /** consumer group key → group */
    private final Map<String, ConsumerGroup> groups = new LinkedHashMap<>();

    private volatile boolean running = false;

    public SubscriberManager(SubscriberRegistry registry, ConnectionRegistry connections,
                             MessageDispatcher dispatcher, Duration reconnectInterval) {
        this(registry, connections, dispatcher, reconnectInterval,
                Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventbus-consumer-recovery-")),
                true);
    }

    public SubscriberManager(SubscriberRegistry registry, ConnectionRegistry connections,
                             MessageDispatcher dispatcher, Duration reconnectInterval,
                             ScheduledExecutorService scheduler) {
        this(registry, connections, dispatcher, reconnectInterval, scheduler, false);
    }

    private SubscriberManager(SubscriberRegistry registry, ConnectionRegistry connections,
                              MessageDispatcher dispatcher, Duration reconnectInterval,
                              ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.registry = registry;
        this.connections = connections;
        this.dispatcher = dispatcher;
        this.reconnectInterval = reconnectInterval;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Build one consumer group per queue from the resolved subscriptions. Idempotent.
     */
    public synchronized Map<String, ConsumerGroup> createGroups() {
        for (EventSubscriptions subscription : registry.snapshot().values()) {
            SubscriberOptions options = subscription.getOptions();
            String key = options.consumerGroupKey();
            ConsumerGroup group = groups.computeIfAbsent(key, k -> new ConsumerGroup(k, options,
                    connections.getOrCreate(options.getVirtualHostSettings()), dispatcher, scheduler,
                    reconnectInterval));
            group.addSubscription(subscription);
        }
        return Map.copyOf(groups);
    }

    /**
     * Start every consumer group. A group failing to start is logged and retried
     * after the reconnect interval; the others start regardless.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Subscriber manager is already running");
            return;
        }
        createGroups();
        for (ConsumerGroup group : groups.values()) {
            try {
                group.start();
            } catch (Exception e) {
                log.error("Failed to start consumer group {}: {}", group.getKey(), e.getMessage(), e);
                group.scheduleRebuild(reconnectInterval);
            }
        }
        running = true;
    }

    public synchronized List<ConsumerGroup> getGroups() { return new ArrayList<>(groups.values()); }

    public boolean isRunning() { return running; }

    @Override
    public synchronized void close() {
        running = false;
        for (ConsumerGroup group : groups.values()) {
            try {
                group.close();
            } catch (Exception e) {
                log.warn("Error stopping consumer group {}: {}", group.getKey(), e.getMessage());
            }
        }
        groups.clear();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.info("Subscriber manager closed");
    }
}
