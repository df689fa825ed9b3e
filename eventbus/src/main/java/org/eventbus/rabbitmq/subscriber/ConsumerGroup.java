package org.eventbus.rabbitmq.subscriber;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.connection.BrokerConnection;
import org.eventbus.rabbitmq.exception.ChannelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consumer of one queue on one virtual host ({@code virtualHost-queueName}).
 *
 * <p>Every event type multiplexed onto the queue shares the group's channel.
 * Topology declared per channel:</p>
 * <ul>
 *   <li>Durable exchange of the configured type, with the exchange arguments</li>
 *   <li>Durable, non-exclusive queue, with the queue arguments</li>
 *   <li>One binding per routing key of the registered event types</li>
 * </ul>
 *
 * <p>When the broker closes the channel (including after a consumer callback failure)
 * the whole declare/bind/consume sequence is run again on a new channel. Bindings are
 * channel-scoped state, so the group never patches an existing channel.</p>
 */
public class ConsumerGroup implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ConsumerGroup.class);

    private final String key;
    private final SubscriberOptions options;
    private final BrokerConnection connection;
    private final MessageDispatcher dispatcher;
    private final ScheduledExecutorService scheduler;
    private final Duration reconnectInterval;

    /** resolved event type name → subscriptions */
    private final Map<String, EventSubscriptions> subscriptions = new ConcurrentHashMap<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final ShutdownListener shutdownListener = this::onChannelShutdown;

    private volatile Channel channel;
    private volatile String consumerTag;
    private volatile boolean closed = false;

    /**
     * @param options resolved options of the first event registered on the queue
     */
    public ConsumerGroup(String key, SubscriberOptions options, BrokerConnection connection,
                         MessageDispatcher dispatcher, ScheduledExecutorService scheduler,
                         Duration reconnectInterval) {
        this.key = key;
        this.options = options;
        this.connection = connection;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.reconnectInterval = reconnectInterval;
    }

    public void addSubscription(EventSubscriptions subscription) {
        subscriptions.put(subscription.getOptions().getEventTypeName(), subscription);
    }

    // ========== Start / rebuild ==========

    /**
     * Declare the topology and start consuming.
     *
     * @throws ChannelException if declaring or consuming failed
     * @throws org.eventbus.rabbitmq.exception.ConnectionException if no channel could be opened
     */
    public void start() {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Consumer group " + key + " is closed");
            }
            openAndConsume();
        } finally {
            lock.unlock();
        }
    }

    private void openAndConsume() {
        HostSettings settings = options.getVirtualHostSettings();
        String queueName = options.getQueueName();
        Channel opened = connection.createChannel();
        try {
            opened.exchangeDeclare(settings.getExchangeName(), settings.getExchangeType(), true, false,
                    settings.getExchangeArguments());
            opened.queueDeclare(queueName, true, false, false, settings.getQueueArguments());
            for (String routingKey : routingKeys()) {
                opened.queueBind(queueName, settings.getExchangeName(), routingKey);
            }
            if (settings.getPrefetchCount() != null && settings.getPrefetchCount() > 0) {
                opened.basicQos(settings.getPrefetchCount());
            }
            opened.addShutdownListener(shutdownListener);
            consumerTag = opened.basicConsume(queueName, false, new DeliveryConsumer(opened));
            channel = opened;
            log.info("Started consumer group {}: exchange={}, queue={}, events={}",
                    key, settings.getExchangeName(), queueName, subscriptions.keySet());
        } catch (IOException | AlreadyClosedException e) {
            opened.removeShutdownListener(shutdownListener);
            abortQuietly(opened);
            throw new ChannelException("Error while creating RabbitMQ consumer channel for '" + queueName
                    + "' queue of '" + settings.getVirtualHost() + "' virtual host.", e);
        }
    }

    Set<String> routingKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (EventSubscriptions subscription : subscriptions.values()) {
            keys.add(subscription.getOptions().getRoutingKey());
        }
        return keys;
    }

    private void onChannelShutdown(ShutdownSignalException cause) {
        if (closed) {
            return;
        }
        // connection-level signals reference the connection and always apply
        if (cause.getReference() instanceof Channel other && other != channel) {
            return;
        }
        log.warn("Consumer channel of group {} was closed (hard error: {}), recreating it: {}",
                key, cause.isHardError(), cause.getMessage());
        scheduleRebuild(Duration.ZERO);
    }

    /**
     * Schedule a full rebuild of the consumer channel after {@code delay}.
     */
    void scheduleRebuild(Duration delay) {
        if (closed) {
            return;
        }
        try {
            scheduler.schedule(this::rebuild, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Rebuild of consumer group {} skipped, scheduler is shut down", key);
        }
    }

    void rebuild() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            Channel stale = channel;
            channel = null;
            consumerTag = null;
            if (stale != null) {
                stale.removeShutdownListener(shutdownListener);
                abortQuietly(stale);
            }
            openAndConsume();
            log.info("Recreated consumer channel of group {}", key);
        } catch (RuntimeException e) {
            ChannelException error = e instanceof ChannelException ce ? ce
                    : new ChannelException("Error while recreating RabbitMQ consumer channel of group " + key, e);
            log.error("Failed to recreate consumer group {}, retrying in {}", key, reconnectInterval, error);
            scheduleRebuild(reconnectInterval);
        } finally {
            lock.unlock();
        }
    }

    // ========== Close ==========

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            Channel current = channel;
            channel = null;
            if (current != null) {
                current.removeShutdownListener(shutdownListener);
                try {
                    if (current.isOpen() && consumerTag != null) {
                        current.basicCancel(consumerTag);
                    }
                } catch (IOException | AlreadyClosedException e) {
                    log.debug("Error cancelling consumer of group {}: {}", key, e.getMessage());
                }
                abortQuietly(current);
            }
            log.info("Consumer group {} closed", key);
        } finally {
            lock.unlock();
        }
    }

    private void abortQuietly(Channel target) {
        try {
            if (target.isOpen()) {
                target.abort();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Error closing consumer channel of group {}: {}", key, e.getMessage());
        }
    }

    public String getKey() { return key; }
    public SubscriberOptions getOptions() { return options; }
    public Map<String, EventSubscriptions> getSubscriptions() { return Map.copyOf(subscriptions); }
    public boolean isRunning() {
        Channel current = channel;
        return !closed && current != null && current.isOpen();
    }

    // ========== Inner: delivery consumer ==========

    private class DeliveryConsumer extends DefaultConsumer {
        DeliveryConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            ReceivedMessage message = new ReceivedMessage(body, properties.getType(), envelope.getRoutingKey(),
                    properties.getMessageId(), properties.getHeaders(), envelope.getDeliveryTag(),
                    options.getVirtualHostSettings().getVirtualHost());
            dispatcher.dispatch(message, subscriptions, deliveryTag -> getChannel().basicAck(deliveryTag, false));
        }
    }
}
