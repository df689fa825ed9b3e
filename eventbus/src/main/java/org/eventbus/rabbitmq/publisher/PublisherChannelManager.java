package org.eventbus.rabbitmq.publisher;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.connection.ConnectionRegistry;
import org.eventbus.rabbitmq.exception.ChannelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches one channel per publish target ({@code host:port:virtualHost:exchange}).
 *
 * <p>AMQP channels must not be used for concurrent publishing, so every use of a
 * target's channel happens under that target's lock. The exchange is declared each
 * time a channel is opened for the target.</p>
 */
public class PublisherChannelManager implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(PublisherChannelManager.class);

    private final ConnectionRegistry connections;

    /** target key → target */
    private final Map<String, Target> targets = new ConcurrentHashMap<>();

    public PublisherChannelManager(ConnectionRegistry connections) {
        this.connections = connections;
    }

    @FunctionalInterface
    public interface ChannelAction<T> {
        T apply(Channel channel) throws IOException;
    }

    public static String targetKey(HostSettings settings) {
        return settings.connectionKey() + ":" + settings.getExchangeName();
    }

    /**
     * Run {@code action} on the target's channel while holding the target's lock,
     * opening the channel first if needed.
     *
     * @throws ChannelException on channel I/O errors
     * @throws org.eventbus.rabbitmq.exception.ConnectionException if the connection could not be opened
     */
    public <T> T withChannel(HostSettings settings, ChannelAction<T> action) {
        Target target = targets.computeIfAbsent(targetKey(settings), key -> new Target(settings));
        target.lock.lock();
        try {
            Channel channel = target.open();
            return action.apply(channel);
        } catch (IOException | AlreadyClosedException e) {
            throw new ChannelException("Channel error on the '" + settings.getExchangeName() + "' exchange of the '"
                    + settings.getVirtualHost() + "' virtual host: " + e.getMessage(), e);
        } finally {
            target.lock.unlock();
        }
    }

    /**
     * Open the target's channel, which declares its exchange.
     */
    public void declareExchange(HostSettings settings) {
        withChannel(settings, channel -> null);
    }

    public int size() { return targets.size(); }

    @Override
    public void close() {
        for (Target target : targets.values()) {
            target.lock.lock();
            try {
                target.dispose();
            } finally {
                target.lock.unlock();
            }
        }
        targets.clear();
    }

    private final class Target {
        final HostSettings settings;
        final ReentrantLock lock = new ReentrantLock();
        Channel channel;

        Target(HostSettings settings) {
            this.settings = settings;
        }

        Channel open() throws IOException {
            if (channel != null && channel.isOpen()) {
                return channel;
            }
            channel = null;
            Channel opened = connections.getOrCreate(settings).createChannel();
            try {
                opened.exchangeDeclare(settings.getExchangeName(), settings.getExchangeType(), true, false,
                        settings.getExchangeArguments());
            } catch (IOException | RuntimeException e) {
                closeQuietly(opened);
                throw e;
            }
            log.info("Opened publish channel for the '{}' exchange on the '{}' virtual host",
                    settings.getExchangeName(), settings.getVirtualHost());
            channel = opened;
            return opened;
        }

        void dispose() {
            if (channel != null) {
                closeQuietly(channel);
                channel = null;
            }
        }

        private void closeQuietly(Channel target) {
            try {
                if (target.isOpen()) {
                    target.close();
                }
            } catch (IOException | TimeoutException | AlreadyClosedException e) {
                log.debug("Error closing publish channel of the '{}' exchange: {}",
                        settings.getExchangeName(), e.getMessage());
            }
        }
    }
}
