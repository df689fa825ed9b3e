package org.eventbus.rabbitmq.connection;

import org.eventbus.rabbitmq.config.HostSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Owns exactly one {@link BrokerConnection} per {@code host:port:virtualHost}.
 *
 * <p>Connections are created lazily: {@link #getOrCreate(HostSettings)} does no
 * network I/O, the first channel request does.</p>
 */
public class ConnectionRegistry implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Function<HostSettings, BrokerConnection> creator;

    /** connection key → connection */
    private final Map<String, BrokerConnection> connections = new ConcurrentHashMap<>();

    private volatile boolean closed = false;

    public ConnectionRegistry() {
        this(RabbitMqConnection::new);
    }

    public ConnectionRegistry(Function<HostSettings, BrokerConnection> creator) {
        this.creator = creator;
    }

    /**
     * Return the cached connection for the settings' key, creating it on first use.
     */
    public BrokerConnection getOrCreate(HostSettings settings) {
        if (closed) {
            throw new IllegalStateException("Connection registry is closed");
        }
        return connections.computeIfAbsent(settings.connectionKey(), key -> {
            log.debug("Creating connection for {}", key);
            return creator.apply(settings);
        });
    }

    public int size() { return connections.size(); }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        List<BrokerConnection> toClose = new ArrayList<>(connections.values());
        connections.clear();
        for (BrokerConnection connection : toClose) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warn("Error closing connection to {}: {}",
                        connection.getSettings().connectionKey(), e.getMessage());
            }
        }
        log.info("Connection registry closed ({} connection(s))", toClose.size());
    }
}
