package org.eventbus.rabbitmq.connection;

import com.rabbitmq.client.Channel;
import org.eventbus.rabbitmq.config.HostSettings;

import java.io.Closeable;

/**
 * One shared broker connection per {@code host:port:virtualHost}.
 *
 * <p>Publishers and consumer groups only ever hold a reference obtained from
 * {@link ConnectionRegistry}; they open channels on it but never open
 * connections of their own.</p>
 *
 * <p>Implementations must be thread-safe and recover on their own when the
 * broker drops the connection.</p>
 */
public interface BrokerConnection extends Closeable {

    /**
     * @return settings this connection was created from
     */
    HostSettings getSettings();

    /**
     * @return true only while the underlying connection is open and this instance is not closed
     */
    boolean isConnected();

    ConnectionState getState();

    /**
     * Open the connection unless it is already open.
     *
     * @throws org.eventbus.rabbitmq.exception.ConnectionException if all attempts failed
     */
    void connect();

    /**
     * Open a new channel, connecting first when needed.
     *
     * @throws org.eventbus.rabbitmq.exception.ConnectionException if the connection or channel could not be opened
     */
    Channel createChannel();

    /**
     * Close the connection and stop recovering it.
     * Idempotent.
     */
    @Override
    void close();
}
