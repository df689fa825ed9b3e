package org.eventbus.rabbitmq.connection;

/**
 * Lifecycle of a {@link BrokerConnection}. The cycle restarts at
 * {@link #DISCONNECTED} whenever the broker drops the connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
