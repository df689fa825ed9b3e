package org.eventbus.rabbitmq.connection;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.impl.DefaultExceptionHandler;
import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.exception.ConnectionException;
import org.eventbus.rabbitmq.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Self-healing connection to one virtual host.
 *
 * <p>State moves {@code DISCONNECTED -> CONNECTING -> CONNECTED} under a per-connection lock.
 * Transport failures are retried up to {@code retryConnectionCount} times with a
 * {@code 2^attempt} second pause; any other failure is fatal.</p>
 *
 * <p>Once connected, each of these leads to {@link #recover(Connection)}:</p>
 * <ul>
 *   <li>a shutdown signal of the connection</li>
 *   <li>a blocked notification</li>
 *   <li>an unexpected driver exception</li>
 *   <li>an exception escaping a consumer callback</li>
 * </ul>
 * <p>Recovery runs on the single recovery thread of this instance: reconnects of one
 * virtual host are serialized, reconnects of different virtual hosts are independent.</p>
 */
public class RabbitMqConnection implements BrokerConnection {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqConnection.class);

    private final HostSettings settings;
    private final ConnectionFactory factory;
    private final ConnectBackoff backoff;
    private final Executor recoveryExecutor;
    private final boolean ownsExecutor;

    private final ReentrantLock lock = new ReentrantLock();

    private volatile Connection connection;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean disposed;

    private final ShutdownListener shutdownListener = this::onShutdown;
    private final BlockedListener blockedListener = new BlockedListener() {
        @Override
        public void handleBlocked(String reason) {
            log.warn("Connection to {} is blocked by the broker: {}", describe(), reason);
            recover(connection);
        }

        @Override
        public void handleUnblocked() {
            log.info("Connection to {} is unblocked", describe());
        }
    };

    public RabbitMqConnection(HostSettings settings) {
        this.settings = settings;
        this.factory = ConnectionFactories.create(settings, new RecoveringExceptionHandler());
        this.backoff = ConnectBackoff.exponential();
        this.recoveryExecutor = Executors.newSingleThreadExecutor(
                new DaemonThreadFactory("eventbus-recovery-" + settings.getVirtualHost() + "-"));
        this.ownsExecutor = true;
    }

    /**
     * Create a connection with an externally built factory.
     *
     * @param recoveryExecutor must run tasks one at a time
     */
    public RabbitMqConnection(HostSettings settings, ConnectionFactory factory,
                              ConnectBackoff backoff, Executor recoveryExecutor) {
        this.settings = settings;
        this.factory = factory;
        this.backoff = backoff;
        this.recoveryExecutor = recoveryExecutor;
        this.ownsExecutor = false;
        factory.setExceptionHandler(new RecoveringExceptionHandler());
    }

    @Override
    public HostSettings getSettings() { return settings; }

    @Override
    public boolean isConnected() {
        Connection current = connection;
        return current != null && current.isOpen() && !disposed;
    }

    @Override
    public ConnectionState getState() {
        if (state == ConnectionState.CONNECTED && !isConnected()) {
            return ConnectionState.DISCONNECTED;
        }
        return state;
    }

    // ========== Connect ==========

    @Override
    public void connect() {
        lock.lock();
        try {
            if (disposed) {
                throw new ConnectionException("Connection to " + describe() + " is already closed");
            }
            if (isConnected()) {
                return;
            }
            discardStale();
            state = ConnectionState.CONNECTING;
            tryConnect();
        } finally {
            if (state != ConnectionState.CONNECTED) {
                state = ConnectionState.DISCONNECTED;
            }
            lock.unlock();
        }
    }

    private void tryConnect() {
        int attempts = Math.max(1, settings.getRetryConnectionCount() != null ? settings.getRetryConnectionCount() : 1);
        Exception lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                Connection opened = factory.newConnection("eventbus-" + settings.getVirtualHost());
                if (opened == null) {
                    throw new ConnectionException("Broker returned no connection for " + describe());
                }
                opened.addShutdownListener(shutdownListener);
                opened.addBlockedListener(blockedListener);
                connection = opened;
                state = ConnectionState.CONNECTED;
                log.info("Connected to {} (attempt {}/{})", describe(), attempt, attempts);
                return;
            } catch (IOException | TimeoutException e) {
                lastError = e;
                if (!isTransient(e)) {
                    throw new ConnectionException("Could not connect to " + describe() + ": " + e.getMessage(), e);
                }
                log.warn("Connection attempt {}/{} to {} failed: {}", attempt, attempts, describe(), e.getMessage());
            } catch (ConnectionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConnectionException("Could not connect to " + describe() + ": " + e.getMessage(), e);
            }

            if (attempt < attempts) {
                try {
                    backoff.await(attempt);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ConnectionException("Connecting to " + describe() + " was interrupted", e);
                }
            }
        }

        throw new ConnectionException("Could not connect to " + describe() + " after " + attempts
                + " attempt(s)", lastError);
    }

    /**
     * Transport-level failures that are worth another attempt: socket errors,
     * timeouts and unresolvable or unreachable brokers.
     */
    static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketException
                    || t instanceof SocketTimeoutException
                    || t instanceof UnknownHostException
                    || t instanceof TimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    // ========== Channels ==========

    @Override
    public Channel createChannel() {
        connect();
        Connection current = connection;
        if (current == null || !isConnected()) {
            throw new ConnectionException("Could not create a channel because the connection to the '"
                    + settings.getVirtualHost() + "' virtual host of '" + settings.getHostName() + "' is not open");
        }
        try {
            Channel channel = current.createChannel();
            if (channel == null) {
                throw new ConnectionException("No channel available on the '" + settings.getVirtualHost()
                        + "' virtual host of '" + settings.getHostName() + "'");
            }
            return channel;
        } catch (IOException | AlreadyClosedException e) {
            throw new ConnectionException("Could not create a channel on the '" + settings.getVirtualHost()
                    + "' virtual host of '" + settings.getHostName() + "'", e);
        }
    }

    // ========== Recovery ==========

    private void onShutdown(ShutdownSignalException cause) {
        if (disposed) {
            return;
        }
        log.warn("Connection to {} was shut down: {}", describe(), cause.getMessage());
        Object reference = cause.getReference();
        recover(reference instanceof Connection failed ? failed : connection);
    }

    /**
     * Schedule a reconnect replacing {@code failed}. Ignored when {@code failed}
     * was already replaced or this instance is closed.
     */
    void recover(Connection failed) {
        if (disposed) {
            return;
        }
        try {
            recoveryExecutor.execute(() -> doRecover(failed));
        } catch (RejectedExecutionException e) {
            log.debug("Recovery of {} skipped, executor is shut down", describe());
        }
    }

    private void doRecover(Connection failed) {
        lock.lock();
        try {
            if (disposed || failed == null || failed != connection) {
                log.debug("Recovery of {} skipped, connection was already replaced", describe());
                return;
            }
            log.info("Recovering connection to {}", describe());
            discardStale();
            connect();
        } catch (ConnectionException e) {
            log.error("Failed to recover connection to {}", describe(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Detach listeners from the current connection object and dispose it. Caller holds the lock.
     */
    private void discardStale() {
        Connection stale = connection;
        connection = null;
        state = ConnectionState.DISCONNECTED;
        if (stale == null) {
            return;
        }
        detach(stale);
        try {
            stale.abort();
        } catch (RuntimeException e) {
            log.debug("Error aborting stale connection to {}: {}", describe(), e.getMessage());
        }
    }

    private void detach(Connection target) {
        target.removeShutdownListener(shutdownListener);
        target.removeBlockedListener(blockedListener);
    }

    // ========== Close ==========

    @Override
    public void close() {
        lock.lock();
        try {
            if (disposed) {
                return;
            }
            disposed = true;
            Connection current = connection;
            connection = null;
            state = ConnectionState.DISCONNECTED;
            if (current != null) {
                detach(current);
                try {
                    if (current.isOpen()) {
                        current.close();
                    }
                } catch (IOException | AlreadyClosedException e) {
                    log.warn("Error closing connection to {}: {}", describe(), e.getMessage());
                }
            }
        } finally {
            lock.unlock();
        }
        if (ownsExecutor && recoveryExecutor instanceof ExecutorService executor) {
            executor.shutdownNow();
        }
        log.info("Connection to {} closed", describe());
    }

    private String describe() {
        return "'" + settings.getVirtualHost() + "' virtual host of '" + settings.getHostName() + ":"
                + settings.getHostPort() + "'";
    }

    /**
     * Forwards unexpected driver failures and exceptions thrown from consumer callbacks
     * to the recovery routine. The library default still runs first, so a failing
     * consumer's channel is closed before the connection is replaced.
     */
    private class RecoveringExceptionHandler extends DefaultExceptionHandler {
        @Override
        public void handleUnexpectedConnectionDriverException(Connection conn, Throwable exception) {
            super.handleUnexpectedConnectionDriverException(conn, exception);
            recover(conn);
        }

        @Override
        public void handleConsumerException(Channel channel, Throwable exception, Consumer consumer,
                                            String consumerTag, String methodName) {
            super.handleConsumerException(channel, exception, consumer, consumerTag, methodName);
            log.warn("Consumer {} on {} failed in {}, recovering the connection",
                    consumerTag, describe(), methodName);
            recover(channel.getConnection());
        }
    }
}
