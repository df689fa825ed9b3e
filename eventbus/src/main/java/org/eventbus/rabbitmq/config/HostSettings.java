package org.eventbus.rabbitmq.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for connecting to one virtual host of a RabbitMQ server.
 *
 * <p>Every field is optional. Unset fields are filled from a parent
 * through {@link #merge(HostSettings)}: the default settings feed every named
 * virtual host, and {@link #defaults()} feeds the default settings.</p>
 *
 * <p>Once the settings cascade has selected an instance for an event it is
 * {@link #freeze() frozen}; setters then fail with {@link IllegalStateException}.</p>
 */
public class HostSettings {

    public static final String DEFAULT_HOST_NAME = "localhost";
    public static final int DEFAULT_HOST_PORT = 5672;
    public static final String DEFAULT_VIRTUAL_HOST = "/";
    public static final String DEFAULT_USER_NAME = "guest";
    public static final String DEFAULT_PASSWORD = "guest";
    public static final String DEFAULT_EXCHANGE_NAME = "DefaultExchange";
    public static final String DEFAULT_EXCHANGE_TYPE = "topic";
    public static final int DEFAULT_RETRY_CONNECTION_COUNT = 3;
    public static final String DEFAULT_SSL_PROTOCOL = "TLSv1.2";
    public static final int DEFAULT_PREFETCH_COUNT = 10;
    public static final int DEFAULT_CONNECTION_TIMEOUT = 10_000;
    public static final int DEFAULT_HEARTBEAT = 30;

    private String hostName;
    private Integer hostPort;
    private String virtualHost;
    private String userName;
    private String password;

    private String exchangeName;

    /** "direct", "fanout", "topic" or "headers" */
    private String exchangeType;

    private String queueName;
    private String routingKey;

    /** Optional "x-arguments" used when declaring a queue. */
    private Map<String, Object> queueArguments = new LinkedHashMap<>();

    /** Optional arguments used when declaring an exchange, e.g. "alternate-exchange". */
    private Map<String, Object> exchangeArguments = new LinkedHashMap<>();

    private Integer retryConnectionCount;

    /** Naming policy of serialized event properties. */
    private NamingPolicyType propertyNamingPolicy;

    /** Naming policy of event type names. */
    private NamingPolicyType eventNamingPolicy;

    private Boolean useTls;
    private String sslProtocolVersion;

    /** PKCS12 key store holding the client certificate and key. */
    private String clientCertPath;
    private String clientCertPassword;

    /** Consumer prefetch count per channel. */
    private Integer prefetchCount;

    /** Connection timeout in milliseconds. */
    private Integer connectionTimeout;

    /** AMQP heartbeat interval in seconds. */
    private Integer heartbeat;

    private boolean frozen;

    /**
     * Built-in defaults at the bottom of the settings cascade.
     */
    public static HostSettings defaults() {
        HostSettings settings = new HostSettings();
        settings.hostName = DEFAULT_HOST_NAME;
        settings.hostPort = DEFAULT_HOST_PORT;
        settings.virtualHost = DEFAULT_VIRTUAL_HOST;
        settings.userName = DEFAULT_USER_NAME;
        settings.password = DEFAULT_PASSWORD;
        settings.exchangeName = DEFAULT_EXCHANGE_NAME;
        settings.exchangeType = DEFAULT_EXCHANGE_TYPE;
        settings.retryConnectionCount = DEFAULT_RETRY_CONNECTION_COUNT;
        settings.propertyNamingPolicy = NamingPolicyType.PASCAL_CASE;
        settings.eventNamingPolicy = NamingPolicyType.PASCAL_CASE;
        settings.useTls = false;
        settings.sslProtocolVersion = DEFAULT_SSL_PROTOCOL;
        settings.prefetchCount = DEFAULT_PREFETCH_COUNT;
        settings.connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        settings.heartbeat = DEFAULT_HEARTBEAT;
        return settings;
    }

    // ========== Merge ==========

    /**
     * Return new settings holding this instance's values where they are set,
     * and the parent's values otherwise. Argument maps are merged key by key,
     * this instance's keys winning. Neither input is modified.
     */
    public HostSettings merge(HostSettings parent) {
        HostSettings merged = new HostSettings();
        copyMerged(merged, this, parent);
        return merged;
    }

    protected static void copyMerged(HostSettings target, HostSettings own, HostSettings parent) {
        HostSettings p = parent != null ? parent : new HostSettings();
        target.hostName = firstSet(own.hostName, p.hostName);
        target.hostPort = own.hostPort != null ? own.hostPort : p.hostPort;
        target.virtualHost = firstSet(own.virtualHost, p.virtualHost);
        target.userName = firstSet(own.userName, p.userName);
        target.password = firstSet(own.password, p.password);
        target.exchangeName = firstSet(own.exchangeName, p.exchangeName);
        target.exchangeType = firstSet(own.exchangeType, p.exchangeType);
        target.queueName = firstSet(own.queueName, p.queueName);
        target.routingKey = firstSet(own.routingKey, p.routingKey);
        target.queueArguments = mergeArguments(own.queueArguments, p.queueArguments);
        target.exchangeArguments = mergeArguments(own.exchangeArguments, p.exchangeArguments);
        target.retryConnectionCount = own.retryConnectionCount != null
                ? own.retryConnectionCount : p.retryConnectionCount;
        target.propertyNamingPolicy = own.propertyNamingPolicy != null
                ? own.propertyNamingPolicy : p.propertyNamingPolicy;
        target.eventNamingPolicy = own.eventNamingPolicy != null ? own.eventNamingPolicy : p.eventNamingPolicy;
        target.useTls = own.useTls != null ? own.useTls : p.useTls;
        target.sslProtocolVersion = firstSet(own.sslProtocolVersion, p.sslProtocolVersion);
        target.clientCertPath = firstSet(own.clientCertPath, p.clientCertPath);
        target.clientCertPassword = firstSet(own.clientCertPassword, p.clientCertPassword);
        target.prefetchCount = own.prefetchCount != null ? own.prefetchCount : p.prefetchCount;
        target.connectionTimeout = own.connectionTimeout != null ? own.connectionTimeout : p.connectionTimeout;
        target.heartbeat = own.heartbeat != null ? own.heartbeat : p.heartbeat;
    }

    private static String firstSet(String own, String parent) {
        return own != null && !own.isEmpty() ? own : parent;
    }

    private static Map<String, Object> mergeArguments(Map<String, Object> own, Map<String, Object> parent) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (own != null) merged.putAll(own);
        if (parent != null) parent.forEach(merged::putIfAbsent);
        return merged;
    }

    // ========== Identity / state ==========

    /**
     * Connection identity: {@code host:port:virtualHost}.
     */
    public String connectionKey() {
        return hostName + ":" + hostPort + ":" + virtualHost;
    }

    /**
     * Make this instance immutable. Idempotent.
     */
    public HostSettings freeze() {
        if (!frozen) {
            queueArguments = Map.copyOf(queueArguments);
            exchangeArguments = Map.copyOf(exchangeArguments);
            frozen = true;
        }
        return this;
    }

    public boolean isFrozen() { return frozen; }

    protected void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Settings of virtual host '" + virtualHost
                    + "' are already resolved and can no longer be changed");
        }
    }

    // --- Getters / Setters ---

    public String getHostName() { return hostName; }
    public void setHostName(String hostName) { checkMutable(); this.hostName = hostName; }

    public Integer getHostPort() { return hostPort; }
    public void setHostPort(Integer hostPort) { checkMutable(); this.hostPort = hostPort; }

    public String getVirtualHost() { return virtualHost; }
    public void setVirtualHost(String virtualHost) { checkMutable(); this.virtualHost = virtualHost; }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { checkMutable(); this.userName = userName; }

    public String getPassword() { return password; }
    public void setPassword(String password) { checkMutable(); this.password = password; }

    public String getExchangeName() { return exchangeName; }
    public void setExchangeName(String exchangeName) { checkMutable(); this.exchangeName = exchangeName; }

    public String getExchangeType() { return exchangeType; }
    public void setExchangeType(String exchangeType) { checkMutable(); this.exchangeType = exchangeType; }

    public String getQueueName() { return queueName; }
    public void setQueueName(String queueName) { checkMutable(); this.queueName = queueName; }

    public String getRoutingKey() { return routingKey; }
    public void setRoutingKey(String routingKey) { checkMutable(); this.routingKey = routingKey; }

    public Map<String, Object> getQueueArguments() { return queueArguments; }
    public void setQueueArguments(Map<String, Object> queueArguments) {
        checkMutable();
        this.queueArguments = queueArguments != null ? new LinkedHashMap<>(queueArguments) : new LinkedHashMap<>();
    }

    public Map<String, Object> getExchangeArguments() { return exchangeArguments; }
    public void setExchangeArguments(Map<String, Object> exchangeArguments) {
        checkMutable();
        this.exchangeArguments = exchangeArguments != null
                ? new LinkedHashMap<>(exchangeArguments) : new LinkedHashMap<>();
    }

    public Integer getRetryConnectionCount() { return retryConnectionCount; }
    public void setRetryConnectionCount(Integer retryConnectionCount) {
        checkMutable();
        this.retryConnectionCount = retryConnectionCount;
    }

    public NamingPolicyType getPropertyNamingPolicy() { return propertyNamingPolicy; }
    public void setPropertyNamingPolicy(NamingPolicyType propertyNamingPolicy) {
        checkMutable();
        this.propertyNamingPolicy = propertyNamingPolicy;
    }

    public NamingPolicyType getEventNamingPolicy() { return eventNamingPolicy; }
    public void setEventNamingPolicy(NamingPolicyType eventNamingPolicy) {
        checkMutable();
        this.eventNamingPolicy = eventNamingPolicy;
    }

    public Boolean getUseTls() { return useTls; }
    public void setUseTls(Boolean useTls) { checkMutable(); this.useTls = useTls; }

    public String getSslProtocolVersion() { return sslProtocolVersion; }
    public void setSslProtocolVersion(String sslProtocolVersion) {
        checkMutable();
        this.sslProtocolVersion = sslProtocolVersion;
    }

    public String getClientCertPath() { return clientCertPath; }
    public void setClientCertPath(String clientCertPath) { checkMutable(); this.clientCertPath = clientCertPath; }

    public String getClientCertPassword() { return clientCertPassword; }
    public void setClientCertPassword(String clientCertPassword) {
        checkMutable();
        this.clientCertPassword = clientCertPassword;
    }

    public Integer getPrefetchCount() { return prefetchCount; }
    public void setPrefetchCount(Integer prefetchCount) { checkMutable(); this.prefetchCount = prefetchCount; }

    public Integer getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Integer connectionTimeout) {
        checkMutable();
        this.connectionTimeout = connectionTimeout;
    }

    public Integer getHeartbeat() { return heartbeat; }
    public void setHeartbeat(Integer heartbeat) { checkMutable(); this.heartbeat = heartbeat; }

    @Override
    public String toString() {
        return "HostSettings{" +
                "hostName='" + hostName + '\'' +
                ", hostPort=" + hostPort +
                ", virtualHost='" + virtualHost + '\'' +
                ", exchangeName='" + exchangeName + '\'' +
                ", exchangeType='" + exchangeType + '\'' +
                ", queueName='" + queueName + '\'' +
                ", routingKey='" + routingKey + '\'' +
                '}';
    }
}
