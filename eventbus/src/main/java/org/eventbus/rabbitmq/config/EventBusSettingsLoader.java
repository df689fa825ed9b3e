package org.eventbus.rabbitmq.config;

import org.eventbus.rabbitmq.exception.ConfigurationException;
import org.eventbus.rabbitmq.publisher.PublisherOptions;
import org.eventbus.rabbitmq.subscriber.SubscriberOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads {@link EventBusSettings} from a YAML file.
 *
 * <p>Everything lives under the {@code rabbitmq} root key. Keys are kebab case;
 * naming policies accept both {@code SnakeCaseLower} and {@code SNAKE_CASE_LOWER}.</p>
 */
public class EventBusSettingsLoader {

    /**
     * Load settings from a YAML file path.
     */
    public static EventBusSettings fromYaml(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return fromYaml(is);
        }
    }

    /**
     * Load settings from a classpath resource.
     */
    public static EventBusSettings fromClasspath(String resource) {
        try (InputStream is = EventBusSettingsLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            return fromYaml(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load event bus settings from classpath: " + resource, e);
        }
    }

    /**
     * Load settings from an InputStream.
     */
    public static EventBusSettings fromYaml(InputStream is) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(is);
        if (root == null) {
            throw new ConfigurationException("Event bus settings are empty");
        }

        Map<String, Object> rabbitmq = getMap(root, "rabbitmq");
        EventBusSettings settings = new EventBusSettings();

        Map<String, Object> defaults = getMapOrEmpty(rabbitmq, "default-settings");
        RabbitMqOptions options = new RabbitMqOptions();
        parseHost(defaults, options);
        if (defaults.containsKey("enabled")) {
            options.setEnabled(Boolean.parseBoolean(String.valueOf(defaults.get("enabled"))));
        }
        if (defaults.containsKey("use-inbox")) {
            options.setUseInbox(Boolean.parseBoolean(String.valueOf(defaults.get("use-inbox"))));
        }
        if (defaults.containsKey("reconnect-interval")) {
            options.setReconnectInterval(parseDuration(String.valueOf(defaults.get("reconnect-interval"))));
        }
        settings.setDefaultSettings(options);

        for (Map.Entry<String, Map<String, Object>> entry : entries(rabbitmq, "virtual-host-settings").entrySet()) {
            HostSettings host = new HostSettings();
            parseHost(entry.getValue(), host);
            settings.getVirtualHostSettings().put(entry.getKey(), host);
        }

        for (Map.Entry<String, Map<String, Object>> entry : entries(rabbitmq, "publishers").entrySet()) {
            PublisherOptions publisher = new PublisherOptions();
            parseEvent(entry.getValue(), publisher);
            settings.getPublishers().put(entry.getKey(), publisher);
        }

        for (Map.Entry<String, Map<String, Object>> entry : entries(rabbitmq, "subscribers").entrySet()) {
            SubscriberOptions subscriber = new SubscriberOptions();
            parseEvent(entry.getValue(), subscriber);
            if (entry.getValue().containsKey("queue-name")) {
                subscriber.setQueueName(String.valueOf(entry.getValue().get("queue-name")));
            }
            settings.getSubscribers().put(entry.getKey(), subscriber);
        }

        return settings;
    }

    @SuppressWarnings("unchecked")
    private static void parseHost(Map<String, Object> map, HostSettings host) {
        if (map.containsKey("host-name")) host.setHostName(String.valueOf(map.get("host-name")));
        if (map.containsKey("host-port")) host.setHostPort(toInt(map.get("host-port"), HostSettings.DEFAULT_HOST_PORT));
        if (map.containsKey("virtual-host")) host.setVirtualHost(String.valueOf(map.get("virtual-host")));
        if (map.containsKey("user-name")) host.setUserName(String.valueOf(map.get("user-name")));
        if (map.containsKey("password")) host.setPassword(String.valueOf(map.get("password")));
        if (map.containsKey("exchange-name")) host.setExchangeName(String.valueOf(map.get("exchange-name")));
        if (map.containsKey("exchange-type")) host.setExchangeType(String.valueOf(map.get("exchange-type")));
        if (map.containsKey("queue-name")) host.setQueueName(String.valueOf(map.get("queue-name")));
        if (map.containsKey("routing-key")) host.setRoutingKey(String.valueOf(map.get("routing-key")));
        if (map.get("queue-arguments") instanceof Map<?, ?> args) {
            host.setQueueArguments((Map<String, Object>) args);
        }
        if (map.get("exchange-arguments") instanceof Map<?, ?> args) {
            host.setExchangeArguments((Map<String, Object>) args);
        }
        if (map.containsKey("retry-connection-count"))
            host.setRetryConnectionCount(toInt(map.get("retry-connection-count"),
                    HostSettings.DEFAULT_RETRY_CONNECTION_COUNT));
        if (map.containsKey("property-naming-policy"))
            host.setPropertyNamingPolicy(toPolicy(map.get("property-naming-policy")));
        if (map.containsKey("event-naming-policy"))
            host.setEventNamingPolicy(toPolicy(map.get("event-naming-policy")));
        if (map.containsKey("use-tls")) host.setUseTls(Boolean.parseBoolean(String.valueOf(map.get("use-tls"))));
        if (map.containsKey("ssl-protocol-version"))
            host.setSslProtocolVersion(String.valueOf(map.get("ssl-protocol-version")));
        if (map.containsKey("client-cert-path")) host.setClientCertPath(String.valueOf(map.get("client-cert-path")));
        if (map.containsKey("client-cert-password"))
            host.setClientCertPassword(String.valueOf(map.get("client-cert-password")));
        if (map.containsKey("prefetch-count"))
            host.setPrefetchCount(toInt(map.get("prefetch-count"), HostSettings.DEFAULT_PREFETCH_COUNT));
        if (map.containsKey("connection-timeout"))
            host.setConnectionTimeout(toInt(map.get("connection-timeout"), HostSettings.DEFAULT_CONNECTION_TIMEOUT));
        if (map.containsKey("heartbeat")) host.setHeartbeat(toInt(map.get("heartbeat"), HostSettings.DEFAULT_HEARTBEAT));
    }

    private static void parseEvent(Map<String, Object> map, EventOptions options) {
        if (map.containsKey("event-type-name")) options.setEventTypeName(String.valueOf(map.get("event-type-name")));
        if (map.containsKey("routing-key")) options.setRoutingKey(String.valueOf(map.get("routing-key")));
        if (map.containsKey("virtual-host-key")) options.setVirtualHostKey(String.valueOf(map.get("virtual-host-key")));
        if (map.containsKey("property-naming-policy"))
            options.setPropertyNamingPolicy(toPolicy(map.get("property-naming-policy")));
    }

    // ========== Utility ==========

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        throw new ConfigurationException("Missing or invalid key: " + key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMapOrEmpty(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        return new LinkedHashMap<>();
    }

    /**
     * Entries of a keyed section. An entry without a body (e.g. {@code OrderSubmitted:}) is an empty map.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> entries(Map<String, Object> parent, String key) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : getMapOrEmpty(parent, key).entrySet()) {
            Object val = entry.getValue();
            result.put(String.valueOf(entry.getKey()),
                    val instanceof Map ? (Map<String, Object>) val : new LinkedHashMap<>());
        }
        return result;
    }

    private static int toInt(Object val, int defaultVal) {
        if (val == null) return defaultVal;
        if (val instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(val).trim());
        } catch (NumberFormatException e) {
            return defaultVal;
        }
    }

    private static NamingPolicyType toPolicy(Object val) {
        try {
            return NamingPolicyType.fromName(String.valueOf(val));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    /**
     * Parse simple duration strings: "5s", "30m", "1h", "500ms".
     * Falls back to seconds if no unit specified.
     */
    static Duration parseDuration(String str) {
        if (str == null || str.isBlank()) return RabbitMqOptions.DEFAULT_RECONNECT_INTERVAL;
        str = str.trim().toLowerCase();
        if (str.endsWith("ms")) return Duration.ofMillis(Long.parseLong(str.replace("ms", "").trim()));
        if (str.endsWith("s")) return Duration.ofSeconds(Long.parseLong(str.replace("s", "").trim()));
        if (str.endsWith("m")) return Duration.ofMinutes(Long.parseLong(str.replace("m", "").trim()));
        if (str.endsWith("h")) return Duration.ofHours(Long.parseLong(str.replace("h", "").trim()));
        return Duration.ofSeconds(Long.parseLong(str));
    }
}
