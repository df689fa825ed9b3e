package org.eventbus.rabbitmq.config;

import org.eventbus.rabbitmq.publisher.PublisherOptions;
import org.eventbus.rabbitmq.subscriber.SubscriberOptions;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the event bus configuration.
 *
 * <p>Can be loaded from YAML via {@link EventBusSettingsLoader} or built programmatically.</p>
 *
 * <pre>
 * rabbitmq:
 *   default-settings:
 *     host-name: localhost
 *     exchange-name: Orders
 *     use-inbox: false
 *   virtual-host-settings:
 *     users:
 *       virtual-host: users
 *       exchange-name: Users
 *       queue-name: users-queue
 *   publishers:
 *     OrderSubmitted:
 *       routing-key: orders.submitted
 *   subscribers:
 *     UserCreated:
 *       virtual-host-key: users
 *       property-naming-policy: SnakeCaseLower
 * </pre>
 */
public class EventBusSettings {

    private RabbitMqOptions defaultSettings = new RabbitMqOptions();

    /**
     * Publisher options keyed by event class simple name.
     */
    private Map<String, PublisherOptions> publishers = new LinkedHashMap<>();

    /**
     * Subscriber options keyed by event class simple name.
     */
    private Map<String, SubscriberOptions> subscribers = new LinkedHashMap<>();

    /**
     * Named virtual hosts, selected by {@link EventOptions#getVirtualHostKey()}.
     */
    private Map<String, HostSettings> virtualHostSettings = new LinkedHashMap<>();

    // --- Getters / Setters ---

    public RabbitMqOptions getDefaultSettings() { return defaultSettings; }
    public void setDefaultSettings(RabbitMqOptions defaultSettings) { this.defaultSettings = defaultSettings; }

    public Map<String, PublisherOptions> getPublishers() { return publishers; }
    public void setPublishers(Map<String, PublisherOptions> publishers) { this.publishers = publishers; }

    public Map<String, SubscriberOptions> getSubscribers() { return subscribers; }
    public void setSubscribers(Map<String, SubscriberOptions> subscribers) { this.subscribers = subscribers; }

    public Map<String, HostSettings> getVirtualHostSettings() { return virtualHostSettings; }
    public void setVirtualHostSettings(Map<String, HostSettings> virtualHostSettings) {
        this.virtualHostSettings = virtualHostSettings;
    }
}
