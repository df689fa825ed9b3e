package org.eventbus.rabbitmq.subscriber;

import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.config.SettingsResolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Fan-out registry of subscribed events, keyed by event class simple name.
 *
 * <p>Event classes sharing a simple name share one entry; each handler still
 * receives its own event class.</p>
 */
public class SubscriberRegistry {

    /** event class simple name → subscriptions */
    private final Map<String, EventSubscriptions> subscriptions = new ConcurrentHashMap<>();

    /**
     * Register a handler with options. The options replace earlier ones; handlers are kept.
     */
    public <T extends SubscribeEvent> void register(Class<T> eventType,
                                                    Class<? extends EventHandler<T>> handlerType,
                                                    SubscriberOptions options) {
        SubscriberOptions effective = options != null ? options : new SubscriberOptions();
        subscriptions.compute(eventType.getSimpleName(), (name, existing) -> {
            EventSubscriptions entry = existing != null ? existing : new EventSubscriptions(effective);
            entry.setOptions(effective);
            entry.add(new SubscriberRegistration(eventType, handlerType));
            return entry;
        });
    }

    /**
     * Register a handler, creating or updating the options of its event through {@code callback}.
     */
    public <T extends SubscribeEvent> void register(Class<T> eventType,
                                                    Class<? extends EventHandler<T>> handlerType,
                                                    Consumer<SubscriberOptions> callback) {
        subscriptions.compute(eventType.getSimpleName(), (name, existing) -> {
            EventSubscriptions entry = existing != null ? existing : new EventSubscriptions(new SubscriberOptions());
            if (callback != null) {
                callback.accept(entry.getOptions());
            }
            entry.add(new SubscriberRegistration(eventType, handlerType));
            return entry;
        });
    }

    public <T extends SubscribeEvent> void register(Class<T> eventType, Class<? extends EventHandler<T>> handlerType) {
        register(eventType, handlerType, (Consumer<SubscriberOptions>) null);
    }

    /**
     * Resolve the options of every subscribed event against the virtual host settings.
     */
    public void resolveAll(Map<String, HostSettings> virtualHosts, HostSettings defaults) {
        for (Map.Entry<String, EventSubscriptions> entry : subscriptions.entrySet()) {
            SubscriberOptions options = entry.getValue().getOptions();
            HostSettings settings = SettingsResolver.selectHostSettings(options.getVirtualHostKey(), virtualHosts, defaults);
            SettingsResolver.resolve(options, settings, entry.getKey());
        }
    }

    public EventSubscriptions get(String eventName) {
        return subscriptions.get(eventName);
    }

    public Map<String, EventSubscriptions> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(subscriptions));
    }

    public int size() { return subscriptions.size(); }
}
