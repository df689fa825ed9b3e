package org.eventbus.rabbitmq.publisher;

import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.config.SettingsResolver;
import org.eventbus.rabbitmq.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Publisher options per published event type.
 */
public class PublisherRegistry {

    private static final Logger log = LoggerFactory.getLogger(PublisherRegistry.class);

    /** event class → options */
    private final Map<Class<? extends PublishEvent>, PublisherOptions> publishers =
            Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * Register a publisher, replacing any options registered before.
     */
    public void register(Class<? extends PublishEvent> eventType, PublisherOptions options) {
        publishers.put(eventType, options != null ? options : new PublisherOptions());
    }

    /**
     * Register a publisher, or update the options of an already registered one.
     */
    public void register(Class<? extends PublishEvent> eventType, Consumer<PublisherOptions> callback) {
        publishers.compute(eventType, (type, existing) -> {
            PublisherOptions options = existing != null ? existing : new PublisherOptions();
            if (callback != null) {
                callback.accept(options);
            }
            return options;
        });
    }

    /**
     * Resolve the options of every registered publisher against the virtual host settings.
     */
    public void resolveAll(Map<String, HostSettings> virtualHosts, HostSettings defaults) {
        for (Map.Entry<Class<? extends PublishEvent>, PublisherOptions> entry : snapshot().entrySet()) {
            PublisherOptions options = entry.getValue();
            HostSettings settings = SettingsResolver.selectHostSettings(options.getVirtualHostKey(), virtualHosts, defaults);
            SettingsResolver.resolve(options, settings, entry.getKey().getSimpleName());
        }
    }

    /**
     * @throws ConfigurationException if no publisher was registered for the event type
     */
    public PublisherOptions optionsFor(Class<?> eventType) {
        PublisherOptions options = publishers.get(eventType);
        if (options == null) {
            throw new ConfigurationException("No publisher is registered for the '"
                    + eventType.getSimpleName() + "' event.");
        }
        if (!options.isResolved()) {
            throw new ConfigurationException("The publisher options of the '"
                    + eventType.getSimpleName() + "' event are not resolved.");
        }
        return options;
    }

    /**
     * Declare the exchange of every publish target once. Failures are logged and skipped.
     */
    public void declareExchanges(PublisherChannelManager channels) {
        Set<String> declared = new LinkedHashSet<>();
        for (Map.Entry<Class<? extends PublishEvent>, PublisherOptions> entry : snapshot().entrySet()) {
            HostSettings settings = entry.getValue().getVirtualHostSettings();
            if (settings == null || !declared.add(PublisherChannelManager.targetKey(settings))) {
                continue;
            }
            try {
                channels.declareExchange(settings);
            } catch (Exception e) {
                declared.remove(PublisherChannelManager.targetKey(settings));
                log.error("Error while creating the exchange for the {} publisher", entry.getKey().getSimpleName(), e);
            }
        }
    }

    public Map<Class<? extends PublishEvent>, PublisherOptions> snapshot() {
        synchronized (publishers) {
            return new LinkedHashMap<>(publishers);
        }
    }

    public int size() { return publishers.size(); }
}
