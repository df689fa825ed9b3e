package org.eventbus.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventbus.rabbitmq.config.EventBusSettings;
import org.eventbus.rabbitmq.config.EventBusSettingsLoader;
import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.config.RabbitMqOptions;
import org.eventbus.rabbitmq.config.SettingsResolver;
import org.eventbus.rabbitmq.connection.BrokerConnection;
import org.eventbus.rabbitmq.connection.ConnectionRegistry;
import org.eventbus.rabbitmq.exception.ConfigurationException;
import org.eventbus.rabbitmq.inbox.InboxStore;
import org.eventbus.rabbitmq.publisher.EventPublisherManager;
import org.eventbus.rabbitmq.publisher.MessageBrokerEventPublisher;
import org.eventbus.rabbitmq.publisher.PublishEvent;
import org.eventbus.rabbitmq.publisher.PublisherChannelManager;
import org.eventbus.rabbitmq.publisher.PublisherOptions;
import org.eventbus.rabbitmq.publisher.PublisherRegistry;
import org.eventbus.rabbitmq.serialization.JsonEventSerializer;
import org.eventbus.rabbitmq.subscriber.EventHandler;
import org.eventbus.rabbitmq.subscriber.EventHandlersCompletedListener;
import org.eventbus.rabbitmq.subscriber.HandlerResolver;
import org.eventbus.rabbitmq.subscriber.MessageDispatcher;
import org.eventbus.rabbitmq.subscriber.SubscribeEvent;
import org.eventbus.rabbitmq.subscriber.SubscribedEventListener;
import org.eventbus.rabbitmq.subscriber.SubscriberManager;
import org.eventbus.rabbitmq.subscriber.SubscriberOptions;
import org.eventbus.rabbitmq.subscriber.SubscriberRegistry;
import org.eventbus.rabbitmq.tracing.EventTracer;
import org.eventbus.rabbitmq.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Main entry point of the RabbitMQ event bus.
 *
 * <p>Assembles the settings cascade, the shared connections, the publishers and the
 * consumer groups, and owns their lifecycle.</p>
 *
 * <h3>Usage with YAML settings:</h3>
 * <pre>
 * var bus = RabbitMqEventBus.fromYaml(Path.of("eventbus.yml"))
 *         .publisher(OrderSubmitted.class)
 *         .subscriber(UserCreated.class, UserCreatedHandler.class)
 *         .handlerResolver(HandlerResolver.instantiating())
 *         .build();
 * bus.start();
 * try (var publisher = bus.createPublisher()) {
 *     publisher.publish(new OrderSubmitted(...));
 * }
 * bus.close();
 * </pre>
 *
 * <h3>Code-level overrides:</h3>
 * <pre>
 * RabbitMqEventBus.builder()
 *         .defaultSettings(s -> s.setExchangeName("Orders"))
 *         .virtualHost("users", s -> { s.setVirtualHost("users"); s.setExchangeName("Users"); })
 *         .subscriber(UserCreated.class, UserCreatedHandler.class, o -> o.setVirtualHostKey("users"))
 *         .build();
 * </pre>
 */
public class RabbitMqEventBus implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqEventBus.class);

    private final RabbitMqOptions defaultSettings;
    private final Map<String, HostSettings> virtualHostSettings;
    private final PublisherRegistry publisherRegistry;
    private final SubscriberRegistry subscriberRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final PublisherChannelManager channelManager;
    private final JsonEventSerializer serializer;
    private final EventTracer tracer;
    private final SubscriberManager subscriberManager;
    private final ExecutorService publishExecutor =
            Executors.newCachedThreadPool(new DaemonThreadFactory("eventbus-publish-"));

    private volatile boolean running = false;
    private volatile boolean closed = false;

    // ========== Factory methods ==========

    public static Builder builder() {
        return new Builder();
    }

    public static Builder fromYaml(Path path) {
        try {
            return new Builder().settings(EventBusSettingsLoader.fromYaml(path));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load event bus settings from " + path, e);
        }
    }

    public static Builder fromClasspath(String resource) {
        return new Builder().settings(EventBusSettingsLoader.fromClasspath(resource));
    }

    // ========== Constructor ==========

    private RabbitMqEventBus(Builder builder, RabbitMqOptions defaultSettings,
                             Map<String, HostSettings> virtualHostSettings,
                             PublisherRegistry publisherRegistry, SubscriberRegistry subscriberRegistry) {
        this.defaultSettings = defaultSettings;
        this.virtualHostSettings = virtualHostSettings;
        this.publisherRegistry = publisherRegistry;
        this.subscriberRegistry = subscriberRegistry;
        this.connectionRegistry = builder.connectionCreator != null
                ? new ConnectionRegistry(builder.connectionCreator)
                : new ConnectionRegistry();
        this.channelManager = new PublisherChannelManager(connectionRegistry);
        this.serializer = new JsonEventSerializer(builder.objectMapper != null
                ? builder.objectMapper : JsonEventSerializer.defaultObjectMapper());
        this.tracer = builder.tracer != null ? builder.tracer : EventTracer.noop();

        MessageDispatcher dispatcher = new MessageDispatcher(builder.handlerResolver, serializer, tracer,
                defaultSettings.isUseInbox(), builder.inboxStore, builder.subscribedListeners,
                builder.completedListeners);
        this.subscriberManager = new SubscriberManager(subscriberRegistry, connectionRegistry, dispatcher,
                defaultSettings.getReconnectInterval());
    }

    // ========== Lifecycle ==========

    /**
     * Declare publisher exchanges and start consuming.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RabbitMQ event bus is closed");
        }
        if (running) {
            log.warn("RabbitMQ event bus is already running");
            return;
        }
        running = true;
        if (!defaultSettings.isEnabled()) {
            log.info("Since the RabbitMQ functionality is disabled, publishing and subscribing events will be skipped.");
            return;
        }

        log.info("Starting RabbitMQ event bus ({} publisher(s), {} subscribed event(s))",
                publisherRegistry.size(), subscriberRegistry.size());
        publisherRegistry.snapshot().forEach((type, options) ->
                log.debug("Loaded publisher {}: {}", type.getSimpleName(), options));
        subscriberRegistry.snapshot().forEach((name, subscriptions) ->
                log.debug("Loaded subscriber {}: {}", name, subscriptions));

        publisherRegistry.declareExchanges(channelManager);
        subscriberManager.start();
        log.info("RabbitMQ event bus started (consumer groups: {})", subscriberManager.getGroups().size());
    }

    /**
     * Stop consuming and release every channel and connection. Idempotent.
     */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        running = false;

        subscriberManager.close();
        publishExecutor.shutdown();
        channelManager.close();
        connectionRegistry.close();
        log.info("RabbitMQ event bus closed");
    }

    public boolean isRunning() { return running; }

    // ========== Publishing ==========

    /**
     * A new publisher with its own collect buffer. Close it to flush what it collected.
     * Asynchronous publishes run on the bus's publish threads, stopped by {@link #close()}.
     */
    public EventPublisherManager createPublisher() {
        return new EventPublisherManager(publisherRegistry, channelManager, serializer, tracer, defaultSettings,
                publishExecutor);
    }

    /**
     * Publisher used by an outbox to send stored events.
     */
    public MessageBrokerEventPublisher outboxPublisher() {
        return new MessageBrokerEventPublisher(defaultSettings.isEnabled() ? createPublisher() : null);
    }

    // --- Getters ---

    public RabbitMqOptions getDefaultSettings() { return defaultSettings; }
    public Map<String, HostSettings> getVirtualHostSettings() { return virtualHostSettings; }
    public PublisherRegistry getPublisherRegistry() { return publisherRegistry; }
    public SubscriberRegistry getSubscriberRegistry() { return subscriberRegistry; }
    public ConnectionRegistry getConnectionRegistry() { return connectionRegistry; }
    public SubscriberManager getSubscriberManager() { return subscriberManager; }

    // ========== Builder ==========

    public static class Builder {

        private EventBusSettings settings = new EventBusSettings();
        private Consumer<RabbitMqOptions> defaultSettings;
        private final Map<String, HostSettings> virtualHosts = new LinkedHashMap<>();
        private final List<Consumer<Registration>> publishers = new ArrayList<>();
        private final List<Consumer<Registration>> subscribers = new ArrayList<>();
        private final List<SubscribedEventListener> subscribedListeners = new ArrayList<>();
        private final List<EventHandlersCompletedListener> completedListeners = new ArrayList<>();
        private HandlerResolver handlerResolver = HandlerResolver.instantiating();
        private InboxStore inboxStore;
        private EventTracer tracer;
        private ObjectMapper objectMapper;
        private Function<HostSettings, BrokerConnection> connectionCreator;

        private Builder() {
        }

        public Builder settings(EventBusSettings settings) {
            this.settings = settings != null ? settings : new EventBusSettings();
            return this;
        }

        /**
         * Override default settings after the configuration is loaded.
         */
        public Builder defaultSettings(Consumer<RabbitMqOptions> callback) {
            this.defaultSettings = callback;
            return this;
        }

        /**
         * Add or override a named virtual host. Values set here win over configured ones.
         */
        public Builder virtualHost(String key, Consumer<HostSettings> callback) {
            HostSettings host = virtualHosts.computeIfAbsent(key, k -> new HostSettings());
            callback.accept(host);
            return this;
        }

        public Builder publisher(Class<? extends PublishEvent> eventType) {
            return publisher(eventType, null);
        }

        public Builder publisher(Class<? extends PublishEvent> eventType, Consumer<PublisherOptions> callback) {
            publishers.add(registration -> {
                PublisherOptions configured = registration.settings.getPublishers().get(eventType.getSimpleName());
                registration.usedPublisherNames.add(eventType.getSimpleName());
                if (configured != null) {
                    registration.publishers.register(eventType, configured);
                }
                registration.publishers.register(eventType, callback);
            });
            return this;
        }

        public <T extends SubscribeEvent> Builder subscriber(Class<T> eventType,
                                                             Class<? extends EventHandler<T>> handlerType) {
            return subscriber(eventType, handlerType, null);
        }

        public <T extends SubscribeEvent> Builder subscriber(Class<T> eventType,
                                                             Class<? extends EventHandler<T>> handlerType,
                                                             Consumer<SubscriberOptions> callback) {
            subscribers.add(registration -> {
                SubscriberOptions configured = registration.settings.getSubscribers().get(eventType.getSimpleName());
                registration.usedSubscriberNames.add(eventType.getSimpleName());
                if (configured != null) {
                    registration.subscribers.register(eventType, handlerType, configured);
                }
                registration.subscribers.register(eventType, handlerType, callback);
            });
            return this;
        }

        public Builder handlerResolver(HandlerResolver handlerResolver) {
            this.handlerResolver = handlerResolver;
            return this;
        }

        public Builder inboxStore(InboxStore inboxStore) {
            this.inboxStore = inboxStore;
            return this;
        }

        public Builder tracer(EventTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder onEventSubscribed(SubscribedEventListener listener) {
            subscribedListeners.add(listener);
            return this;
        }

        public Builder onEventHandlersCompleted(EventHandlersCompletedListener listener) {
            completedListeners.add(listener);
            return this;
        }

        /**
         * Replace how connections are created, e.g. to share a client factory.
         */
        public Builder connectionCreator(Function<HostSettings, BrokerConnection> connectionCreator) {
            this.connectionCreator = connectionCreator;
            return this;
        }

        /**
         * Resolve every publisher and subscriber against the settings cascade.
         *
         * @throws ConfigurationException if a required setting is missing, or the inbox is
         *                                enabled without an {@link InboxStore}
         */
        public RabbitMqEventBus build() {
            RabbitMqOptions defaults = SettingsResolver.prepareDefaults(settings.getDefaultSettings(), defaultSettings);
            Map<String, HostSettings> hosts = SettingsResolver.prepareVirtualHosts(
                    settings.getVirtualHostSettings(), virtualHosts, defaults);

            if (defaults.isEnabled() && defaults.isUseInbox() && inboxStore == null) {
                throw new ConfigurationException("The RabbitMQ is configured to use the Inbox for received events, "
                        + "but no inbox store is configured.");
            }

            Registration registration = new Registration(settings);
            publishers.forEach(p -> p.accept(registration));
            subscribers.forEach(s -> s.accept(registration));
            registration.warnUnused();

            registration.publishers.resolveAll(hosts, defaults);
            registration.subscribers.resolveAll(hosts, defaults);
            defaults.freeze();

            return new RabbitMqEventBus(this, defaults, Map.copyOf(hosts),
                    registration.publishers, registration.subscribers);
        }
    }

    private static final class Registration {
        final EventBusSettings settings;
        final PublisherRegistry publishers = new PublisherRegistry();
        final SubscriberRegistry subscribers = new SubscriberRegistry();
        final Set<String> usedPublisherNames = new HashSet<>();
        final Set<String> usedSubscriberNames = new HashSet<>();

        Registration(EventBusSettings settings) {
            this.settings = settings;
        }

        void warnUnused() {
            settings.getPublishers().keySet().stream()
                    .filter(name -> !usedPublisherNames.contains(name))
                    .forEach(name -> log.warn("Publisher settings of '{}' are configured, but no such publisher is registered", name));
            settings.getSubscribers().keySet().stream()
                    .filter(name -> !usedSubscriberNames.contains(name))
                    .forEach(name -> log.warn("Subscriber settings of '{}' are configured, but no such subscriber is registered", name));
        }
    }
}
