package org.eventbus.rabbitmq.publisher;

import com.rabbitmq.client.AMQP;
import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.config.NamingPolicyType;
import org.eventbus.rabbitmq.config.RabbitMqOptions;
import org.eventbus.rabbitmq.exception.PublishException;
import org.eventbus.rabbitmq.serialization.JsonEventSerializer;
import org.eventbus.rabbitmq.tracing.EventBusTagNames;
import org.eventbus.rabbitmq.tracing.EventTracer;
import org.eventbus.rabbitmq.tracing.TraceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link EventPublisher} writing to the exchanges resolved by {@link PublisherRegistry}.
 *
 * <p>Headers of a message are the naming policy marker, the trace parent of the publish
 * span when a trace is recorded, and the event's own headers, which win on collision.</p>
 *
 * <p>Each instance owns its collect buffer; channels are shared through
 * {@link PublisherChannelManager}.</p>
 */
public class EventPublisherManager implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisherManager.class);

    static final String CONTENT_TYPE = "application/json";
    static final int PERSISTENT = 2;

    private final PublisherRegistry registry;
    private final PublisherChannelManager channels;
    private final JsonEventSerializer serializer;
    private final EventTracer tracer;
    private final RabbitMqOptions options;
    private final Executor asyncExecutor;

    /** event id → event, in collect order */
    private final Map<UUID, PublishEvent> collected = new LinkedHashMap<>();

    private volatile boolean closed = false;

    /**
     * @param asyncExecutor runs {@link #publishAsync(PublishEvent)}; a publish may block while
     *                      the connection is being re-established
     */
    public EventPublisherManager(PublisherRegistry registry, PublisherChannelManager channels,
                                 JsonEventSerializer serializer, EventTracer tracer, RabbitMqOptions options,
                                 Executor asyncExecutor) {
        this.registry = registry;
        this.channels = channels;
        this.serializer = serializer;
        this.tracer = tracer != null ? tracer : EventTracer.noop();
        this.options = options;
        this.asyncExecutor = asyncExecutor;
    }

    // ========== Publish ==========

    @Override
    public void publish(PublishEvent event) {
        if (!options.isEnabled()) {
            log.warn("The RabbitMQ event bus is disabled, the {} event is not published",
                    event.getClass().getSimpleName());
            return;
        }

        String eventTypeName = event.getClass().getSimpleName();
        try {
            PublisherOptions publisherOptions = registry.optionsFor(event.getClass());
            eventTypeName = publisherOptions.getEventTypeName();
            send(event, publisherOptions);
        } catch (PublishException e) {
            log.error("Error while publishing the {} event: {}", eventTypeName, e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Error while publishing the {} event: {}", eventTypeName, e.getMessage(), e);
            throw new PublishException("Failed to publish the '" + eventTypeName + "' event: " + e.getMessage(), e);
        }
    }

    @Override
    public CompletableFuture<Void> publishAsync(PublishEvent event) {
        return CompletableFuture.runAsync(() -> publish(event), asyncExecutor);
    }

    private void send(PublishEvent event, PublisherOptions publisherOptions) {
        String eventTypeName = publisherOptions.getEventTypeName();
        checkNotCancelled(eventTypeName);

        HostSettings settings = publisherOptions.getVirtualHostSettings();
        NamingPolicyType namingPolicy = publisherOptions.getPropertyNamingPolicy();

        try (TraceSpan span = tracer.startPublish(eventTypeName)) {
            try {
                Map<String, Object> headers = new LinkedHashMap<>();
                headers.put(EventBusTagNames.NAMING_POLICY_HEADER, namingPolicy.wireName());
                String traceParentId = span.traceParentId();
                if (traceParentId != null) {
                    headers.put(EventBusTagNames.TRACE_PARENT_ID_HEADER, traceParentId);
                }
                if (event.getHeaders() != null) {
                    headers.putAll(event.getHeaders());
                }

                byte[] body = serializer.serialize(event, namingPolicy);
                AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                        .messageId(event.getEventId().toString())
                        .type(eventTypeName)
                        .headers(headers)
                        .contentType(CONTENT_TYPE)
                        .deliveryMode(PERSISTENT)
                        .build();

                span.setAttribute(EventBusTagNames.MESSAGE_ID, properties.getMessageId());
                span.setAttribute(EventBusTagNames.DESTINATION, settings.getExchangeName());
                span.setAttribute(EventBusTagNames.ROUTING_KEY, publisherOptions.getRoutingKey());
                span.setAttribute(EventBusTagNames.VIRTUAL_HOST, settings.getVirtualHost());
                span.attachPayload(new String(body, StandardCharsets.UTF_8));
                span.attachHeaders(headers);

                channels.withChannel(settings, channel -> {
                    checkNotCancelled(eventTypeName);
                    channel.basicPublish(settings.getExchangeName(), publisherOptions.getRoutingKey(), false,
                            properties, body);
                    return null;
                });
                log.debug("Published {} ({}) to exchange={}, routingKey={}", eventTypeName,
                        properties.getMessageId(), settings.getExchangeName(), publisherOptions.getRoutingKey());
            } catch (RuntimeException e) {
                span.recordException(e);
                throw e;
            }
        }
    }

    private static void checkNotCancelled(String eventTypeName) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PublishException("Publishing the '" + eventTypeName + "' event was cancelled");
        }
    }

    // ========== Collect / flush ==========

    @Override
    public void collect(PublishEvent event) {
        synchronized (collected) {
            collected.putIfAbsent(event.getEventId(), event);
        }
    }

    @Override
    public void flush() {
        List<PublishEvent> pending;
        synchronized (collected) {
            pending = new ArrayList<>(collected.values());
        }
        if (pending.isEmpty()) {
            return;
        }

        List<RuntimeException> failures = new ArrayList<>();
        for (PublishEvent event : pending) {
            try {
                publish(event);
                synchronized (collected) {
                    collected.remove(event.getEventId());
                }
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }

        if (!failures.isEmpty()) {
            PublishException error = new PublishException("Failed to publish " + failures.size() + " of "
                    + pending.size() + " collected event(s)", failures.get(0));
            failures.stream().skip(1).forEach(error::addSuppressed);
            throw error;
        }
    }

    @Override
    public void clearCollected() {
        synchronized (collected) {
            collected.clear();
        }
    }

    public int collectedCount() {
        synchronized (collected) {
            return collected.size();
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        flush();
    }
}
