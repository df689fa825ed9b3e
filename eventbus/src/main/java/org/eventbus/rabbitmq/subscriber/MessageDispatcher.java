package org.eventbus.rabbitmq.subscriber;

import com.rabbitmq.client.LongString;
import org.eventbus.rabbitmq.config.NamingPolicyType;
import org.eventbus.rabbitmq.exception.ConfigurationException;
import org.eventbus.rabbitmq.exception.NamingPolicyMismatchException;
import org.eventbus.rabbitmq.inbox.EventProviderType;
import org.eventbus.rabbitmq.inbox.InboxStore;
import org.eventbus.rabbitmq.serialization.JsonEventSerializer;
import org.eventbus.rabbitmq.tracing.EventBusTagNames;
import org.eventbus.rabbitmq.tracing.EventTracer;
import org.eventbus.rabbitmq.tracing.TraceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Routes a received message to the handlers of its event type, or to the inbox.
 *
 * <p>A message is acknowledged only after every handler completed, or the inbox
 * accepted it. Unknown event types and failures leave the message unacknowledged;
 * nothing thrown here reaches the consumer.</p>
 */
public class MessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final HandlerResolver handlerResolver;
    private final JsonEventSerializer serializer;
    private final EventTracer tracer;
    private final boolean useInbox;
    private final InboxStore inboxStore;
    private final List<SubscribedEventListener> subscribedListeners;
    private final List<EventHandlersCompletedListener> completedListeners;

    public MessageDispatcher(HandlerResolver handlerResolver, JsonEventSerializer serializer, EventTracer tracer,
                             boolean useInbox, InboxStore inboxStore,
                             List<SubscribedEventListener> subscribedListeners,
                             List<EventHandlersCompletedListener> completedListeners) {
        this.handlerResolver = handlerResolver;
        this.serializer = serializer;
        this.tracer = tracer != null ? tracer : EventTracer.noop();
        this.useInbox = useInbox;
        this.inboxStore = inboxStore;
        this.subscribedListeners = subscribedListeners != null ? List.copyOf(subscribedListeners) : List.of();
        this.completedListeners = completedListeners != null ? List.copyOf(completedListeners) : List.of();
    }

    /**
     * Dispatch one message.
     *
     * @param subscriptions subscriptions of the consumer group, keyed by resolved event type name
     */
    public DispatchResult dispatch(ReceivedMessage message, Map<String, EventSubscriptions> subscriptions,
                                   Acknowledger acknowledger) {
        String eventType = message.type() == null || message.type().isEmpty() ? message.routingKey() : message.type();
        try {
            log.debug("Receiving event type '{}' (routingKey={}, messageId={})",
                    eventType, message.routingKey(), message.messageId());

            Map<String, String> headers;
            try {
                headers = decodeHeaders(message.headers());
            } catch (RuntimeException e) {
                log.error("Error while reading the headers of event '{}'. Payload: '{}', headers: '{}'",
                        eventType, payloadOf(message), message.headers(), e);
                return DispatchResult.failed(e);
            }

            String traceParentId = headers.get(EventBusTagNames.TRACE_PARENT_ID_HEADER);

            EventSubscriptions subscription = subscriptions.get(eventType);
            if (subscription == null) {
                log.warn("No subscription for '{}' RabbitMQ event.", eventType);
                return DispatchResult.NO_SUBSCRIBERS;
            }

            try (TraceSpan span = tracer.startConsume(eventType, traceParentId)) {
                span.setAttribute(EventBusTagNames.MESSAGE_ID, message.messageId());
                span.setAttribute(EventBusTagNames.ROUTING_KEY, message.routingKey());
                span.setAttribute(EventBusTagNames.VIRTUAL_HOST, message.virtualHost());
                span.attachPayload(payloadOf(message));
                span.attachHeaders(headers);
                try {
                    process(message, eventType, headers, subscription);
                    acknowledger.ack(message.deliveryTag());
                } catch (Exception e) {
                    span.recordException(e);
                    throw e;
                }
            }
            return DispatchResult.ACKNOWLEDGED;
        } catch (Exception e) {
            log.error("Error while receiving '{}' event with the '{}' routing key and '{}' event id. {}",
                    eventType, message.routingKey(), message.messageId(), e.getMessage(), e);
            return DispatchResult.failed(e);
        }
    }

    private void process(ReceivedMessage message, String eventType, Map<String, String> headers,
                         EventSubscriptions subscription) throws Exception {
        UUID eventId = parseEventId(message.messageId());
        SubscriberOptions options = subscription.getOptions();
        NamingPolicyType configured = options.getPropertyNamingPolicy() != null
                ? options.getPropertyNamingPolicy() : NamingPolicyType.PASCAL_CASE;
        log.debug("Received RabbitMQ event '{}' (ID: {})", eventType, eventId);

        String received = headers.get(EventBusTagNames.NAMING_POLICY_HEADER);
        if (received != null && !sameNamingPolicy(received, configured)) {
            throw new NamingPolicyMismatchException(eventType, received, configured.wireName());
        }

        if (useInbox) {
            storeToInbox(message, eventType, eventId, headers, configured);
        } else {
            runHandlers(message, eventType, eventId, headers, subscription, configured);
        }
    }

    private void storeToInbox(ReceivedMessage message, String eventType, UUID eventId, Map<String, String> headers,
                              NamingPolicyType namingPolicy) {
        if (inboxStore == null) {
            throw new ConfigurationException("The RabbitMQ is configured to use the Inbox for received events, "
                    + "but no inbox store is available.");
        }
        boolean stored = inboxStore.store(eventId, eventType, EventProviderType.MESSAGE_BROKER, payloadOf(message),
                serializer.serializeHeaders(headers), message.routingKey(), namingPolicy);
        if (!stored) {
            log.debug("Event '{}' ({}) is already in the inbox", eventType, eventId);
        }
    }

    @SuppressWarnings("unchecked")
    private void runHandlers(ReceivedMessage message, String eventType, UUID eventId, Map<String, String> headers,
                             EventSubscriptions subscription, NamingPolicyType namingPolicy) throws Exception {
        List<SubscriberRegistration> registrations = subscription.getRegistrations();
        String systemName = systemName(message.virtualHost());
        log.debug("Executing {} subscribers of received event '{}'", registrations.size(), eventType);

        for (SubscriberRegistration registration : registrations) {
            SubscribeEvent event = serializer.deserialize(message.body(), registration.eventType(), namingPolicy);
            event.setEventId(eventId);
            event.setHeaders(new LinkedHashMap<>(headers));

            for (SubscribedEventListener listener : subscribedListeners) {
                listener.onSubscribed(event, systemName);
            }

            EventHandler<SubscribeEvent> handler =
                    (EventHandler<SubscribeEvent>) handlerResolver.resolve(registration.handlerType());
            handler.handle(event);
        }

        for (EventHandlersCompletedListener listener : completedListeners) {
            listener.onCompleted(eventType, EventProviderType.MESSAGE_BROKER);
        }
    }

    // ========== Helpers ==========

    /**
     * Headers as strings. Byte values are read as UTF-8; nulls and nested
     * tables or arrays are skipped.
     */
    static Map<String, String> decodeHeaders(Map<String, Object> raw) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (raw == null) {
            return headers;
        }
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            Object value = entry.getValue();
            if (value == null || value instanceof Map || value instanceof List) {
                continue;
            }
            if (value instanceof LongString longString) {
                headers.put(entry.getKey(), new String(longString.getBytes(), StandardCharsets.UTF_8));
            } else if (value instanceof byte[] bytes) {
                headers.put(entry.getKey(), new String(bytes, StandardCharsets.UTF_8));
            } else {
                headers.put(entry.getKey(), value.toString());
            }
        }
        return headers;
    }

    static UUID parseEventId(String messageId) {
        if (messageId != null) {
            try {
                return UUID.fromString(messageId);
            } catch (IllegalArgumentException e) {
                log.debug("Message id '{}' is not a UUID, generating a new event id", messageId);
            }
        }
        return UUID.randomUUID();
    }

    private static boolean sameNamingPolicy(String received, NamingPolicyType configured) {
        try {
            return NamingPolicyType.fromName(received) == configured;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static String systemName(String virtualHost) {
        if (virtualHost == null) {
            return "";
        }
        return virtualHost.startsWith("/") ? virtualHost.substring(1) : virtualHost;
    }

    private static String payloadOf(ReceivedMessage message) {
        return message.body() == null ? "" : new String(message.body(), StandardCharsets.UTF_8);
    }
}
