package org.eventbus.rabbitmq.subscriber;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base class of events received from the broker.
 *
 * <p>The event id is taken from the message id, headers from the AMQP headers.</p>
 */
public abstract class SubscribeEvent {

    private UUID eventId;
    private Instant createdAt;

    @JsonIgnore
    private Map<String, String> headers = new LinkedHashMap<>();

    public UUID getEventId() { return eventId; }
    public void setEventId(UUID eventId) { this.eventId = eventId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @JsonIgnore
    public Map<String, String> getHeaders() { return headers; }

    @JsonIgnore
    public void setHeaders(Map<String, String> headers) {
        this.headers = headers != null ? headers : new LinkedHashMap<>();
    }
}
