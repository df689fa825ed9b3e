package org.eventbus.rabbitmq.publisher;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base class of events published to the broker.
 *
 * <p>{@link #getHeaders() Headers} travel as AMQP headers and are not part of the JSON body.</p>
 */
public abstract class PublishEvent {

    private UUID eventId = UUID.randomUUID();
    private Instant createdAt = Instant.now();

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
