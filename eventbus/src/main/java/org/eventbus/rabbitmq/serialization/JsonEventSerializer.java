package org.eventbus.rabbitmq.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.eventbus.rabbitmq.config.NamingPolicyType;
import org.eventbus.rabbitmq.exception.EventBusException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON codec of event bodies. Property names follow the naming policy resolved for the event.
 *
 * <p>One {@link ObjectMapper} per naming policy is derived from the base mapper and cached.</p>
 */
public class JsonEventSerializer {

    private static final TypeReference<Map<String, String>> HEADERS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper baseMapper;
    private final Map<NamingPolicyType, ObjectMapper> mappers = new ConcurrentHashMap<>();

    public JsonEventSerializer() {
        this(defaultObjectMapper());
    }

    public JsonEventSerializer(ObjectMapper baseMapper) {
        this.baseMapper = baseMapper;
    }

    /**
     * Mapper used when none is supplied: ISO-8601 dates, nulls omitted, unknown properties ignored.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public byte[] serialize(Object event, NamingPolicyType policy) {
        try {
            return mapperFor(policy).writeValueAsBytes(event);
        } catch (Exception e) {
            throw new SerializationException("Failed to serialize " + event.getClass().getSimpleName(), e);
        }
    }

    public <T> T deserialize(byte[] body, Class<T> type, NamingPolicyType policy) {
        try {
            return mapperFor(policy).readValue(body, type);
        } catch (Exception e) {
            throw new SerializationException("Failed to deserialize message into " + type.getSimpleName(), e);
        }
    }

    /**
     * Headers as a JSON object, used for the inbox hand-off.
     */
    public String serializeHeaders(Map<String, String> headers) {
        try {
            return baseMapper.writeValueAsString(headers);
        } catch (Exception e) {
            throw new SerializationException("Failed to serialize message headers", e);
        }
    }

    public Map<String, String> deserializeHeaders(String json) {
        try {
            return baseMapper.readValue(json, HEADERS_TYPE);
        } catch (Exception e) {
            throw new SerializationException("Failed to deserialize message headers", e);
        }
    }

    ObjectMapper mapperFor(NamingPolicyType policy) {
        NamingPolicyType effective = policy != null ? policy : NamingPolicyType.PASCAL_CASE;
        return mappers.computeIfAbsent(effective,
                p -> baseMapper.copy().setPropertyNamingStrategy(p.strategy()));
    }

    public static class SerializationException extends EventBusException {
        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
