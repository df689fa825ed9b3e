package org.eventbus.rabbitmq.serialization;

import org.eventbus.rabbitmq.config.NamingPolicyType;
import org.eventbus.rabbitmq.publisher.PublishEvent;
import org.eventbus.rabbitmq.subscriber.SubscribeEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonEventSerializerTest {

    public static class PaymentCaptured extends PublishEvent {
        private String paymentId;
        private String cardHolder;

        public String getPaymentId() { return paymentId; }
        public void setPaymentId(String paymentId) { this.paymentId = paymentId; }

        public String getCardHolder() { return cardHolder; }
        public void setCardHolder(String cardHolder) { this.cardHolder = cardHolder; }
    }

    public static class PaymentReceived extends SubscribeEvent {
        private String paymentId;

        public String getPaymentId() { return paymentId; }
        public void setPaymentId(String paymentId) { this.paymentId = paymentId; }
    }

    private final JsonEventSerializer serializer = new JsonEventSerializer();

    private static PaymentCaptured payment() {
        PaymentCaptured event = new PaymentCaptured();
        event.setEventId(UUID.fromString("3f1c2a8e-5b7d-4e2f-9a6c-1d0b8e7f6a5c"));
        event.setCreatedAt(Instant.parse("2024-05-01T10:15:30Z"));
        event.setPaymentId("pay-1");
        event.getHeaders().put("TenantId", "acme");
        return event;
    }

    @Test
    @DisplayName("PascalCase is the default: property names start upper case, dates are ISO-8601")
    void pascalCase() {
        String json = new String(serializer.serialize(payment(), NamingPolicyType.PASCAL_CASE), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"PaymentId\":\"pay-1\"")
                .contains("\"EventId\":\"3f1c2a8e-5b7d-4e2f-9a6c-1d0b8e7f6a5c\"")
                .contains("\"CreatedAt\":\"2024-05-01T10:15:30Z\"")
                .doesNotContain("CardHolder")
                .doesNotContain("TenantId");
    }

    @Test
    void snakeCase() {
        String json = new String(serializer.serialize(payment(), NamingPolicyType.SNAKE_CASE_LOWER),
                StandardCharsets.UTF_8);

        assertThat(json).contains("\"payment_id\":\"pay-1\"").contains("\"event_id\"");
    }

    @Test
    @DisplayName("unknown properties are ignored when reading")
    void deserializeIgnoresUnknownProperties() {
        byte[] body = "{\"payment_id\":\"pay-2\",\"amount\":10}".getBytes(StandardCharsets.UTF_8);

        PaymentReceived event = serializer.deserialize(body, PaymentReceived.class, NamingPolicyType.SNAKE_CASE_LOWER);

        assertThat(event.getPaymentId()).isEqualTo("pay-2");
    }

    @Test
    void policyMustMatchToReadProperties() {
        byte[] body = "{\"payment_id\":\"pay-2\"}".getBytes(StandardCharsets.UTF_8);

        PaymentReceived event = serializer.deserialize(body, PaymentReceived.class, NamingPolicyType.PASCAL_CASE);

        assertThat(event.getPaymentId()).isNull();
    }

    @Test
    void malformedBody() {
        assertThatThrownBy(() -> serializer.deserialize("[".getBytes(StandardCharsets.UTF_8), PaymentReceived.class,
                NamingPolicyType.PASCAL_CASE))
                .isInstanceOf(JsonEventSerializer.SerializationException.class)
                .hasMessageContaining("PaymentReceived");
    }

    @Test
    void headersAsJson() {
        String json = serializer.serializeHeaders(Map.of("TraceParentId", "00-abc-def-01"));

        assertThat(json).isEqualTo("{\"TraceParentId\":\"00-abc-def-01\"}");
        assertThat(serializer.deserializeHeaders(json)).containsEntry("TraceParentId", "00-abc-def-01");
    }

    @Test
    void mapperIsCachedPerPolicy() {
        assertThat(serializer.mapperFor(NamingPolicyType.CAMEL_CASE))
                .isSameAs(serializer.mapperFor(NamingPolicyType.CAMEL_CASE))
                .isNotSameAs(serializer.mapperFor(NamingPolicyType.KEBAB_CASE_LOWER));
        assertThat(serializer.mapperFor(null)).isSameAs(serializer.mapperFor(NamingPolicyType.PASCAL_CASE));
    }
}
