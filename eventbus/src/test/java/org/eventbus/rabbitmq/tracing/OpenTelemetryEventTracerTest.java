package org.eventbus.rabbitmq.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class OpenTelemetryEventTracerTest {

    private final List<SpanData> finished = new CopyOnWriteArrayList<>();
    private OpenTelemetrySdk sdk;
    private OpenTelemetryEventTracer tracer;

    @BeforeEach
    void setUp() {
        SpanExporter exporter = new SpanExporter() {
            @Override
            public CompletableResultCode export(Collection<SpanData> spans) {
                finished.addAll(spans);
                return CompletableResultCode.ofSuccess();
            }

            @Override
            public CompletableResultCode flush() {
                return CompletableResultCode.ofSuccess();
            }

            @Override
            public CompletableResultCode shutdown() {
                return CompletableResultCode.ofSuccess();
            }
        };
        sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                        .build())
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
        tracer = new OpenTelemetryEventTracer(sdk);
    }

    @AfterEach
    void tearDown() {
        sdk.getSdkTracerProvider().shutdown();
    }

    @Test
    @DisplayName("the publish span exposes a W3C traceparent")
    void publishSpan() {
        String traceParent;
        String traceId;
        try (TraceSpan span = tracer.startPublish("OrderSubmitted")) {
            traceParent = span.traceParentId();
            traceId = Span.current().getSpanContext().getTraceId();
        }

        assertThat(traceParent).matches("00-[0-9a-f]{32}-[0-9a-f]{16}-01");
        assertThat(traceParent).contains(traceId);
        assertThat(finished).singleElement().satisfies(span -> {
            assertThat(span.getKind()).isEqualTo(SpanKind.PRODUCER);
            assertThat(span.getName()).isEqualTo("eventbus.publish OrderSubmitted");
        });
    }

    @Test
    @DisplayName("the consume span continues the publisher's trace")
    void consumeSpanContinuesTrace() {
        String traceParent;
        try (TraceSpan publish = tracer.startPublish("OrderSubmitted")) {
            traceParent = publish.traceParentId();
        }

        try (TraceSpan consume = tracer.startConsume("OrderSubmitted", traceParent)) {
            consume.setAttribute(EventBusTagNames.ROUTING_KEY, "Orders.OrderSubmitted");
        }

        SpanData producer = finished.get(0);
        SpanData consumer = finished.get(1);
        assertThat(consumer.getKind()).isEqualTo(SpanKind.CONSUMER);
        assertThat(consumer.getTraceId()).isEqualTo(producer.getTraceId());
        assertThat(consumer.getParentSpanId()).isEqualTo(producer.getSpanId());
        assertThat(consumer.getAttributes().asMap().values()).contains("Orders.OrderSubmitted");
    }

    @Test
    void consumeWithoutTraceParentStartsANewTrace() {
        try (TraceSpan span = tracer.startConsume("OrderSubmitted", null)) {
            assertThat(span.traceParentId()).isNotNull();
        }

        assertThat(finished.get(0).getParentSpanContext().isValid()).isFalse();
    }

    @Test
    void recordedExceptionMarksTheSpanAsFailed() {
        try (TraceSpan span = tracer.startConsume("OrderSubmitted", null)) {
            span.recordException(new IllegalStateException("handler failed"));
        }

        assertThat(finished.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(finished.get(0).getEvents()).isNotEmpty();
    }

    @Test
    @DisplayName("payload and headers are added as span events")
    void payloadAndHeadersEvents() {
        try (TraceSpan span = tracer.startPublish("OrderSubmitted")) {
            span.attachPayload("{\"OrderId\":\"42\"}");
            span.attachHeaders(Map.of("NamingPolicyType", "PascalCase"));
        }

        List<EventData> events = finished.get(0).getEvents();
        assertThat(events).extracting(EventData::getName)
                .containsExactly(EventBusTagNames.PAYLOAD_EVENT, EventBusTagNames.HEADERS_EVENT);
        assertThat(events.get(0).getAttributes().get(AttributeKey.stringKey(EventBusTagNames.PAYLOAD)))
                .isEqualTo("{\"OrderId\":\"42\"}");
        assertThat(events.get(1).getAttributes()
                .get(AttributeKey.stringKey(EventBusTagNames.HEADERS + ".NamingPolicyType")))
                .isEqualTo("PascalCase");
    }

    @Test
    void payloadAndHeadersCanBeSwitchedOff() {
        OpenTelemetryEventTracer quiet = new OpenTelemetryEventTracer(sdk, false, false);

        try (TraceSpan span = quiet.startConsume("OrderSubmitted", null)) {
            span.attachPayload("{\"OrderId\":\"42\"}");
            span.attachHeaders(Map.of("NamingPolicyType", "PascalCase"));
        }

        assertThat(finished.get(0).getEvents()).isEmpty();
    }

    @Test
    @DisplayName("without an SDK nothing is recorded and no traceparent is sent")
    void noopOpenTelemetry() {
        OpenTelemetryEventTracer noop = new OpenTelemetryEventTracer(io.opentelemetry.api.OpenTelemetry.noop());

        try (TraceSpan span = noop.startPublish("OrderSubmitted")) {
            assertThat(span.traceParentId()).isNull();
        }
    }
}
