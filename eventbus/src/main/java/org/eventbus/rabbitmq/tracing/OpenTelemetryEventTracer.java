package org.eventbus.rabbitmq.tracing;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link EventTracer} on the OpenTelemetry API. The trace parent header holds the
 * W3C {@code traceparent} produced by the configured text map propagator.
 *
 * <p>Message bodies and headers are added to the spans as events unless switched off
 * with {@link #OpenTelemetryEventTracer(OpenTelemetry, boolean, boolean)}.</p>
 */
public class OpenTelemetryEventTracer implements EventTracer {

    public static final String INSTRUMENTATION_NAME = "org.eventbus.rabbitmq";

    private static final String TRACEPARENT = "traceparent";
    private static final TextMapSetter<Map<String, String>> SETTER = Map::put;
    private static final MapTextMapGetter GETTER = new MapTextMapGetter();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final boolean attachPayload;
    private final boolean attachHeaders;

    public OpenTelemetryEventTracer() {
        this(GlobalOpenTelemetry.get());
    }

    public OpenTelemetryEventTracer(OpenTelemetry openTelemetry) {
        this(openTelemetry, true, true);
    }

    /**
     * @param attachPayload add the message body to publish and consume spans
     * @param attachHeaders add the message headers to publish and consume spans
     */
    public OpenTelemetryEventTracer(OpenTelemetry openTelemetry, boolean attachPayload, boolean attachHeaders) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.attachPayload = attachPayload;
        this.attachHeaders = attachHeaders;
    }

    @Override
    public TraceSpan startPublish(String eventTypeName) {
        Span span = tracer.spanBuilder("eventbus.publish " + eventTypeName)
                .setSpanKind(SpanKind.PRODUCER)
                .setAttribute(EventBusTagNames.MESSAGING_SYSTEM, "rabbitmq")
                .setAttribute(EventBusTagNames.EVENT_TYPE, eventTypeName)
                .startSpan();
        return new OtelSpan(span);
    }

    @Override
    public TraceSpan startConsume(String eventTypeName, String traceParentId) {
        var builder = tracer.spanBuilder("eventbus.consume " + eventTypeName)
                .setSpanKind(SpanKind.CONSUMER)
                .setAttribute(EventBusTagNames.MESSAGING_SYSTEM, "rabbitmq")
                .setAttribute(EventBusTagNames.EVENT_TYPE, eventTypeName);
        if (traceParentId != null && !traceParentId.isEmpty()) {
            builder.setParent(extract(traceParentId));
        }
        return new OtelSpan(builder.startSpan());
    }

    Context extract(String traceParentId) {
        Map<String, String> carrier = new HashMap<>();
        carrier.put(TRACEPARENT, traceParentId);
        return openTelemetry.getPropagators().getTextMapPropagator().extract(Context.current(), carrier, GETTER);
    }

    private final class OtelSpan implements TraceSpan {
        private final Span span;
        private final Scope scope;

        OtelSpan(Span span) {
            this.span = span;
            this.scope = span.makeCurrent();
        }

        @Override
        public String traceParentId() {
            if (!span.getSpanContext().isValid()) {
                return null;
            }
            Map<String, String> carrier = new HashMap<>();
            openTelemetry.getPropagators().getTextMapPropagator()
                    .inject(Context.current().with(span), carrier, SETTER);
            return carrier.get(TRACEPARENT);
        }

        @Override
        public void setAttribute(String key, String value) {
            if (value != null) {
                span.setAttribute(key, value);
            }
        }

        @Override
        public void recordException(Throwable error) {
            span.recordException(error);
            span.setStatus(StatusCode.ERROR, error.getMessage() != null ? error.getMessage() : "");
        }

        @Override
        public void attachPayload(String payload) {
            if (attachPayload && payload != null) {
                span.addEvent(EventBusTagNames.PAYLOAD_EVENT,
                        Attributes.of(AttributeKey.stringKey(EventBusTagNames.PAYLOAD), payload));
            }
        }

        @Override
        public void attachHeaders(Map<String, ?> headers) {
            if (!attachHeaders || headers == null || headers.isEmpty()) {
                return;
            }
            AttributesBuilder attributes = Attributes.builder();
            headers.forEach((key, value) -> {
                if (value != null) {
                    attributes.put(EventBusTagNames.HEADERS + "." + key, value.toString());
                }
            });
            span.addEvent(EventBusTagNames.HEADERS_EVENT, attributes.build());
        }

        @Override
        public void close() {
            scope.close();
            span.end();
        }
    }
}
