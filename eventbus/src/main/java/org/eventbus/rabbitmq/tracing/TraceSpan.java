package org.eventbus.rabbitmq.tracing;

import java.util.Map;

/**
 * An in-flight span. Closing it ends the span and restores the previous context.
 */
public interface TraceSpan extends AutoCloseable {

    /**
     * @return W3C traceparent of this span, or {@code null} when no trace is recorded
     */
    String traceParentId();

    void setAttribute(String key, String value);

    void recordException(Throwable error);

    /**
     * Add the message body as a span event, when the tracer is configured to.
     */
    default void attachPayload(String payload) {
    }

    /**
     * Add the message headers as a span event, when the tracer is configured to.
     */
    default void attachHeaders(Map<String, ?> headers) {
    }

    @Override
    void close();
}
