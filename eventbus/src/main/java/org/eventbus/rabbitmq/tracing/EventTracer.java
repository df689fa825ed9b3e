package org.eventbus.rabbitmq.tracing;

/**
 * Tracing collaborator of the event bus.
 *
 * @see OpenTelemetryEventTracer
 */
public interface EventTracer {

    /**
     * Start a producer span as a child of the current context.
     */
    TraceSpan startPublish(String eventTypeName);

    /**
     * Start a consumer span continuing the publisher's trace.
     *
     * @param traceParentId value of the trace parent header, may be {@code null}
     */
    TraceSpan startConsume(String eventTypeName, String traceParentId);

    /**
     * Tracer that records nothing.
     */
    static EventTracer noop() {
        return NoopTracer.INSTANCE;
    }

    final class NoopTracer implements EventTracer, TraceSpan {
        static final NoopTracer INSTANCE = new NoopTracer();

        private NoopTracer() {
        }

        @Override
        public TraceSpan startPublish(String eventTypeName) { return this; }

        @Override
        public TraceSpan startConsume(String eventTypeName, String traceParentId) { return this; }

        @Override
        public String traceParentId() { return null; }

        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void recordException(Throwable error) {
        }

        @Override
        public void close() {
        }
    }
}
