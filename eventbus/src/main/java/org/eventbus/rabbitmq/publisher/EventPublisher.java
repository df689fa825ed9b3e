package org.eventbus.rabbitmq.publisher;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes events to the broker, immediately or through a collect-then-flush buffer.
 *
 * <p>Closing a publisher flushes what is still buffered.</p>
 */
public interface EventPublisher extends AutoCloseable {

    /**
     * Publish an event now.
     *
     * @throws org.eventbus.rabbitmq.exception.PublishException if resolving, channel acquisition or the write failed
     */
    void publish(PublishEvent event);

    /**
     * Publish an event on another thread. The future completes exceptionally with a
     * {@link org.eventbus.rabbitmq.exception.PublishException} on failure.
     */
    CompletableFuture<Void> publishAsync(PublishEvent event);

    /**
     * Buffer an event until {@link #flush()}. An event whose id is already buffered is ignored.
     */
    void collect(PublishEvent event);

    /**
     * Publish every buffered event. Published events leave the buffer; failed ones stay.
     *
     * @throws org.eventbus.rabbitmq.exception.PublishException if at least one event failed
     */
    void flush();

    /**
     * Drop every buffered event without publishing.
     */
    void clearCollected();

    @Override
    void close();
}
