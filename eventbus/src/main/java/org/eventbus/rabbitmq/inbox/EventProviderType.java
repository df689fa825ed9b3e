package org.eventbus.rabbitmq.inbox;

/**
 * Where an inbox event came from.
 */
public enum EventProviderType {
    MESSAGE_BROKER,
    HTTP,
    GRPC,
    UNKNOWN
}
