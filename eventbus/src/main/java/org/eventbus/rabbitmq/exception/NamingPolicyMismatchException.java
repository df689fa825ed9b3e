package org.eventbus.rabbitmq.exception;

/**
 * A received message was serialized with a property naming policy other than
 * the one the consumer is configured for. The message is neither processed
 * nor acknowledged.
 */
public class NamingPolicyMismatchException extends EventBusException {

    private final String receivedPolicy;
    private final String configuredPolicy;

    public NamingPolicyMismatchException(String eventType, String receivedPolicy, String configuredPolicy) {
        super("The naming policy type of received event '" + eventType + "' (" + receivedPolicy
                + ") is different from the configured naming policy type (" + configuredPolicy
                + "). Deserialization issues may occur.");
        this.receivedPolicy = receivedPolicy;
        this.configuredPolicy = configuredPolicy;
    }

    public String getReceivedPolicy() { return receivedPolicy; }
    public String getConfiguredPolicy() { return configuredPolicy; }
}
