package org.eventbus.rabbitmq.tracing;

/**
 * Header and span attribute names shared by publishers and subscribers.
 */
public final class EventBusTagNames {

    /** AMQP header carrying the W3C traceparent of the publishing span. */
    public static final String TRACE_PARENT_ID_HEADER = "TraceParentId";

    /** AMQP header carrying the property naming policy the body was written with. */
    public static final String NAMING_POLICY_HEADER = "NamingPolicyType";

    public static final String MESSAGING_SYSTEM = "messaging.system";
    public static final String EVENT_TYPE = "messaging.eventbus.event_type";
    public static final String MESSAGE_ID = "messaging.message.id";
    public static final String ROUTING_KEY = "messaging.rabbitmq.destination.routing_key";
    public static final String DESTINATION = "messaging.destination.name";
    public static final String VIRTUAL_HOST = "messaging.rabbitmq.virtual_host";
    public static final String HEADERS = "messaging.eventbus.headers";
    public static final String PAYLOAD = "messaging.eventbus.payload";

    public static final String PAYLOAD_EVENT = "eventbus.payload";
    public static final String HEADERS_EVENT = "eventbus.headers";

    private EventBusTagNames() {
    }
}
