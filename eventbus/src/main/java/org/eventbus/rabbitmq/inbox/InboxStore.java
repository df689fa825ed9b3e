package org.eventbus.rabbitmq.inbox;

import org.eventbus.rabbitmq.config.NamingPolicyType;

import java.util.UUID;

/**
 * Persistence of received messages, used instead of running handlers inline when
 * the inbox is enabled. Implementations deduplicate by event id.
 *
 * <p>The store is an external component; the event bus only hands messages over.</p>
 */
@FunctionalInterface
public interface InboxStore {

    /**
     * Store a received message.
     *
     * @param eventId       message id of the received message
     * @param eventTypeName resolved event type name
     * @param providerType  always {@link EventProviderType#MESSAGE_BROKER} from the event bus
     * @param payload       raw JSON body
     * @param headersJson   decoded headers as a JSON object
     * @param eventPath     routing key the message arrived with
     * @param namingPolicy  property naming policy of the payload
     * @return {@code false} when the event was already stored
     */
    boolean store(UUID eventId, String eventTypeName, EventProviderType providerType, String payload,
                  String headersJson, String eventPath, NamingPolicyType namingPolicy);
}
