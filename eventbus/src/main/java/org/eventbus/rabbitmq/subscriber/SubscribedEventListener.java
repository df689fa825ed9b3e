package org.eventbus.rabbitmq.subscriber;

/**
 * Called before each handler runs on a received event.
 */
@FunctionalInterface
public interface SubscribedEventListener {

    /**
     * @param systemName virtual host the event was received from, without a leading '/'
     */
    void onSubscribed(SubscribeEvent event, String systemName);
}
