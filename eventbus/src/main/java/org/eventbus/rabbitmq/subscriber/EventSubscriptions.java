package org.eventbus.rabbitmq.subscriber;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Subscriber options of one event type name plus its handlers, in registration order.
 */
public class EventSubscriptions {

    private volatile SubscriberOptions options;
    private final CopyOnWriteArrayList<SubscriberRegistration> registrations = new CopyOnWriteArrayList<>();

    public EventSubscriptions(SubscriberOptions options) {
        this.options = options;
    }

    /**
     * @return false if the pair was already registered
     */
    public boolean add(SubscriberRegistration registration) {
        return registrations.addIfAbsent(registration);
    }

    public SubscriberOptions getOptions() { return options; }
    void setOptions(SubscriberOptions options) { this.options = options; }

    public List<SubscriberRegistration> getRegistrations() { return List.copyOf(registrations); }

    @Override
    public String toString() {
        return "EventSubscriptions{options=" + options + ", handlers=" + registrations.size() + '}';
    }
}
