package org.eventbus.rabbitmq.config;

import java.time.Duration;

/**
 * Default settings of the event bus, plus the switches that apply to the whole bus.
 */
public class RabbitMqOptions extends HostSettings {

    public static final Duration DEFAULT_RECONNECT_INTERVAL = Duration.ofSeconds(5);

    private boolean enabled = true;

    /**
     * Hand received messages to the inbox store instead of running handlers inline.
     */
    private boolean useInbox = false;

    /**
     * Delay before a failed consumer rebuild is attempted again.
     */
    private Duration reconnectInterval = DEFAULT_RECONNECT_INTERVAL;

    /**
     * Merge these options over a parent, keeping the bus switches of this instance.
     */
    public RabbitMqOptions mergeOptions(HostSettings parent) {
        RabbitMqOptions merged = new RabbitMqOptions();
        copyMerged(merged, this, parent);
        merged.enabled = enabled;
        merged.useInbox = useInbox;
        merged.reconnectInterval = reconnectInterval;
        return merged;
    }

    // --- Getters / Setters ---

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { checkMutable(); this.enabled = enabled; }

    public boolean isUseInbox() { return useInbox; }
    public void setUseInbox(boolean useInbox) { checkMutable(); this.useInbox = useInbox; }

    public Duration getReconnectInterval() { return reconnectInterval; }
    public void setReconnectInterval(Duration reconnectInterval) {
        checkMutable();
        this.reconnectInterval = reconnectInterval != null ? reconnectInterval : DEFAULT_RECONNECT_INTERVAL;
    }
}
