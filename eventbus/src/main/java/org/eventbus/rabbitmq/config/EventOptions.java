package org.eventbus.rabbitmq.config;

/**
 * Per-event overrides of the virtual host settings.
 *
 * <p>Unset fields are completed by {@link SettingsResolver}. Until then
 * {@link #getVirtualHostSettings()} is {@code null} and the options are unresolved.</p>
 */
public abstract class EventOptions {

    /** Event type name on the wire. Defaults to the converted class name. */
    private String eventTypeName;

    /** Routing key. Defaults to the host's routing key, then "{exchange}.{eventTypeName}". */
    private String routingKey;

    /** Key into the virtual host settings map. Empty selects the default settings. */
    private String virtualHostKey;

    private NamingPolicyType propertyNamingPolicy;

    private volatile HostSettings virtualHostSettings;

    /**
     * Fill unset fields from the selected host settings. Called once per resolution,
     * after the common fields are completed. Must never overwrite a set field.
     */
    protected void completeFrom(HostSettings settings) {
    }

    public boolean isResolved() { return virtualHostSettings != null; }

    // --- Getters / Setters ---

    public String getEventTypeName() { return eventTypeName; }
    public void setEventTypeName(String eventTypeName) { this.eventTypeName = eventTypeName; }

    public String getRoutingKey() { return routingKey; }
    public void setRoutingKey(String routingKey) { this.routingKey = routingKey; }

    public String getVirtualHostKey() { return virtualHostKey; }
    public void setVirtualHostKey(String virtualHostKey) { this.virtualHostKey = virtualHostKey; }

    public NamingPolicyType getPropertyNamingPolicy() { return propertyNamingPolicy; }
    public void setPropertyNamingPolicy(NamingPolicyType propertyNamingPolicy) {
        this.propertyNamingPolicy = propertyNamingPolicy;
    }

    public HostSettings getVirtualHostSettings() { return virtualHostSettings; }

    void setVirtualHostSettings(HostSettings virtualHostSettings) {
        this.virtualHostSettings = virtualHostSettings;
    }

    static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
