package org.eventbus.rabbitmq.config;

import org.eventbus.rabbitmq.exception.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Resolves per-event options against the virtual host settings cascade.
 *
 * <p>Each field is taken from the event options when set, then from the selected
 * host settings, then from a computed default. Resolution is idempotent: a field
 * that is already set is never overwritten.</p>
 */
public final class SettingsResolver {

    private SettingsResolver() {
    }

    // ========== Cascade preparation ==========

    /**
     * Built-in defaults, overlaid with the configured defaults, then with the code-level override.
     */
    public static RabbitMqOptions prepareDefaults(RabbitMqOptions configured, Consumer<RabbitMqOptions> override) {
        RabbitMqOptions own = configured != null ? configured : new RabbitMqOptions();
        RabbitMqOptions merged = own.mergeOptions(HostSettings.defaults());
        if (override != null) {
            override.accept(merged);
        }
        return merged;
    }

    /**
     * Merge configured and code-level virtual hosts. Per key, code-level values win over
     * configured ones, and every entry inherits its unset fields from the defaults.
     */
    public static Map<String, HostSettings> prepareVirtualHosts(Map<String, HostSettings> configured,
                                                                Map<String, HostSettings> fromCode,
                                                                HostSettings defaults) {
        Map<String, HostSettings> combined = new LinkedHashMap<>();
        if (configured != null) {
            combined.putAll(configured);
        }
        if (fromCode != null) {
            fromCode.forEach((key, settings) -> combined.merge(key, settings, (cfg, code) -> code.merge(cfg)));
        }

        Map<String, HostSettings> prepared = new LinkedHashMap<>();
        combined.forEach((key, settings) -> prepared.put(key, settings.merge(defaults)));
        return prepared;
    }

    // ========== Resolution ==========

    /**
     * Select the named virtual host for a key, falling back to the defaults when the key
     * is empty or unknown.
     */
    public static HostSettings selectHostSettings(String virtualHostKey,
                                                  Map<String, HostSettings> namedHosts,
                                                  HostSettings defaults) {
        if (!EventOptions.isEmpty(virtualHostKey) && namedHosts != null) {
            HostSettings named = namedHosts.get(virtualHostKey);
            if (named != null) {
                return named;
            }
        }
        return defaults;
    }

    /**
     * Complete the unset fields of {@code options} from {@code settings}.
     *
     * @param options       the per-event options, modified in place
     * @param settings      the selected virtual host settings, frozen by this call
     * @param canonicalName the event class simple name
     * @throws ConfigurationException when the virtual host or exchange name is missing
     */
    public static <T extends EventOptions> T resolve(T options, HostSettings settings, String canonicalName) {
        if (settings == null) {
            throw new ConfigurationException("No virtual host settings found for the '" + canonicalName + "' event.");
        }
        if (EventOptions.isEmpty(settings.getVirtualHost())) {
            throw new ConfigurationException("The VirtualHost is required, but it is currently null or empty for the '"
                    + settings.getHostName() + "' host.");
        }
        if (EventOptions.isEmpty(settings.getExchangeName())) {
            throw new ConfigurationException("The ExchangeName is required, but it is currently null or empty for the '"
                    + settings.getVirtualHost() + "' virtual host.");
        }

        settings.freeze();
        synchronized (options) {
            if (options.getVirtualHostSettings() == null) {
                options.setVirtualHostSettings(settings);
            }
            HostSettings owner = options.getVirtualHostSettings();

            if (EventOptions.isEmpty(options.getEventTypeName())) {
                options.setEventTypeName(convertEventName(owner, canonicalName));
            }
            if (EventOptions.isEmpty(options.getRoutingKey())) {
                options.setRoutingKey(EventOptions.isEmpty(owner.getRoutingKey())
                        ? owner.getExchangeName() + "." + options.getEventTypeName()
                        : owner.getRoutingKey());
            }
            if (options.getPropertyNamingPolicy() == null) {
                options.setPropertyNamingPolicy(owner.getPropertyNamingPolicy() != null
                        ? owner.getPropertyNamingPolicy()
                        : NamingPolicyType.PASCAL_CASE);
            }
            options.completeFrom(owner);
        }
        return options;
    }

    private static String convertEventName(HostSettings settings, String canonicalName) {
        NamingPolicyType policy = settings.getEventNamingPolicy();
        return policy == null ? canonicalName : policy.convertName(canonicalName);
    }
}
