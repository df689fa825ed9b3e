package org.eventbus.rabbitmq.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HostSettingsTest {

    @Test
    @DisplayName("merge keeps own values and fills the rest from the parent")
    void mergeFillsUnsetFields() {
        HostSettings own = new HostSettings();
        own.setVirtualHost("users");
        own.setExchangeName("Users");
        own.setHostPort(5673);

        HostSettings merged = own.merge(HostSettings.defaults());

        assertThat(merged.getVirtualHost()).isEqualTo("users");
        assertThat(merged.getExchangeName()).isEqualTo("Users");
        assertThat(merged.getHostPort()).isEqualTo(5673);
        assertThat(merged.getHostName()).isEqualTo(HostSettings.DEFAULT_HOST_NAME);
        assertThat(merged.getExchangeType()).isEqualTo("topic");
        assertThat(merged.getRetryConnectionCount()).isEqualTo(3);
        assertThat(merged.getPropertyNamingPolicy()).isEqualTo(NamingPolicyType.PASCAL_CASE);
    }

    @Test
    void mergeTreatsEmptyStringsAsUnset() {
        HostSettings own = new HostSettings();
        own.setExchangeName("");

        HostSettings merged = own.merge(HostSettings.defaults());

        assertThat(merged.getExchangeName()).isEqualTo(HostSettings.DEFAULT_EXCHANGE_NAME);
    }

    @Test
    @DisplayName("argument maps are merged key by key, own keys winning")
    void mergeArguments() {
        HostSettings parent = new HostSettings();
        parent.setQueueArguments(Map.of("x-queue-type", "classic", "x-max-length", 100));
        HostSettings own = new HostSettings();
        own.setQueueArguments(Map.of("x-queue-type", "quorum"));

        HostSettings merged = own.merge(parent);

        assertThat(merged.getQueueArguments())
                .containsEntry("x-queue-type", "quorum")
                .containsEntry("x-max-length", 100);
    }

    @Test
    void mergeDoesNotModifyItsInputs() {
        HostSettings parent = HostSettings.defaults();
        HostSettings own = new HostSettings();

        own.merge(parent);

        assertThat(own.getHostName()).isNull();
        assertThat(parent.isFrozen()).isFalse();
    }

    @Test
    @DisplayName("frozen settings reject changes")
    void freeze() {
        HostSettings settings = HostSettings.defaults();
        settings.setQueueArguments(Map.of("x-queue-type", "quorum"));

        settings.freeze();

        assertThat(settings.isFrozen()).isTrue();
        assertThatThrownBy(() -> settings.setExchangeName("Other"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> settings.getQueueArguments().put("x-max-length", 1))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(settings.freeze()).isSameAs(settings);
    }

    @Test
    void connectionKeyIsHostPortAndVirtualHost() {
        HostSettings settings = HostSettings.defaults();
        settings.setVirtualHost("orders");

        assertThat(settings.connectionKey()).isEqualTo("localhost:5672:orders");
    }

    @Test
    @DisplayName("RabbitMqOptions keep their bus switches through a merge")
    void mergeOptionsKeepsSwitches() {
        RabbitMqOptions options = new RabbitMqOptions();
        options.setEnabled(false);
        options.setUseInbox(true);
        options.setExchangeName("Orders");

        RabbitMqOptions merged = options.mergeOptions(HostSettings.defaults());

        assertThat(merged.isEnabled()).isFalse();
        assertThat(merged.isUseInbox()).isTrue();
        assertThat(merged.getExchangeName()).isEqualTo("Orders");
        assertThat(merged.getReconnectInterval()).isEqualTo(RabbitMqOptions.DEFAULT_RECONNECT_INTERVAL);
    }
}
