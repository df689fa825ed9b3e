package org.eventbus.rabbitmq.connection;

import org.eventbus.rabbitmq.config.HostSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConnectionRegistryTest {

    private final List<BrokerConnection> created = new ArrayList<>();

    private ConnectionRegistry registry() {
        return new ConnectionRegistry(settings -> {
            BrokerConnection connection = mock(BrokerConnection.class);
            when(connection.getSettings()).thenReturn(settings);
            created.add(connection);
            return connection;
        });
    }

    private static HostSettings host(String virtualHost, String exchange) {
        HostSettings settings = HostSettings.defaults();
        settings.setVirtualHost(virtualHost);
        settings.setExchangeName(exchange);
        return settings;
    }

    @Test
    @DisplayName("settings with the same host, port and virtual host share one connection")
    void sameKeySameConnection() {
        ConnectionRegistry registry = registry();

        BrokerConnection first = registry.getOrCreate(host("/", "Orders"));
        BrokerConnection second = registry.getOrCreate(host("/", "Billing"));

        assertThat(second).isSameAs(first);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void differentVirtualHostsGetDistinctConnections() {
        ConnectionRegistry registry = registry();

        BrokerConnection orders = registry.getOrCreate(host("/", "Orders"));
        BrokerConnection users = registry.getOrCreate(host("users", "Users"));

        assertThat(users).isNotSameAs(orders);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("close closes every connection even when one fails")
    void closeAll() {
        ConnectionRegistry registry = registry();
        registry.getOrCreate(host("/", "Orders"));
        registry.getOrCreate(host("users", "Users"));
        doThrow(new IllegalStateException("boom")).when(created.get(0)).close();

        registry.close();

        created.forEach(connection -> verify(connection).close());
        assertThat(registry.size()).isZero();
        assertThatThrownBy(() -> registry.getOrCreate(host("/", "Orders")))
                .isInstanceOf(IllegalStateException.class);
    }
}
