package org.eventbus.rabbitmq.subscriber;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.connection.BrokerConnection;
import org.eventbus.rabbitmq.connection.ConnectionRegistry;
import org.eventbus.rabbitmq.exception.ConnectionException;
import org.eventbus.rabbitmq.serialization.JsonEventSerializer;
import org.eventbus.rabbitmq.tracing.EventTracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubscriberManagerTest {

    private static final Duration RECONNECT = Duration.ofSeconds(2);

    private BrokerConnection connection;
    private Channel channel;
    private ScheduledExecutorService scheduler;
    private SubscriberRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        connection = mock(BrokerConnection.class);
        channel = mock(Channel.class);
        when(channel.isOpen()).thenReturn(true);
        when(channel.basicConsume(anyString(), anyBoolean(), any(Consumer.class))).thenReturn("ctag");
        when(connection.createChannel()).thenReturn(channel);
        scheduler = mock(ScheduledExecutorService.class);
        registry = new SubscriberRegistry();
    }

    private SubscriberManager manager() {
        HostSettings defaults = HostSettings.defaults();
        defaults.setExchangeName("Users");
        registry.resolveAll(Map.of(), defaults);
        MessageDispatcher dispatcher = new MessageDispatcher(new RecordingHandlers().resolver(),
                new JsonEventSerializer(), EventTracer.noop(), false, null, List.of(), List.of());
        return new SubscriberManager(registry, new ConnectionRegistry(s -> connection), dispatcher, RECONNECT,
                scheduler);
    }

    @Test
    @DisplayName("events sharing a queue are multiplexed onto one consumer group")
    void sharedQueue() throws Exception {
        registry.register(UserCreated.class, RecordingHandlers.UserCreatedHandler.class, o -> o.setQueueName("Q1"));
        registry.register(UserDeleted.class, RecordingHandlers.UserDeletedHandler.class, o -> o.setQueueName("Q1"));
        SubscriberManager manager = manager();

        manager.start();

        assertThat(manager.getGroups()).extracting(ConsumerGroup::getKey).containsExactly("/-Q1");
        verify(channel).queueBind("Q1", "Users", "Users.UserCreated");
        verify(channel).queueBind("Q1", "Users", "Users.UserDeleted");
        verify(channel, times(1)).basicConsume(eq("Q1"), eq(false), any(Consumer.class));
        assertThat(manager.isRunning()).isTrue();
    }

    @Test
    void separateQueuesGetSeparateGroups() {
        registry.register(UserCreated.class, RecordingHandlers.UserCreatedHandler.class, o -> o.setQueueName("Q1"));
        registry.register(UserDeleted.class, RecordingHandlers.UserDeletedHandler.class, o -> o.setQueueName("Q2"));
        SubscriberManager manager = manager();

        assertThat(manager.createGroups()).containsOnlyKeys("/-Q1", "/-Q2");
        assertThat(manager.createGroups()).hasSize(2);
    }

    @Test
    @DisplayName("a group that fails to start is retried after the reconnect interval")
    void failedGroupIsRetried() {
        when(connection.createChannel()).thenThrow(new ConnectionException("broker unavailable"));
        registry.register(UserCreated.class, RecordingHandlers.UserCreatedHandler.class);
        SubscriberManager manager = manager();

        manager.start();

        verify(scheduler).schedule(any(Runnable.class), eq(RECONNECT.toMillis()), eq(TimeUnit.MILLISECONDS));
        assertThat(manager.isRunning()).isTrue();
    }

    @Test
    void closeStopsEveryGroup() throws Exception {
        registry.register(UserCreated.class, RecordingHandlers.UserCreatedHandler.class);
        SubscriberManager manager = manager();
        manager.start();

        manager.close();

        verify(channel).basicCancel("ctag");
        assertThat(manager.getGroups()).isEmpty();
        assertThat(manager.isRunning()).isFalse();
    }
}
