package org.eventbus.rabbitmq.subscriber;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import org.eventbus.rabbitmq.config.HostSettings;
import org.eventbus.rabbitmq.connection.BrokerConnection;
import org.eventbus.rabbitmq.exception.ChannelException;
import org.eventbus.rabbitmq.serialization.JsonEventSerializer;
import org.eventbus.rabbitmq.tracing.EventTracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsumerGroupTest {

    private static final Duration RECONNECT = Duration.ofSeconds(5);

    private BrokerConnection connection;
    private ScheduledExecutorService scheduler;
    private RecordingHandlers handlers;
    private SubscriberRegistry registry;

    @BeforeEach
    void setUp() {
        connection = mock(BrokerConnection.class);
        scheduler = mock(ScheduledExecutorService.class);
        handlers = new RecordingHandlers();
        registry = new SubscriberRegistry();
        registry.register(UserCreated.class, RecordingHandlers.UserCreatedHandler.class,
                o -> o.setQueueName("Q1"));
        registry.register(UserDeleted.class, RecordingHandlers.UserDeletedHandler.class,
                o -> o.setQueueName("Q1"));

        HostSettings settings = HostSettings.defaults();
        settings.setVirtualHost("users");
        settings.setExchangeName("Users");
        settings.setQueueArguments(Map.of("x-queue-type", "quorum"));
        registry.resolveAll(Map.of(), settings);
    }

    private ConsumerGroup group() {
        MessageDispatcher dispatcher = new MessageDispatcher(handlers.resolver(), new JsonEventSerializer(),
                EventTracer.noop(), false, null, List.of(), List.of());
        ConsumerGroup group = new ConsumerGroup("users-Q1", registry.get("UserCreated").getOptions(), connection,
                dispatcher, scheduler, RECONNECT);
        registry.snapshot().values().forEach(group::addSubscription);
        return group;
    }

    private static Channel openChannel() throws IOException {
        Channel channel = mock(Channel.class);
        when(channel.isOpen()).thenReturn(true);
        when(channel.basicConsume(anyString(), anyBoolean(), any(Consumer.class))).thenReturn("ctag-1");
        return channel;
    }

    private void runScheduledTasksImmediately() {
        when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(invocation -> {
            ((Runnable) invocation.getArgument(0)).run();
            return null;
        });
    }

    @Test
    @DisplayName("start declares the exchange and queue, binds every routing key and consumes")
    void start() throws Exception {
        Channel channel = openChannel();
        when(connection.createChannel()).thenReturn(channel);
        ConsumerGroup group = group();

        group.start();

        verify(channel).exchangeDeclare("Users", "topic", true, false, Map.of());
        verify(channel).queueDeclare("Q1", true, false, false, Map.of("x-queue-type", "quorum"));
        verify(channel).queueBind("Q1", "Users", "Users.UserCreated");
        verify(channel).queueBind("Q1", "Users", "Users.UserDeleted");
        verify(channel).basicQos(HostSettings.DEFAULT_PREFETCH_COUNT);
        verify(channel).basicConsume(eq("Q1"), eq(false), any(Consumer.class));
        assertThat(group.isRunning()).isTrue();
        assertThat(group.routingKeys()).containsExactlyInAnyOrder("Users.UserCreated", "Users.UserDeleted");
    }

    @Test
    @DisplayName("a delivery is dispatched to its handler and acked on the consuming channel")
    void delivery() throws Exception {
        Channel channel = openChannel();
        when(connection.createChannel()).thenReturn(channel);
        ConsumerGroup group = group();
        group.start();

        ArgumentCaptor<Consumer> consumer = ArgumentCaptor.forClass(Consumer.class);
        verify(channel).basicConsume(eq("Q1"), eq(false), consumer.capture());
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .type("UserDeleted")
                .messageId("9b2f3c1e-0d4a-4f6b-8a7e-2c1d0e9f8a7b")
                .build();

        consumer.getValue().handleDelivery("ctag-1", new Envelope(5L, false, "Users", "Users.UserDeleted"),
                properties, "{\"UserName\":\"bob\"}".getBytes(StandardCharsets.UTF_8));

        assertThat(handlers.log).containsExactly("deleted:bob");
        verify(channel).basicAck(5L, false);
    }

    @Test
    void declarationFailure() throws Exception {
        Channel channel = openChannel();
        doThrow(new IOException("PRECONDITION_FAILED")).when(channel)
                .queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), anyMap());
        when(connection.createChannel()).thenReturn(channel);

        assertThatThrownBy(() -> group().start())
                .isInstanceOf(ChannelException.class)
                .hasMessage("Error while creating RabbitMQ consumer channel for 'Q1' queue of 'users' virtual host.");
        verify(channel).abort();
    }

    @Test
    @DisplayName("a closed channel is rebuilt with the full declare and bind sequence")
    void rebuildAfterShutdown() throws Exception {
        runScheduledTasksImmediately();
        Channel first = openChannel();
        Channel second = openChannel();
        when(connection.createChannel()).thenReturn(first, second);
        ConsumerGroup group = group();
        group.start();

        ArgumentCaptor<ShutdownListener> listener = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(first).addShutdownListener(listener.capture());
        when(first.isOpen()).thenReturn(false);

        listener.getValue().shutdownCompleted(new ShutdownSignalException(false, false, null, first));

        verify(second).exchangeDeclare("Users", "topic", true, false, Map.of());
        verify(second).queueBind("Q1", "Users", "Users.UserCreated");
        verify(second).queueBind("Q1", "Users", "Users.UserDeleted");
        verify(second).basicConsume(eq("Q1"), eq(false), any(Consumer.class));
        verify(first).removeShutdownListener(listener.getValue());
        assertThat(group.isRunning()).isTrue();
    }

    @Test
    void shutdownOfAnotherChannelIsIgnored() throws Exception {
        Channel channel = openChannel();
        when(connection.createChannel()).thenReturn(channel);
        ConsumerGroup group = group();
        group.start();

        ArgumentCaptor<ShutdownListener> listener = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(channel).addShutdownListener(listener.capture());
        listener.getValue().shutdownCompleted(new ShutdownSignalException(false, false, null, mock(Channel.class)));

        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    @DisplayName("a lost connection rebuilds the consumer once a channel can be opened again")
    void rebuildAfterConnectionLoss() throws Exception {
        runScheduledTasksImmediately();
        Channel first = openChannel();
        Channel second = openChannel();
        when(connection.createChannel()).thenReturn(first, second);
        ConsumerGroup group = group();
        group.start();

        ArgumentCaptor<ShutdownListener> listener = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(first).addShutdownListener(listener.capture());
        when(first.isOpen()).thenReturn(false);

        listener.getValue().shutdownCompleted(
                new ShutdownSignalException(true, false, null, mock(Connection.class)));

        verify(connection, times(2)).createChannel();
        verify(second).queueDeclare("Q1", true, false, false, Map.of("x-queue-type", "quorum"));
        verify(second).queueBind("Q1", "Users", "Users.UserCreated");
        verify(second).basicConsume(eq("Q1"), eq(false), any(Consumer.class));
        assertThat(group.isRunning()).isTrue();
    }

    @Test
    @DisplayName("a failed rebuild is retried after the reconnect interval")
    void failedRebuildIsRescheduled() throws Exception {
        when(connection.createChannel()).thenThrow(new ChannelException("broker unavailable"));
        ConsumerGroup group = group();

        group.rebuild();

        verify(scheduler).schedule(any(Runnable.class), eq(RECONNECT.toMillis()), eq(TimeUnit.MILLISECONDS));
        assertThat(group.isRunning()).isFalse();
    }

    @Test
    @DisplayName("close cancels the consumer and stops rebuilding")
    void close() throws Exception {
        Channel channel = openChannel();
        when(connection.createChannel()).thenReturn(channel);
        ConsumerGroup group = group();
        group.start();
        ArgumentCaptor<ShutdownListener> listener = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(channel).addShutdownListener(listener.capture());

        group.close();
        group.close();

        verify(channel, times(1)).basicCancel("ctag-1");
        verify(channel).abort();
        assertThat(group.isRunning()).isFalse();
        assertThatThrownBy(group::start).isInstanceOf(IllegalStateException.class);
        group.scheduleRebuild(Duration.ZERO);
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }
}
