package com.fintech.signals.actor;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("MessageBus Tests")
class MessageBusTest {

    private SimpleMeterRegistry meterRegistry;
    private MessageBus bus;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        bus = new MessageBus(meterRegistry);
    }

    private ActorRef subscriber(String name, boolean accepts) {
        ActorRef ref = mock(ActorRef.class);
        when(ref.name()).thenReturn(name);
        when(ref.tell(any())).thenReturn(accepts);
        return ref;
    }

    @Test
    @DisplayName("Should deliver to every subscriber of the message type")
    void testFanOut() {
        ActorRef first = subscriber("first", true);
        ActorRef second = subscriber("second", true);
        bus.subscribe(String.class, first);
        bus.subscribe(String.class, second);

        int delivered = bus.publish("hello");

        assertThat(delivered).isEqualTo(2);
        verify(first).tell("hello");
        verify(second).tell("hello");
    }

    @Test
    @DisplayName("Should route by exact message class")
    void testTopicIsClass() {
        ActorRef strings = subscriber("strings", true);
        bus.subscribe(String.class, strings);

        assertThat(bus.publish(42)).isZero();
        verify(strings, never()).tell(any());
    }

    @Test
    @DisplayName("Should ignore duplicate subscriptions")
    void testIdempotentSubscribe() {
        ActorRef ref = subscriber("ref", true);
        bus.subscribe(String.class, ref);
        bus.subscribe(String.class, ref);

        bus.publish("once");

        assertThat(bus.subscriberCount(String.class)).isEqualTo(1);
        verify(ref, times(1)).tell("once");
    }

    @Test
    @DisplayName("Should count refused deliveries without failing the publisher")
    void testDropIsCounted() {
        ActorRef full = subscriber("full", false);
        ActorRef healthy = subscriber("healthy", true);
        bus.subscribe(String.class, full);
        bus.subscribe(String.class, healthy);

        int delivered = bus.publish("msg");

        assertThat(delivered).isEqualTo(1);
        assertThat(bus.getMessagesDropped()).isEqualTo(1);
        assertThat(bus.getMessagesPublished()).isEqualTo(1);
        assertThat(meterRegistry.counter("bus.messages.dropped", "topic", "String").count()).isEqualTo(1.0);
        verify(healthy).tell("msg");
    }

    @Test
    @DisplayName("Should deliver nothing when there are no subscribers")
    void testNoSubscribers() {
        assertThat(bus.publish("nobody")).isZero();
        assertThat(bus.getMessagesDropped()).isZero();
    }

    @Test
    @DisplayName("Should stop delivering after unsubscribe")
    void testUnsubscribe() {
        ActorRef ref = subscriber("ref", true);
        bus.subscribe(String.class, ref);
        bus.subscribe(Integer.class, ref);

        bus.unsubscribeAll(ref);

        assertThat(bus.publish("a")).isZero();
        assertThat(bus.publish(1)).isZero();
        verify(ref, never()).tell(any());
    }
}
