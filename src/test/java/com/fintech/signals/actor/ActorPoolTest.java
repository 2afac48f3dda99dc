package com.fintech.signals.actor;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ActorPool Tests")
class ActorPoolTest {

    private static final Function<Object, Object> BY_VALUE = message -> message;

    private SimpleMeterRegistry meterRegistry;
    private MessageBus bus;
    private ActorPool pool;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        bus = new MessageBus(meterRegistry);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop();
        }
    }

    @Test
    @DisplayName("Should route the same key to the same worker")
    void testStableRouting() {
        pool = new ActorPool("pool", 3, ThreadRecorder::new, BY_VALUE, bus, MailboxSettings.DEFAULT, meterRegistry);

        Supervisor first = pool.route("AAPL");

        assertThat(pool.route("AAPL")).isSameAs(first);
        assertThat(first).isSameAs(pool.getWorkers().get(Math.floorMod("AAPL".hashCode(), 3)));
    }

    @Test
    @DisplayName("Should handle messages with one key on one thread")
    void testKeyAffinity() throws Exception {
        pool = new ActorPool("pool", 3, ThreadRecorder::new, BY_VALUE, bus, MailboxSettings.DEFAULT, meterRegistry);
        pool.start();

        Set<Object> threads = ConcurrentHashMap.newKeySet();
        for (int i = 0; i < 10; i++) {
            threads.add(pool.ask("MSFT").get(5, TimeUnit.SECONDS));
        }

        assertThat(threads).hasSize(1);
        assertThat((String) threads.iterator().next()).startsWith("actor-pool-");
    }

    @Test
    @DisplayName("Should register the pool once on the bus")
    void testSingleRegistration() {
        pool = new ActorPool("pool", 4, ThreadRecorder::new, BY_VALUE, bus, MailboxSettings.DEFAULT, meterRegistry);
        pool.start();

        assertThat(bus.subscriberCount(String.class)).isEqualTo(1);
        assertThat(bus.publish("GOOG")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should never run more messages at once than it has workers")
    void testConcurrencyCap() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(12);

        pool = new ActorPool("slow", 2, () -> new Actor() {
            @Override
            public Object receive(Object message) throws Exception {
                int now = active.incrementAndGet();
                maxActive.accumulateAndGet(now, Math::max);
                Thread.sleep(20);
                active.decrementAndGet();
                done.countDown();
                return null;
            }
        }, BY_VALUE, bus, MailboxSettings.DEFAULT, meterRegistry);
        pool.start();

        for (String symbol : List.of("AAPL", "MSFT", "UBER", "GOOG", "TSLA", "AMZN")) {
            pool.tell(symbol);
            pool.tell(symbol);
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(maxActive.get()).isBetween(1, 2);
    }

    @Test
    @DisplayName("Should reject an empty pool")
    void testInvalidSize() {
        assertThatThrownBy(() -> new ActorPool("empty", 0, ThreadRecorder::new, BY_VALUE, bus,
                MailboxSettings.DEFAULT, meterRegistry))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should stop started workers when one fails to start")
    void testPartialStartFailure() {
        AtomicInteger created = new AtomicInteger();
        Map<Integer, Boolean> stopped = new ConcurrentHashMap<>();

        pool = new ActorPool("flaky", 3, () -> {
            int id = created.incrementAndGet();
            return new Actor() {
                @Override
                public void preStart(ActorContext context) {
                    if (id == 2) {
                        throw new IllegalStateException("worker 2 cannot start");
                    }
                    context.subscribe(String.class);
                }

                @Override
                public Object receive(Object message) {
                    return null;
                }

                @Override
                public void postStop() {
                    stopped.put(id, true);
                }
            };
        }, BY_VALUE, bus, MailboxSettings.DEFAULT, meterRegistry);

        assertThatThrownBy(pool::start).isInstanceOf(ActorInitializationException.class);
        assertThat(stopped).containsKey(1);
        assertThat(pool.getWorkers().get(0).getState()).isEqualTo(Supervisor.State.STOPPED);
        assertThat(bus.subscriberCount(String.class)).isZero();
    }

    /** Replies with the name of the handling thread. */
    static class ThreadRecorder implements Actor {

        @Override
        public void preStart(ActorContext context) {
            context.subscribe(String.class);
        }

        @Override
        public Object receive(Object message) {
            return Thread.currentThread().getName();
        }
    }
}
