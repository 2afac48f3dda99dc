package com.fintech.signals.actor;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Typed publish/subscribe registry connecting the pipeline stages.
 *
 * <p>The topic of a message is its class. Publishing is fire-and-forget: each
 * subscriber's mailbox is offered the message without blocking, and a mailbox
 * that refuses it (closed or full) costs only that subscriber the message.
 * Failures are logged and counted, never thrown back to the publisher.
 *
 * <p>Messages are immutable records, so every subscriber receives the same
 * instance. Registration is read on every publish and written only when
 * workers start or stop, hence the copy-on-write sets.
 */
public class MessageBus {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final Map<Class<?>, Set<ActorRef>> subscriptions = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    private final AtomicLong messagesPublished = new AtomicLong(0);
    private final AtomicLong messagesDropped = new AtomicLong(0);

    public MessageBus(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("bus.messages.published.total", messagesPublished);
        meterRegistry.gauge("bus.messages.dropped.total", messagesDropped);
    }

    /**
     * Registers a subscriber for a message type. Registering the same subscriber
     * twice has no effect. Messages published earlier are not replayed.
     */
    public void subscribe(Class<?> topic, ActorRef subscriber) {
        boolean added = subscriptions
            .computeIfAbsent(topic, t -> new CopyOnWriteArraySet<>())
            .add(subscriber);
        if (added) {
            log.debug("Subscribed {} to {}", subscriber.name(), topic.getSimpleName());
        }
    }

    public void unsubscribe(Class<?> topic, ActorRef subscriber) {
        Set<ActorRef> subscribers = subscriptions.get(topic);
        if (subscribers != null && subscribers.remove(subscriber)) {
            log.debug("Unsubscribed {} from {}", subscriber.name(), topic.getSimpleName());
        }
    }

    /** Removes every registration of a subscriber. */
    public void unsubscribeAll(ActorRef subscriber) {
        subscriptions.forEach((topic, subscribers) -> unsubscribe(topic, subscriber));
    }

    /**
     * Delivers a message to every current subscriber of its type.
     *
     * @return number of mailboxes that accepted the message
     */
    public int publish(Object message) {
        Class<?> topic = message.getClass();
        Set<ActorRef> subscribers = subscriptions.getOrDefault(topic, Set.of());

        int delivered = 0;
        for (ActorRef subscriber : subscribers) {
            if (subscriber.tell(message)) {
                delivered++;
            } else {
                messagesDropped.incrementAndGet();
                meterRegistry.counter("bus.messages.dropped", "topic", topic.getSimpleName()).increment();
                log.warn("Dropped {} for {}: mailbox closed or full", topic.getSimpleName(), subscriber.name());
            }
        }

        messagesPublished.incrementAndGet();
        meterRegistry.counter("bus.messages.published", "topic", topic.getSimpleName()).increment();

        if (log.isTraceEnabled()) {
            log.trace("Published {} to {}/{} subscribers", message, delivered, subscribers.size());
        }
        return delivered;
    }

    /** Returns the number of subscribers registered for a message type. */
    public int subscriberCount(Class<?> topic) {
        return subscriptions.getOrDefault(topic, Set.of()).size();
    }

    public long getMessagesPublished() {
        return messagesPublished.get();
    }

    public long getMessagesDropped() {
        return messagesDropped.get();
    }
}
