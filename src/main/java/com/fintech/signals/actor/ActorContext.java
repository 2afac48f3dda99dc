package com.fintech.signals.actor;

/**
 * Handed to {@link Actor#preStart} so a worker can find its own address and
 * register on the bus.
 *
 * @param self address of this worker's mailbox
 * @param subscriptionHandle address registered on the bus; the pool's address for pooled workers
 * @param bus the shared message bus
 */
public record ActorContext(ActorRef self, ActorRef subscriptionHandle, MessageBus bus) {

    /**
     * Subscribes this worker to a message type. Idempotent, so calling it again
     * after a restart keeps exactly one registration.
     */
    public void subscribe(Class<?> topic) {
        bus.subscribe(topic, subscriptionHandle);
    }

    /** Publishes on the bus. */
    public int publish(Object message) {
        return bus.publish(message);
    }
}
