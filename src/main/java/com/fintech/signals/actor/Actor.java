package com.fintech.signals.actor;

/**
 * A long-lived worker with private state.
 *
 * <p>All three callbacks run on the owning {@link Supervisor}'s mailbox thread,
 * so implementations need no synchronization for their own fields. A
 * supervisor creates a fresh instance from its factory every time the worker
 * is (re)started; nothing survives a crash.
 */
public interface Actor {

    /**
     * Registers subscriptions and acquires resources.
     * An exception here aborts the start.
     */
    default void preStart(ActorContext context) throws Exception {
    }

    /**
     * Handles one message.
     *
     * @return reply for {@link ActorRef#ask}; ignored for {@link ActorRef#tell}
     * @throws Exception crashes this instance and triggers a restart
     */
    Object receive(Object message) throws Exception;

    /**
     * Releases resources. Called on normal stop and after a crash.
     */
    default void postStop() throws Exception {
    }
}
