package com.fintech.signals.actor;

import java.util.concurrent.CompletableFuture;

/**
 * Address of a running worker.
 * Messages sent through a reference are queued in the worker's mailbox and
 * handled one at a time on the worker's own thread.
 */
public interface ActorRef {

    /**
     * Name used in logs and metric tags.
     */
    String name();

    /**
     * Fire-and-forget delivery. Never blocks the caller.
     *
     * @param message immutable message
     * @return true if the mailbox accepted the message, false if it is closed or full
     */
    boolean tell(Object message);

    /**
     * Request/response delivery. The returned future completes with the value
     * the actor's handler returned, or exceptionally if the message could not be
     * delivered or the handler failed.
     */
    <R> CompletableFuture<R> ask(Object message);
}
