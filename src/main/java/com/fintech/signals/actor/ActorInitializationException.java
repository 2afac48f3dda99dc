package com.fintech.signals.actor;

/**
 * A worker could not complete {@link Actor#preStart} when first started.
 */
public class ActorInitializationException extends RuntimeException {

    public ActorInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
