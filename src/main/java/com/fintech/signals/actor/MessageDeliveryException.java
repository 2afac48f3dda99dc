package com.fintech.signals.actor;

/**
 * Thrown to callers of {@link ActorRef#ask} when the target mailbox refused the message.
 */
public class MessageDeliveryException extends RuntimeException {

    public MessageDeliveryException(String message) {
        super(message);
    }
}
