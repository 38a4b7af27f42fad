package com.github.dimitryivaniuta.newsletter.mail;

/**
 * Send failed for a reason that may go away (connection refused, timeout, 4xx reply, ...).
 * The task stays queued and is retried later.
 */
public class TransientDeliveryFailureException extends DeliveryFailureException {

    public TransientDeliveryFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
