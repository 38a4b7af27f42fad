package com.github.dimitryivaniuta.newsletter.mail;

/**
 * Base class of send failures, classified by whether a later attempt can succeed.
 */
public abstract class DeliveryFailureException extends RuntimeException {

    protected DeliveryFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
