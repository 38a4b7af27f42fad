package com.github.dimitryivaniuta.newsletter.domain;

/**
 * Why a delivery task was resolved without a successful send.
 */
public enum DeliveryFailureReason {
    /** Recipient address could not be parsed or was rejected by the mail server. */
    INVALID_ADDRESS,

    /** Mail server refused the message for a reason that will not go away on retry. */
    PERMANENT_FAILURE,

    /** Transient failures kept happening until the retry budget ran out. */
    RETRIES_EXHAUSTED,

    /** The subscriber row disappeared after the fan-out. */
    SUBSCRIBER_MISSING
}
