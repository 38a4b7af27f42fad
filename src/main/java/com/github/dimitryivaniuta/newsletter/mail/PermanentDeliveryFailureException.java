package com.github.dimitryivaniuta.newsletter.mail;

import com.github.dimitryivaniuta.newsletter.domain.DeliveryFailureReason;
import lombok.Getter;

/**
 * Send can never succeed for this recipient. The task is resolved without a send.
 */
@Getter
public class PermanentDeliveryFailureException extends DeliveryFailureException {

    private final DeliveryFailureReason reason;

    public PermanentDeliveryFailureException(DeliveryFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
