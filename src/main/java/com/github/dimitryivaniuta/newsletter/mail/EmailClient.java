package com.github.dimitryivaniuta.newsletter.mail;

import jakarta.mail.internet.InternetAddress;

/**
 * Abstraction over the outgoing mail provider.
 *
 * <p>Implementations must report failures as {@link TransientDeliveryFailureException} or
 * {@link PermanentDeliveryFailureException} so the worker can decide between retrying and dropping.</p>
 */
public interface EmailClient {

    /**
     * Sends a multipart (plain text + HTML) email.
     *
     * @param recipient recipient address
     * @param subject subject line
     * @param textContent plain text part
     * @param htmlContent HTML part
     */
    void send(InternetAddress recipient, String subject, String textContent, String htmlContent);
}
