package com.github.dimitryivaniuta.newsletter.mail;

import com.github.dimitryivaniuta.newsletter.domain.DeliveryFailureReason;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

/**
 * Recipient address parsing.
 *
 * <p>Stored addresses are parsed again before every send; validation rules may have changed since the
 * subscriber signed up.</p>
 */
public final class EmailAddresses {

    private EmailAddresses() {
    }

    /**
     * Parses a single bare address ({@code local@domain}).
     *
     * @param raw stored address
     * @return parsed address
     * @throws PermanentDeliveryFailureException if the address is not usable
     */
    public static InternetAddress parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw invalid(raw, null);
        }
        try {
            InternetAddress address = new InternetAddress(raw.trim(), true);
            address.validate();
            String value = address.getAddress();
            int at = value.lastIndexOf('@');
            if (at <= 0 || at == value.length() - 1 || address.getPersonal() != null) {
                throw invalid(raw, null);
            }
            return address;
        } catch (AddressException ex) {
            throw invalid(raw, ex);
        }
    }

    private static PermanentDeliveryFailureException invalid(String raw, Throwable cause) {
        return new PermanentDeliveryFailureException(DeliveryFailureReason.INVALID_ADDRESS,
                "Invalid subscriber email address '" + raw + "'", cause);
    }
}
