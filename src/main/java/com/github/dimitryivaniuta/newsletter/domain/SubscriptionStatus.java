package com.github.dimitryivaniuta.newsletter.domain;

import java.util.Arrays;

/**
 * Subscription status as written by the subscription flow.
 */
public enum SubscriptionStatus {
    PENDING_CONFIRMATION("pending_confirmation"),
    CONFIRMED("confirmed");

    private final String dbValue;

    SubscriptionStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    /**
     * Resolves a stored value.
     *
     * @param dbValue column value
     * @return status
     */
    public static SubscriptionStatus fromDbValue(String dbValue) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equals(dbValue))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscription status: " + dbValue));
    }
}
