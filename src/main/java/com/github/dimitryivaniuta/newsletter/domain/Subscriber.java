package com.github.dimitryivaniuta.newsletter.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Newsletter subscriber. Owned by the subscription flow; read-only here.
 */
@Entity
@Table(name = "subscriptions")
@Getter
@NoArgsConstructor
public class Subscriber {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, columnDefinition = "text")
    private String email;

    @Column(name = "name", nullable = false, columnDefinition = "text")
    private String name;

    @Column(name = "subscribed_at", nullable = false)
    private Instant subscribedAt;

    @Column(name = "status", nullable = false, columnDefinition = "text")
    private SubscriptionStatus status;

    /**
     * Factory method.
     *
     * @param email delivery address
     * @param name display name
     * @param status subscription status
     * @return subscriber
     */
    public static Subscriber of(String email, String name, SubscriptionStatus status) {
        Subscriber s = new Subscriber();
        s.id = UUID.randomUUID();
        s.email = email;
        s.name = name;
        s.status = status;
        s.subscribedAt = Instant.now();
        return s;
    }

    public boolean isConfirmed() {
        return status == SubscriptionStatus.CONFIRMED;
    }
}
