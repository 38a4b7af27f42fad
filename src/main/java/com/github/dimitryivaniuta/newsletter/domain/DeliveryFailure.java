package com.github.dimitryivaniuta.newsletter.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Dead-letter record for a task that was resolved without a successful send.
 *
 * <p>Kept for manual inspection only. The task itself still counts towards {@code finished_n_tasks}
 * so a bad address cannot keep an issue from completing.</p>
 */
@Entity
@Table(
        name = "newsletter_delivery_failures",
        indexes = @Index(name = "idx_delivery_failures_issue", columnList = "issue_id")
)
@Getter
@NoArgsConstructor
public class DeliveryFailure {

    private static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "issue_id", nullable = false, updatable = false)
    private UUID issueId;

    @Column(name = "subscriber_id", nullable = false, updatable = false)
    private UUID subscriberId;

    @Column(name = "subscriber_email", columnDefinition = "text")
    private String subscriberEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private DeliveryFailureReason reason;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "failed_at", nullable = false)
    private Instant failedAt;

    /**
     * Builds the dead-letter record for a task being dropped.
     *
     * @param task the task being resolved
     * @param subscriberEmail address the send was attempted to, if known
     * @param reason failure category
     * @param lastError last error message
     * @return record
     */
    public static DeliveryFailure of(DeliveryTask task, String subscriberEmail, DeliveryFailureReason reason, String lastError) {
        DeliveryFailure f = new DeliveryFailure();
        f.id = UUID.randomUUID();
        f.issueId = task.getIssueId();
        f.subscriberId = task.getSubscriberId();
        f.subscriberEmail = subscriberEmail;
        f.reason = reason;
        f.attempts = task.currentAttempt();
        f.lastError = lastError != null && lastError.length() > MAX_ERROR_LENGTH
                ? lastError.substring(0, MAX_ERROR_LENGTH)
                : lastError;
        f.failedAt = Instant.now();
        return f;
    }
}
