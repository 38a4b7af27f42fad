package com.github.dimitryivaniuta.newsletter.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Outstanding obligation to deliver one issue to one subscriber.
 *
 * <p>The row has no status: while it exists the delivery is pending, deleting it resolves the task.
 * Content and address are looked up by id at delivery time. {@code retries} and {@code executeAfter}
 * only drive the back-off between claim attempts.</p>
 */
@Entity
@Table(
        name = "newsletter_issue_delivery_queue",
        indexes = {
                @Index(name = "idx_delivery_queue_execute_after_enqueued", columnList = "execute_after,enqueued_at")
        }
)
@Getter
@NoArgsConstructor
public class DeliveryTask {

    @EmbeddedId
    private DeliveryTaskId id;

    @Column(name = "enqueued_at", nullable = false, updatable = false)
    private Instant enqueuedAt;

    @Column(name = "n_retries", nullable = false)
    private int retries;

    @Column(name = "execute_after", nullable = false)
    private Instant executeAfter;

    public UUID getIssueId() {
        return id.getIssueId();
    }

    public UUID getSubscriberId() {
        return id.getSubscriberId();
    }

    /**
     * Number of delivery attempts made so far, including the one in flight.
     *
     * @return attempts
     */
    public int currentAttempt() {
        return retries + 1;
    }

    /**
     * Records a failed attempt and hides the task from claims until {@code nextAttemptAt}.
     *
     * @param nextAttemptAt earliest next claim
     */
    public void scheduleRetry(Instant nextAttemptAt) {
        this.retries++;
        this.executeAfter = nextAttemptAt;
    }
}
