package com.github.dimitryivaniuta.newsletter.repo;

import com.github.dimitryivaniuta.newsletter.domain.DeliveryTask;
import com.github.dimitryivaniuta.newsletter.domain.DeliveryTaskId;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for the delivery queue.
 */
public interface DeliveryTaskRepository extends JpaRepository<DeliveryTask, DeliveryTaskId> {

    /**
     * Claims the oldest due task.
     *
     * <p>Uses Postgres {@code FOR UPDATE SKIP LOCKED}: rows locked by other workers are skipped instead of waited on,
     * and the lock is released when the surrounding transaction ends (commit, rollback or lost connection).</p>
     *
     * @param now current timestamp
     * @return locked task, empty if nothing is claimable
     */
    @Query(value = """
            select *
            from newsletter_issue_delivery_queue
            where execute_after <= :now
            order by enqueued_at
            for update skip locked
            limit 1
            """, nativeQuery = true)
    Optional<DeliveryTask> claimNext(@Param("now") Instant now);

    /**
     * Queues one task unless the (issue, subscriber) pair is already queued.
     *
     * @param issueId issue id
     * @param subscriberId subscriber id
     * @param now enqueue timestamp
     * @return 1 if a row was inserted, 0 otherwise
     */
    @Modifying
    @Query(value = """
            insert into newsletter_issue_delivery_queue (issue_id, subscriber_id, enqueued_at, n_retries, execute_after)
            values (:issueId, :subscriberId, :now, 0, :now)
            on conflict do nothing
            """, nativeQuery = true)
    int enqueue(@Param("issueId") UUID issueId, @Param("subscriberId") UUID subscriberId, @Param("now") Instant now);

    /**
     * Queues one task per currently confirmed subscriber.
     *
     * @param issueId issue id
     * @param now enqueue timestamp
     * @return number of tasks created
     */
    @Modifying
    @Query(value = """
            insert into newsletter_issue_delivery_queue (issue_id, subscriber_id, enqueued_at, n_retries, execute_after)
            select :issueId, s.id, :now, 0, :now
            from subscriptions s
            where s.status = 'confirmed'
            on conflict do nothing
            """, nativeQuery = true)
    int enqueueConfirmedSubscribers(@Param("issueId") UUID issueId, @Param("now") Instant now);

    /**
     * Deletes a task.
     *
     * @param issueId issue id
     * @param subscriberId subscriber id
     * @return number of deleted rows
     */
    @Modifying
    @Query("delete from DeliveryTask t where t.id.issueId = :issueId and t.id.subscriberId = :subscriberId")
    int deleteTask(@Param("issueId") UUID issueId, @Param("subscriberId") UUID subscriberId);

    long countByIdIssueId(UUID issueId);
}
