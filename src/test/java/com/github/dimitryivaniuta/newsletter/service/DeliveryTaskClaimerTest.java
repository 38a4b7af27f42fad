package com.github.dimitryivaniuta.newsletter.service;

import com.github.dimitryivaniuta.newsletter.PostgresTestSupport;
import com.github.dimitryivaniuta.newsletter.domain.DeliveryTask;
import com.github.dimitryivaniuta.newsletter.domain.DeliveryTaskId;
import com.github.dimitryivaniuta.newsletter.service.dto.PublishedIssue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Claim protocol: exclusive, non-blocking, released on rollback.
 */
class DeliveryTaskClaimerTest extends PostgresTestSupport {

    @Autowired
    DeliveryTaskClaimer claimer;

    @Autowired
    NewsletterPublisher publisher;

    @Autowired
    TransactionTemplate tx;

    @Test
    void claimRequiresSurroundingTransaction() {
        Assertions.assertThrows(IllegalTransactionStateException.class, () -> claimer.claimOne("no-tx"));
    }

    @Test
    void concurrentClaimsNeverReturnTheSameTask() throws Exception {
        int workers = 5;
        confirmedSubscribers(workers);
        PublishedIssue published = publisher.publish(draft());

        ExecutorService exec = Executors.newFixedThreadPool(workers);
        CountDownLatch allClaimed = new CountDownLatch(workers);
        List<Future<DeliveryTaskId>> claims = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                String workerId = "worker-" + i;
                claims.add(exec.submit(() -> tx.execute(status -> {
                    Optional<DeliveryTask> task = claimer.claimOne(workerId);
                    allClaimed.countDown();
                    try {
                        // hold the row lock until every worker has claimed
                        allClaimed.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    status.setRollbackOnly();
                    return task.map(DeliveryTask::getId).orElse(null);
                })));
            }

            Set<DeliveryTaskId> distinct = new HashSet<>();
            for (Future<DeliveryTaskId> f : claims) {
                DeliveryTaskId id = f.get(30, TimeUnit.SECONDS);
                Assertions.assertNotNull(id, "every worker must get a task while tasks are free");
                Assertions.assertTrue(distinct.add(id), "task claimed twice: " + id);
            }
            Assertions.assertEquals(workers, distinct.size());
        } finally {
            exec.shutdownNow();
        }

        Assertions.assertEquals(workers, queuedTasks(published.issueId()));
    }

    @Test
    void claimedTaskIsSkippedNotAwaited() throws Exception {
        confirmedSubscribers(1);
        publisher.publish(draft());

        ExecutorService exec = Executors.newSingleThreadExecutor();
        CountDownLatch claimed = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            Future<Boolean> holder = exec.submit(() -> tx.execute(status -> {
                boolean got = claimer.claimOne("holder").isPresent();
                claimed.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                status.setRollbackOnly();
                return got;
            }));

            Assertions.assertTrue(claimed.await(10, TimeUnit.SECONDS));
            Optional<DeliveryTaskId> second = tx.execute(status -> claimer.claimOne("second").map(DeliveryTask::getId));
            Assertions.assertTrue(second.isEmpty());

            release.countDown();
            Assertions.assertTrue(holder.get(10, TimeUnit.SECONDS));
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void rolledBackClaimIsClaimableAgain() {
        confirmedSubscribers(1);
        publisher.publish(draft());

        DeliveryTaskId first = tx.execute(status -> {
            DeliveryTaskId id = claimer.claimOne("crashing-worker").orElseThrow().getId();
            status.setRollbackOnly();
            return id;
        });
        DeliveryTaskId again = tx.execute(status -> claimer.claimOne("next-worker").orElseThrow().getId());

        Assertions.assertEquals(first, again);
    }

    @Test
    void taskBackingOffIsNotClaimable() {
        confirmedSubscribers(1);
        PublishedIssue published = publisher.publish(draft());
        jdbcTemplate.update("update newsletter_issue_delivery_queue set execute_after = now() + interval '1 hour' "
                + "where issue_id = ?", published.issueId());

        Optional<DeliveryTask> claimed = tx.execute(status -> claimer.claimOne("worker"));

        Assertions.assertTrue(claimed.isEmpty());
        Assertions.assertEquals(1, queuedTasks(published.issueId()));
    }
}
