package com.github.dimitryivaniuta.newsletter.service;

import com.github.dimitryivaniuta.newsletter.domain.DeliveryTask;
import com.github.dimitryivaniuta.newsletter.repo.DeliveryTaskRepository;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Claims delivery tasks for a worker.
 *
 * <p>A claim is a {@code FOR UPDATE SKIP LOCKED} row lock held by the caller's transaction. There is no
 * in-flight bookkeeping: if the worker dies, its transaction is rolled back by the database, the lock goes away
 * and the row (still present) is claimable again.</p>
 */
@Component
public class DeliveryTaskClaimer {

    private static final Logger log = LoggerFactory.getLogger(DeliveryTaskClaimer.class);

    private final DeliveryTaskRepository taskRepository;

    public DeliveryTaskClaimer(DeliveryTaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    /**
     * Claims one due task, skipping tasks claimed by other workers.
     *
     * @param workerId claiming worker, for logging
     * @return claimed task, or empty if the queue is empty, fully claimed or backing off
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<DeliveryTask> claimOne(String workerId) {
        Optional<DeliveryTask> task = taskRepository.claimNext(Instant.now());
        task.ifPresent(t -> log.debug("Worker {} claimed delivery task {} (attempt {})", workerId, t.getId(), t.currentAttempt()));
        return task;
    }
}
