package com.github.dimitryivaniuta.newsletter.service;

import com.github.dimitryivaniuta.newsletter.domain.DeliveryFailure;
import com.github.dimitryivaniuta.newsletter.domain.DeliveryFailureReason;
import com.github.dimitryivaniuta.newsletter.domain.DeliveryTask;
import com.github.dimitryivaniuta.newsletter.domain.NewsletterIssue;
import com.github.dimitryivaniuta.newsletter.domain.Subscriber;
import com.github.dimitryivaniuta.newsletter.mail.EmailAddresses;
import com.github.dimitryivaniuta.newsletter.mail.EmailClient;
import com.github.dimitryivaniuta.newsletter.mail.PermanentDeliveryFailureException;
import com.github.dimitryivaniuta.newsletter.mail.TransientDeliveryFailureException;
import com.github.dimitryivaniuta.newsletter.repo.DeliveryFailureRepository;
import com.github.dimitryivaniuta.newsletter.repo.DeliveryTaskRepository;
import com.github.dimitryivaniuta.newsletter.repo.NewsletterIssueRepository;
import com.github.dimitryivaniuta.newsletter.repo.SubscriberRepository;
import com.github.dimitryivaniuta.newsletter.service.dto.IssueContent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.mail.internet.InternetAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs one claim-send-acknowledge cycle in a single transaction.
 *
 * <p>The claimed row stays locked while the email is sent. The acknowledge step deletes the row and
 * increments the issue counter under the issue row lock, in the same transaction, so a task is counted at most
 * once even if a worker crashes and the send is repeated by another worker.</p>
 *
 * <p>Kept in its own bean so the worker loop always calls it through the transactional proxy.</p>
 */
@Service
public class DeliveryTaskExecutor {

    /** MDC key for the issue being delivered. */
    public static final String MDC_ISSUE_ID = "issueId";

    /** MDC key for the subscriber being delivered to. */
    public static final String MDC_SUBSCRIBER_ID = "subscriberId";

    private static final Logger log = LoggerFactory.getLogger(DeliveryTaskExecutor.class);

    private final DeliveryTaskClaimer claimer;
    private final DeliveryTaskRepository taskRepository;
    private final NewsletterIssueRepository issueRepository;
    private final SubscriberRepository subscriberRepository;
    private final DeliveryFailureRepository failureRepository;
    private final EmailClient emailClient;
    private final RetryBackoff retryBackoff;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter droppedCounter;
    private final Counter completedCounter;

    /**
     * Creates the executor.
     */
    public DeliveryTaskExecutor(
            DeliveryTaskClaimer claimer,
            DeliveryTaskRepository taskRepository,
            NewsletterIssueRepository issueRepository,
            SubscriberRepository subscriberRepository,
            DeliveryFailureRepository failureRepository,
            EmailClient emailClient,
            RetryBackoff retryBackoff,
            MeterRegistry meterRegistry
    ) {
        this.claimer = claimer;
        this.taskRepository = taskRepository;
        this.issueRepository = issueRepository;
        this.subscriberRepository = subscriberRepository;
        this.failureRepository = failureRepository;
        this.emailClient = emailClient;
        this.retryBackoff = retryBackoff;

        this.sentCounter = Counter.builder("newsletter.delivery.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("newsletter.delivery.retry").register(meterRegistry);
        this.droppedCounter = Counter.builder("newsletter.delivery.dropped").register(meterRegistry);
        this.completedCounter = Counter.builder("newsletter.issue.completed").register(meterRegistry);
    }

    /**
     * Claims and handles one task.
     *
     * @param workerId calling worker
     * @param maxRetries delivery attempts per task before it is dropped
     * @return what happened
     */
    @Transactional
    public ExecutionOutcome tryExecuteTask(String workerId, int maxRetries) {
        Optional<DeliveryTask> claimed = claimer.claimOne(workerId);
        if (claimed.isEmpty()) {
            return ExecutionOutcome.EMPTY_QUEUE;
        }

        DeliveryTask task = claimed.get();
        MDC.put(MDC_ISSUE_ID, task.getIssueId().toString());
        MDC.put(MDC_SUBSCRIBER_ID, task.getSubscriberId().toString());
        try {
            return deliver(task, maxRetries);
        } finally {
            MDC.remove(MDC_ISSUE_ID);
            MDC.remove(MDC_SUBSCRIBER_ID);
        }
    }

    private ExecutionOutcome deliver(DeliveryTask task, int maxRetries) {
        IssueContent content = issueRepository.findContentById(task.getIssueId())
                .orElseThrow(() -> new IssueNotFoundException(task.getIssueId()));

        Subscriber subscriber = subscriberRepository.findById(task.getSubscriberId()).orElse(null);
        if (subscriber == null) {
            return drop(task, null, DeliveryFailureReason.SUBSCRIBER_MISSING, "Subscriber no longer exists");
        }

        try {
            InternetAddress recipient = EmailAddresses.parse(subscriber.getEmail());
            emailClient.send(recipient, content.title(), content.textContent(), content.htmlContent());
        } catch (PermanentDeliveryFailureException ex) {
            return drop(task, subscriber.getEmail(), ex.getReason(), ex.getMessage());
        } catch (TransientDeliveryFailureException ex) {
            if (task.currentAttempt() >= maxRetries) {
                return drop(task, subscriber.getEmail(), DeliveryFailureReason.RETRIES_EXHAUSTED, rootMessage(ex));
            }
            return scheduleRetry(task, ex);
        }

        acknowledge(task);
        sentCounter.increment();
        log.debug("Delivered newsletter issue {} to subscriber {}", task.getIssueId(), task.getSubscriberId());
        return ExecutionOutcome.DELIVERED;
    }

    private ExecutionOutcome scheduleRetry(DeliveryTask task, TransientDeliveryFailureException ex) {
        Duration backoff = retryBackoff.forAttempt(task.currentAttempt());
        task.scheduleRetry(Instant.now().plus(backoff));
        taskRepository.save(task);
        retryCounter.increment();
        log.warn("Delivery of newsletter issue {} to subscriber {} failed. attempt={} nextAttemptAt={} error={}",
                task.getIssueId(), task.getSubscriberId(), task.getRetries(), task.getExecuteAfter(), rootMessage(ex));
        return ExecutionOutcome.RETRY_SCHEDULED;
    }

    private ExecutionOutcome drop(DeliveryTask task, String email, DeliveryFailureReason reason, String error) {
        failureRepository.save(DeliveryFailure.of(task, email, reason, error));
        acknowledge(task);
        droppedCounter.increment();
        log.error("Dropped delivery of newsletter issue {} to subscriber {} after {} attempt(s). reason={} error={}",
                task.getIssueId(), task.getSubscriberId(), task.currentAttempt(), reason, error);
        return ExecutionOutcome.DROPPED;
    }

    /**
     * Deletes the task and counts it on the issue; completes the issue on the last task.
     */
    private void acknowledge(DeliveryTask task) {
        int deleted = taskRepository.deleteTask(task.getIssueId(), task.getSubscriberId());
        if (deleted != 1) {
            throw new IllegalStateException("Delivery task " + task.getId() + " vanished while claimed");
        }

        NewsletterIssue issue = issueRepository.findByIdForUpdate(task.getIssueId())
                .orElseThrow(() -> new IssueNotFoundException(task.getIssueId()));
        if (issue.recordResolvedTask()) {
            completedCounter.increment();
            log.info("Newsletter issue {} completed. tasks={}", issue.getId(), issue.getRequiredTasks());
        }
        issueRepository.save(issue);
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        String msg = t == ex ? ex.getMessage() : ex.getMessage() + ": " + t.getMessage();
        return msg != null ? msg : ex.getClass().getSimpleName();
    }
}
