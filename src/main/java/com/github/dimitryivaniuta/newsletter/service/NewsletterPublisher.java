package com.github.dimitryivaniuta.newsletter.service;

import com.github.dimitryivaniuta.newsletter.config.AppProperties;
import com.github.dimitryivaniuta.newsletter.domain.AlreadyPublishedException;
import com.github.dimitryivaniuta.newsletter.domain.NewsletterIssue;
import com.github.dimitryivaniuta.newsletter.domain.Subscriber;
import com.github.dimitryivaniuta.newsletter.repo.DeliveryTaskRepository;
import com.github.dimitryivaniuta.newsletter.repo.NewsletterIssueRepository;
import com.github.dimitryivaniuta.newsletter.repo.SubscriberRepository;
import com.github.dimitryivaniuta.newsletter.service.dto.IssueDraft;
import com.github.dimitryivaniuta.newsletter.service.dto.PublishedIssue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Publishes an issue: materializes one delivery task per confirmed subscriber and opens the issue for delivery.
 *
 * <p>Everything happens in one transaction:
 * <ol>
 *   <li>advisory lock on (scope, issue id), since the issue row may not exist yet</li>
 *   <li>load the issue {@code FOR UPDATE} or insert it as a draft</li>
 *   <li>reject it if it already has a status</li>
 *   <li>insert the task rows</li>
 *   <li>store {@code required_n_tasks} and flip the status to {@code AVAILABLE}</li>
 * </ol>
 * A crash anywhere before commit leaves neither tasks nor a status behind.</p>
 */
@Service
@Validated
public class NewsletterPublisher {

    private static final Logger log = LoggerFactory.getLogger(NewsletterPublisher.class);

    private final NewsletterIssueRepository issueRepository;
    private final DeliveryTaskRepository taskRepository;
    private final SubscriberRepository subscriberRepository;
    private final PostgresAdvisoryLockService advisoryLockService;
    private final AppProperties properties;

    private final Counter publishedCounter;
    private final Counter rejectedCounter;

    /**
     * Creates the publisher.
     */
    public NewsletterPublisher(
            NewsletterIssueRepository issueRepository,
            DeliveryTaskRepository taskRepository,
            SubscriberRepository subscriberRepository,
            PostgresAdvisoryLockService advisoryLockService,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.issueRepository = issueRepository;
        this.taskRepository = taskRepository;
        this.subscriberRepository = subscriberRepository;
        this.advisoryLockService = advisoryLockService;
        this.properties = properties;

        this.publishedCounter = Counter.builder("newsletter.issue.published").register(meterRegistry);
        this.rejectedCounter = Counter.builder("newsletter.issue.publish.rejected").register(meterRegistry);
    }

    /**
     * Publishes the issue to everyone whose subscription is confirmed right now.
     *
     * @param draft issue to publish
     * @return publish result
     * @throws AlreadyPublishedException if the issue has a status
     */
    @Transactional
    public PublishedIssue publish(@Valid IssueDraft draft) {
        NewsletterIssue issue = lockDraft(draft);
        int queued = taskRepository.enqueueConfirmedSubscribers(issue.getId(), Instant.now());
        return open(issue, queued);
    }

    /**
     * Publishes the issue to the given audience snapshot.
     *
     * <p>Subscribers that are not confirmed are skipped; the same subscriber listed twice gets one task.</p>
     *
     * @param draft issue to publish
     * @param subscribers audience snapshot
     * @return publish result
     * @throws AlreadyPublishedException if the issue has a status
     */
    @Transactional
    public PublishedIssue publish(@Valid IssueDraft draft, Collection<Subscriber> subscribers) {
        NewsletterIssue issue = lockDraft(draft);

        Set<UUID> audience = new LinkedHashSet<>();
        for (Subscriber s : subscribers) {
            if (s.isConfirmed()) {
                audience.add(s.getId());
            }
        }

        Instant now = Instant.now();
        int queued = 0;
        for (UUID subscriberId : audience) {
            queued += taskRepository.enqueue(issue.getId(), subscriberId, now);
        }
        return open(issue, queued);
    }

    private NewsletterIssue lockDraft(IssueDraft draft) {
        advisoryLockService.lock(properties.getDelivery().getPublishLockScope(), draft.id());

        NewsletterIssue issue = issueRepository.findByIdForUpdate(draft.id()).orElse(null);
        if (issue == null) {
            issue = NewsletterIssue.draft(draft.id(), draft.title(), draft.textContent(), draft.htmlContent(),
                    draft.publishedAt());
        } else if (issue.isPublished()) {
            rejectedCounter.increment();
            log.warn("Rejected publish of newsletter issue {}: already {}", issue.getId(), issue.getStatus());
            throw new AlreadyPublishedException(issue.getId(), issue.getStatus());
        } else {
            issue.reviseContent(draft.title(), draft.textContent(), draft.htmlContent());
        }
        // task rows reference the issue row
        return issueRepository.saveAndFlush(issue);
    }

    private PublishedIssue open(NewsletterIssue issue, int queued) {
        issue.publish(queued);
        issueRepository.save(issue);
        publishedCounter.increment();
        log.info("Published newsletter issue {}. requiredTasks={} status={}", issue.getId(), queued, issue.getStatus());
        return new PublishedIssue(issue.getId(), queued, issue.getStatus());
    }
}
