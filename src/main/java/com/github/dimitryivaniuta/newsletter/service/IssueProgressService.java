package com.github.dimitryivaniuta.newsletter.service;

import com.github.dimitryivaniuta.newsletter.domain.NewsletterIssue;
import com.github.dimitryivaniuta.newsletter.repo.DeliveryTaskRepository;
import com.github.dimitryivaniuta.newsletter.repo.NewsletterIssueRepository;
import com.github.dimitryivaniuta.newsletter.service.dto.IssueProgress;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only delivery progress for status reporting.
 */
@Service
public class IssueProgressService {

    private final NewsletterIssueRepository issueRepository;
    private final DeliveryTaskRepository taskRepository;

    public IssueProgressService(NewsletterIssueRepository issueRepository, DeliveryTaskRepository taskRepository) {
        this.issueRepository = issueRepository;
        this.taskRepository = taskRepository;
    }

    /**
     * Current counters, status and live queue size of an issue.
     *
     * @param issueId issue id
     * @return progress snapshot
     * @throws IssueNotFoundException if no such issue exists
     */
    @Transactional(readOnly = true)
    public IssueProgress issueProgress(UUID issueId) {
        NewsletterIssue issue = issueRepository.findById(issueId)
                .orElseThrow(() -> new IssueNotFoundException(issueId));
        long remaining = taskRepository.countByIdIssueId(issueId);
        return new IssueProgress(issueId, issue.getRequiredTasks(), issue.getFinishedTasks(), remaining, issue.getStatus());
    }
}
