package com.github.dimitryivaniuta.newsletter.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A newsletter issue together with its delivery progress.
 *
 * <p>State machine: {@code (unpublished) -> AVAILABLE -> COMPLETED}. The counters are only ever changed
 * while the row is locked {@code FOR UPDATE}, in the same transaction as the queue change that justifies them:
 * <ul>
 *   <li>{@code requiredTasks} is written once, when the fan-out is materialized;</li>
 *   <li>{@code finishedTasks} grows by one per deleted task and never exceeds {@code requiredTasks}.</li>
 * </ul>
 */
@Entity
@Table(name = "newsletter_issues")
@Getter
@NoArgsConstructor
public class NewsletterIssue {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "title", nullable = false, columnDefinition = "text")
    private String title;

    @Column(name = "text_content", nullable = false, columnDefinition = "text")
    private String textContent;

    @Column(name = "html_content", nullable = false, columnDefinition = "text")
    private String htmlContent;

    @Column(name = "published_at", nullable = false)
    private Instant publishedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16)
    private IssueStatus status;

    @Column(name = "required_n_tasks", nullable = false)
    private int requiredTasks;

    @Column(name = "finished_n_tasks", nullable = false)
    private int finishedTasks;

    /**
     * Creates an unpublished issue.
     *
     * @param id issue id
     * @param title title, used as the email subject
     * @param textContent plain text body
     * @param htmlContent HTML body
     * @param publishedAt publication timestamp
     * @return issue without status
     */
    public static NewsletterIssue draft(UUID id, String title, String textContent, String htmlContent, Instant publishedAt) {
        NewsletterIssue issue = new NewsletterIssue();
        issue.id = Objects.requireNonNull(id, "id");
        issue.title = title;
        issue.textContent = textContent;
        issue.htmlContent = htmlContent;
        issue.publishedAt = publishedAt;
        return issue;
    }

    /**
     * Replaces the content of an unpublished issue.
     *
     * @param title new title
     * @param textContent new plain text body
     * @param htmlContent new HTML body
     * @throws IssueContentLockedException if the issue is already published
     */
    public void reviseContent(String title, String textContent, String htmlContent) {
        if (isPublished()) {
            throw new IssueContentLockedException(id);
        }
        this.title = title;
        this.textContent = textContent;
        this.htmlContent = htmlContent;
    }

    /**
     * Records the fan-out size and opens the issue for delivery.
     *
     * <p>An issue without recipients has nothing to wait for and completes immediately.</p>
     *
     * @param requiredTasks number of delivery tasks created for this issue
     * @throws AlreadyPublishedException if the issue already has a status
     */
    public void publish(int requiredTasks) {
        if (isPublished()) {
            throw new AlreadyPublishedException(id, status);
        }
        if (requiredTasks < 0) {
            throw new IllegalArgumentException("requiredTasks must be >= 0");
        }
        this.requiredTasks = requiredTasks;
        this.finishedTasks = 0;
        this.status = requiredTasks == 0 ? IssueStatus.COMPLETED : IssueStatus.AVAILABLE;
    }

    /**
     * Counts one resolved (delivered or dropped) task.
     *
     * <p>Must be called with the row locked, right after the task row was deleted.</p>
     *
     * @return true if this call moved the issue to {@link IssueStatus#COMPLETED}
     */
    public boolean recordResolvedTask() {
        if (status != IssueStatus.AVAILABLE && status != IssueStatus.IN_PROCESS) {
            throw new IllegalStateException("Newsletter issue " + id + " does not accept task updates (status=" + status + ")");
        }
        if (finishedTasks >= requiredTasks) {
            throw new IllegalStateException("Newsletter issue " + id + " already counted " + finishedTasks
                    + " of " + requiredTasks + " tasks");
        }
        finishedTasks++;
        if (finishedTasks == requiredTasks) {
            status = IssueStatus.COMPLETED;
            return true;
        }
        return false;
    }

    public boolean isPublished() {
        return status != null;
    }

    public boolean isCompleted() {
        return status == IssueStatus.COMPLETED;
    }
}
