package com.github.dimitryivaniuta.newsletter.domain;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class NewsletterIssueTest {

    @Test
    void draftHasNoStatus() {
        NewsletterIssue issue = newDraft();

        Assertions.assertFalse(issue.isPublished());
        Assertions.assertNull(issue.getStatus());
    }

    @Test
    void publishOpensIssueForDelivery() {
        NewsletterIssue issue = newDraft();

        issue.publish(2);

        Assertions.assertEquals(IssueStatus.AVAILABLE, issue.getStatus());
        Assertions.assertEquals(2, issue.getRequiredTasks());
        Assertions.assertEquals(0, issue.getFinishedTasks());
    }

    @Test
    void publishWithoutRecipientsCompletes() {
        NewsletterIssue issue = newDraft();

        issue.publish(0);

        Assertions.assertTrue(issue.isCompleted());
    }

    @Test
    void publishTwiceIsRejected() {
        NewsletterIssue issue = newDraft();
        issue.publish(1);

        AlreadyPublishedException ex = Assertions.assertThrows(AlreadyPublishedException.class, () -> issue.publish(1));
        Assertions.assertEquals(IssueStatus.AVAILABLE, ex.getStatus());
    }

    @Test
    void lastResolvedTaskCompletesIssue() {
        NewsletterIssue issue = newDraft();
        issue.publish(2);

        Assertions.assertFalse(issue.recordResolvedTask());
        Assertions.assertEquals(IssueStatus.AVAILABLE, issue.getStatus());
        Assertions.assertTrue(issue.recordResolvedTask());
        Assertions.assertEquals(IssueStatus.COMPLETED, issue.getStatus());
        Assertions.assertEquals(2, issue.getFinishedTasks());
    }

    @Test
    void completedIssueRejectsFurtherTasks() {
        NewsletterIssue issue = newDraft();
        issue.publish(1);
        issue.recordResolvedTask();

        Assertions.assertThrows(IllegalStateException.class, issue::recordResolvedTask);
        Assertions.assertEquals(1, issue.getFinishedTasks());
    }

    @Test
    void unpublishedIssueRejectsTaskUpdates() {
        Assertions.assertThrows(IllegalStateException.class, newDraft()::recordResolvedTask);
    }

    @Test
    void contentIsLockedOncePublished() {
        NewsletterIssue issue = newDraft();
        issue.reviseContent("Fixed title", "text", "<p>html</p>");
        Assertions.assertEquals("Fixed title", issue.getTitle());

        issue.publish(1);

        Assertions.assertThrows(IssueContentLockedException.class,
                () -> issue.reviseContent("Too late", "text", "<p>html</p>"));
    }

    private static NewsletterIssue newDraft() {
        return NewsletterIssue.draft(UUID.randomUUID(), "Weekly", "text", "<p>html</p>", Instant.now());
    }
}
