package com.github.dimitryivaniuta.newsletter.domain;

import java.util.UUID;
import lombok.Getter;

/**
 * Raised when an issue that already has a delivery status is published again.
 */
@Getter
public class AlreadyPublishedException extends RuntimeException {

    private final UUID issueId;
    private final IssueStatus status;

    public AlreadyPublishedException(UUID issueId, IssueStatus status) {
        super("Newsletter issue " + issueId + " is already published (status=" + status + ")");
        this.issueId = issueId;
        this.status = status;
    }
}
