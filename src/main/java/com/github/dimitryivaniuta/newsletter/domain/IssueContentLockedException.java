package com.github.dimitryivaniuta.newsletter.domain;

import java.util.UUID;

/**
 * Raised when the content of a published issue is about to be changed.
 */
public class IssueContentLockedException extends RuntimeException {

    public IssueContentLockedException(UUID issueId) {
        super("Content of newsletter issue " + issueId + " cannot change once it is published");
    }
}
