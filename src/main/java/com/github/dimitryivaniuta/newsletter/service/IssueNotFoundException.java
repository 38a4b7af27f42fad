package com.github.dimitryivaniuta.newsletter.service;

import java.util.UUID;

public class IssueNotFoundException extends RuntimeException {

    public IssueNotFoundException(UUID issueId) {
        super("Newsletter issue " + issueId + " not found");
    }
}
