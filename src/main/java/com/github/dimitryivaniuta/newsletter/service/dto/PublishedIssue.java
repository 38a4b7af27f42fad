package com.github.dimitryivaniuta.newsletter.service.dto;

import com.github.dimitryivaniuta.newsletter.domain.IssueStatus;
import java.util.UUID;

/**
 * Result of a successful publish.
 *
 * @param issueId issue id
 * @param requiredTasks number of delivery tasks queued
 * @param status status right after publishing
 */
public record PublishedIssue(UUID issueId, int requiredTasks, IssueStatus status) {}
