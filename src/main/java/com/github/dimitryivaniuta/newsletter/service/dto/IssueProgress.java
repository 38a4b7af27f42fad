package com.github.dimitryivaniuta.newsletter.service.dto;

import com.github.dimitryivaniuta.newsletter.domain.IssueStatus;
import java.util.UUID;

/**
 * Read-only delivery progress of an issue.
 *
 * @param issueId issue id
 * @param requiredTasks tasks created at publish time
 * @param finishedTasks tasks resolved so far
 * @param remainingTasks tasks still queued
 * @param status issue status, null while unpublished
 */
public record IssueProgress(UUID issueId, int requiredTasks, int finishedTasks, long remainingTasks, IssueStatus status) {}
