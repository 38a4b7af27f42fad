package com.github.dimitryivaniuta.newsletter.service;

/**
 * Result of one claim-send-acknowledge cycle.
 */
public enum ExecutionOutcome {
    /** Nothing was claimable. */
    EMPTY_QUEUE,

    /** Email sent, task deleted and counted. */
    DELIVERED,

    /** Transient failure; the task stays queued with a later {@code execute_after}. */
    RETRY_SCHEDULED,

    /** Permanent failure or retries exhausted; the task was deleted, counted and dead-lettered. */
    DROPPED
}
