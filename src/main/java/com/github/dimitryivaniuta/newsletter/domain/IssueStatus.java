package com.github.dimitryivaniuta.newsletter.domain;

/**
 * Delivery lifecycle of a published newsletter issue.
 *
 * <p>Stored as a VARCHAR; a {@code NULL} status means the issue has not been published yet.
 * A steady-state issue goes {@code AVAILABLE -> COMPLETED}.</p>
 */
public enum IssueStatus {
    /** Published; delivery tasks are queued and being drained. */
    AVAILABLE,

    /** Only assigned by the legacy back-fill to issues that predate the task counters. */
    IN_PROCESS,

    /** Every delivery task was resolved. Terminal. */
    COMPLETED
}
