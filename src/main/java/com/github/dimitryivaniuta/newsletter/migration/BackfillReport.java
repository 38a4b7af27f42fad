package com.github.dimitryivaniuta.newsletter.migration;

/**
 * Row counts touched by each back-fill step.
 *
 * @param markedInProcess legacy issues moved to {@code IN_PROCESS}
 * @param markedCompleted legacy issues closed as {@code COMPLETED} with empty counters
 * @param reopened in-flight issues reset to {@code AVAILABLE} with counters rebuilt from the queue
 * @param closedDrained in-flight issues with nothing left in the queue, closed as {@code COMPLETED}
 */
public record BackfillReport(int markedInProcess, int markedCompleted, int reopened, int closedDrained) {

    public int total() {
        return markedInProcess + markedCompleted + reopened + closedDrained;
    }
}
