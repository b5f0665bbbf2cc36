package io.partiscan.worker;

import io.partiscan.model.WorkItem;

/**
 * Result of processing one delivered work item.
 *
 * @param pageSize     records fetched, 0 when the item was skipped before fetching
 * @param continuation next item to enqueue, present only for {@link Status#ADVANCED}
 */
public record PageOutcome(Status status, WorkItem item, int pageSize, long storedOffset, WorkItem continuation) {

    public enum Status {
        ADVANCED,
        COMPLETED,
        SKIPPED_COMPLETED,
        SKIPPED_STALE,
        LOST_RACE
    }

    public static PageOutcome skipped(Status status, WorkItem item, long storedOffset) {
        return new PageOutcome(status, item, 0, storedOffset, null);
    }

    public boolean hasContinuation() {
        return continuation != null;
    }
}
