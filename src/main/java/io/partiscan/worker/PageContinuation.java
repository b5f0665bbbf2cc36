package io.partiscan.worker;

import io.partiscan.model.PartitionProgress;
import io.partiscan.model.WorkItem;
import io.partiscan.progress.PartitionProgressTracker;

import java.io.IOException;

/**
 * Processes a work item delivered at least once. Duplicates and out-of-order
 * deliveries are skipped before fetching, and every page is acknowledged through
 * the tracker before its continuation is handed back.
 */
public final class PageContinuation {
    private final PartitionProgressTracker tracker;

    public PageContinuation(PartitionProgressTracker tracker) {
        this.tracker = tracker;
    }

    public PageOutcome process(WorkItem item, PageSource source) throws IOException {
        tracker.initialize(item.runId(), item.partitionId());
        PartitionProgress progress = tracker.get(item.runId(), item.partitionId());
        if (progress.completed()) {
            return PageOutcome.skipped(PageOutcome.Status.SKIPPED_COMPLETED, item, progress.nextOffset());
        }
        if (item.offset() != progress.nextOffset()) {
            return PageOutcome.skipped(PageOutcome.Status.SKIPPED_STALE, item, progress.nextOffset());
        }

        long offset = item.offset();
        int size = source.fetch(item, offset, item.limit());
        if (size < 0 || size > item.limit()) {
            throw new IllegalStateException(
                    "page source returned " + size + " records for limit " + item.limit()
            );
        }

        if (size == item.limit()) {
            long next = offset + size;
            if (!tracker.advance(item.runId(), item.partitionId(), offset, next)) {
                return new PageOutcome(PageOutcome.Status.LOST_RACE, item, size, offset, null);
            }
            return new PageOutcome(PageOutcome.Status.ADVANCED, item, size, next, item.continueAt(next));
        }

        // Empty or partial page: the partition is exhausted.
        long finalOffset = offset + size;
        if (!tracker.complete(item.runId(), item.partitionId(), offset, finalOffset)) {
            return new PageOutcome(PageOutcome.Status.LOST_RACE, item, size, offset, null);
        }
        return new PageOutcome(PageOutcome.Status.COMPLETED, item, size, finalOffset, null);
    }
}
