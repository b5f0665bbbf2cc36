package io.partiscan.worker;

import io.partiscan.model.Partition;
import io.partiscan.model.WorkItem;
import io.partiscan.progress.InMemoryProgressStore;
import io.partiscan.progress.PartitionProgressTracker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class PageContinuationTest {
    private static final Partition PARTITION = new Partition("partition-0", 0L, 5_000L, 70L);

    private final PartitionProgressTracker tracker = new PartitionProgressTracker(new InMemoryProgressStore());
    private final PageContinuation continuation = new PageContinuation(tracker);

    private static PageSource recordsUpTo(long total, List<Long> fetchedOffsets) {
        return (item, offset, limit) -> {
            fetchedOffsets.add(offset);
            return (int) Math.max(0L, Math.min(limit, total - offset));
        };
    }

    @Test
    void walksPartitionPageByPageUntilExhausted() throws Exception {
        List<Long> fetched = new ArrayList<>();
        PageSource source = recordsUpTo(70L, fetched);

        PageOutcome first = continuation.process(WorkItem.first("run-1", PARTITION, 30), source);
        Assertions.assertEquals(PageOutcome.Status.ADVANCED, first.status());
        Assertions.assertEquals(30L, first.continuation().offset());

        PageOutcome second = continuation.process(first.continuation(), source);
        Assertions.assertEquals(PageOutcome.Status.ADVANCED, second.status());
        Assertions.assertEquals(60L, second.storedOffset());

        PageOutcome last = continuation.process(second.continuation(), source);
        Assertions.assertEquals(PageOutcome.Status.COMPLETED, last.status());
        Assertions.assertEquals(10, last.pageSize());
        Assertions.assertFalse(last.hasContinuation());

        Assertions.assertEquals(List.of(0L, 30L, 60L), fetched);
        Assertions.assertTrue(tracker.isCompleted("run-1", "partition-0"));
        Assertions.assertEquals(70L, tracker.get("run-1", "partition-0").nextOffset());
    }

    @Test
    void duplicateAndLateDeliveriesAreSkippedWithoutFetching() throws Exception {
        List<Long> fetched = new ArrayList<>();
        PageSource source = recordsUpTo(70L, fetched);
        WorkItem first = WorkItem.first("run-1", PARTITION, 30);

        PageOutcome advanced = continuation.process(first, source);
        PageOutcome duplicate = continuation.process(first, source);
        Assertions.assertEquals(PageOutcome.Status.SKIPPED_STALE, duplicate.status());
        Assertions.assertEquals(30L, duplicate.storedOffset());

        PageOutcome ahead = continuation.process(first.continueAt(60L), source);
        Assertions.assertEquals(PageOutcome.Status.SKIPPED_STALE, ahead.status());

        PageOutcome next = continuation.process(advanced.continuation(), source);
        continuation.process(next.continuation(), source);
        PageOutcome afterCompletion = continuation.process(next.continuation(), source);
        Assertions.assertEquals(PageOutcome.Status.SKIPPED_COMPLETED, afterCompletion.status());

        Assertions.assertEquals(List.of(0L, 30L, 60L), fetched);
    }

    @Test
    void emptyFirstPageCompletesAtZero() throws Exception {
        PageOutcome outcome = continuation.process(WorkItem.first("run-1", PARTITION, 30), (item, offset, limit) -> 0);

        Assertions.assertEquals(PageOutcome.Status.COMPLETED, outcome.status());
        Assertions.assertEquals(0L, outcome.storedOffset());
        Assertions.assertTrue(tracker.isCompleted("run-1", "partition-0"));
    }

    @Test
    void concurrentDeliveryThatWinsFirstMakesThisOneLoseTheRace() throws Exception {
        PageSource racing = (item, offset, limit) -> {
            Assertions.assertTrue(tracker.advance(item.runId(), item.partitionId(), offset, offset + limit));
            return limit;
        };

        PageOutcome outcome = continuation.process(WorkItem.first("run-1", PARTITION, 30), racing);

        Assertions.assertEquals(PageOutcome.Status.LOST_RACE, outcome.status());
        Assertions.assertFalse(outcome.hasContinuation());
        Assertions.assertEquals(30L, tracker.get("run-1", "partition-0").nextOffset());
    }

    @Test
    void oversizedPageIsRejected() {
        Assertions.assertThrows(IllegalStateException.class,
                () -> continuation.process(WorkItem.first("run-1", PARTITION, 30), (item, offset, limit) -> limit + 1));
    }
}
