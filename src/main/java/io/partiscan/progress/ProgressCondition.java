package io.partiscan.progress;

import io.partiscan.model.PartitionProgress;

import java.util.function.Predicate;

/**
 * The state a caller believes is stored. A conditional update applies only when
 * the stored row matches it exactly.
 */
public record ProgressCondition(long expectedOffset, boolean expectedCompleted) implements Predicate<PartitionProgress> {

    public static ProgressCondition activeAt(long expectedOffset) {
        return new ProgressCondition(expectedOffset, false);
    }

    @Override
    public boolean test(PartitionProgress progress) {
        return progress != null
                && progress.nextOffset() == expectedOffset
                && progress.completed() == expectedCompleted;
    }
}
