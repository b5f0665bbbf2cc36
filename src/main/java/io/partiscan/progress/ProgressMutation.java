package io.partiscan.progress;

import io.partiscan.model.PartitionProgress;

public record ProgressMutation(long nextOffset, boolean completed) {

    public static ProgressMutation advanceTo(long nextOffset) {
        return new ProgressMutation(nextOffset, false);
    }

    public static ProgressMutation completeAt(long finalOffset) {
        return new ProgressMutation(finalOffset, true);
    }

    public PartitionProgress applyTo(PartitionProgress current, long nowMs) {
        return completed
                ? current.markCompleted(nextOffset, nowMs)
                : current.withOffset(nextOffset, nowMs);
    }
}
