package io.partiscan.progress;

/**
 * Raised when a progress row is read before {@code initialize} was ever called for its key.
 */
public final class PartitionNotFoundException extends RuntimeException {
    private final String runId;
    private final String partitionId;

    public PartitionNotFoundException(String runId, String partitionId) {
        super("Partition progress not found for runId=" + runId + ", partitionId=" + partitionId);
        this.runId = runId;
        this.partitionId = partitionId;
    }

    public String runId() {
        return runId;
    }

    public String partitionId() {
        return partitionId;
    }
}
