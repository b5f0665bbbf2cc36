package io.partiscan.model;

public record Partition(
        String partitionId,
        long minValue,
        long maxValue,
        long totalRecords
) {
    public static String idFor(int index) {
        return "partition-" + index;
    }
}
