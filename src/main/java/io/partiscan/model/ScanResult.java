package io.partiscan.model;

import java.util.List;

public record ScanResult(
        long totalRecords,
        int workerCount,
        ScanStats stats,
        List<DensityChunk> densityMap,
        List<Partition> partitions
) {
    public ScanResult {
        densityMap = densityMap == null ? List.of() : List.copyOf(densityMap);
        partitions = partitions == null ? List.of() : List.copyOf(partitions);
    }
}
