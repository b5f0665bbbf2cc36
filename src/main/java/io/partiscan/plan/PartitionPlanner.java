package io.partiscan.plan;

import io.partiscan.model.DensityChunk;
import io.partiscan.model.Partition;
import io.partiscan.model.ScanConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a density map into contiguous partitions of roughly equal record counts.
 *
 * <p>Boundaries always fall on chunk edges. Partitions are closed greedily once their
 * running total reaches {@code ceil(total / workers)}; the last one absorbs the remainder.
 */
public final class PartitionPlanner {

    /**
     * Plans with the config's worker settings. An empty map plans the config's whole range as one empty partition.
     */
    public PartitionPlan plan(List<DensityChunk> densityMap, ScanConfig config) {
        if (densityMap == null || densityMap.isEmpty()) {
            Partition only = new Partition(Partition.idFor(0), config.minValue(), config.maxValue(), 0L);
            return new PartitionPlan(List.of(only), 0L, 0L, false, 0L, 1);
        }
        return plan(densityMap, config.maxWorkers(), config.minRecordsPerWorker(), config.maxTotalRecords());
    }

    public PartitionPlan plan(List<DensityChunk> densityMap, int maxWorkers) {
        return plan(densityMap, maxWorkers, 1L, 0L);
    }

    public PartitionPlan plan(List<DensityChunk> densityMap, int maxWorkers, long minRecordsPerWorker, long maxTotalRecords) {
        if (densityMap == null || densityMap.isEmpty()) {
            throw new IllegalArgumentException("density map must not be empty");
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        }
        long total = requireContiguous(densityMap);
        DensityChunk first = densityMap.get(0);
        DensityChunk last = densityMap.get(densityMap.size() - 1);

        if (total == 0L) {
            Partition only = new Partition(Partition.idFor(0), first.minValue(), last.maxValue(), 0L);
            return new PartitionPlan(List.of(only), 0L, 0L, false, 0L, 1);
        }

        boolean capActive = maxTotalRecords > 0L && total > maxTotalRecords;
        long effectiveTotal = capActive ? maxTotalRecords : total;
        int desired = workerCount(effectiveTotal, maxWorkers, minRecordsPerWorker);
        long target = ceilDiv(effectiveTotal, desired);

        List<Partition> partitions = new ArrayList<>();
        long start = first.minValue();
        long running = 0L;
        long cumulative = 0L;
        for (int i = 0; i < densityMap.size(); i++) {
            DensityChunk chunk = densityMap.get(i);
            long count = chunk.count();
            if (capActive && cumulative + count >= maxTotalRecords) {
                running += maxTotalRecords - cumulative;
                cumulative = maxTotalRecords;
                close(partitions, start, chunk.maxValue(), running);
                break;
            }
            running += count;
            cumulative += count;

            boolean isLast = i == densityMap.size() - 1;
            boolean hitTarget = running >= target;
            boolean moreAvailable = partitions.size() < desired - 1;
            if ((hitTarget && moreAvailable) || isLast) {
                close(partitions, start, chunk.maxValue(), running);
                start = chunk.maxValue();
                running = 0L;
            }
        }
        return new PartitionPlan(partitions, cumulative, total, capActive, target, desired);
    }

    /**
     * Number of partitions worth creating for {@code totalRecords}: one per
     * {@code minRecordsPerWorker} records, at least one, at most {@code maxWorkers}.
     */
    public static int workerCount(long totalRecords, int maxWorkers, long minRecordsPerWorker) {
        if (totalRecords <= 0L) {
            return 0;
        }
        long needed = ceilDiv(totalRecords, Math.max(1L, minRecordsPerWorker));
        return (int) Math.max(1L, Math.min(needed, maxWorkers));
    }

    private static void close(List<Partition> partitions, long start, long end, long records) {
        if (records == 0L && !partitions.isEmpty()) {
            // Trailing empty chunks belong to the previous partition.
            Partition previous = partitions.remove(partitions.size() - 1);
            partitions.add(new Partition(previous.partitionId(), previous.minValue(), end, previous.totalRecords()));
            return;
        }
        partitions.add(new Partition(Partition.idFor(partitions.size()), start, end, records));
    }

    private static long requireContiguous(List<DensityChunk> densityMap) {
        long total = 0L;
        DensityChunk previous = null;
        for (DensityChunk chunk : densityMap) {
            if (previous != null && chunk.minValue() != previous.maxValue()) {
                throw new IllegalArgumentException(
                        "density map is not contiguous at " + previous.maxValue() + " -> " + chunk.minValue()
                );
            }
            total += chunk.count();
            previous = chunk;
        }
        return total;
    }

    static long ceilDiv(long dividend, long divisor) {
        long quotient = dividend / divisor;
        return dividend % divisor == 0L ? quotient : quotient + 1L;
    }
}
