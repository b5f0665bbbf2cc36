package io.partiscan.scan;

import java.io.IOException;

/**
 * Bounded count query against the inventory feed.
 */
@FunctionalInterface
public interface RangeCounter {
    /**
     * Number of records whose value falls in {@code [minInclusive, maxExclusive)}.
     */
    long count(long minInclusive, long maxExclusive) throws IOException;
}
