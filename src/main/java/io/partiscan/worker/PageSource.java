package io.partiscan.worker;

import io.partiscan.model.WorkItem;

import java.io.IOException;

/**
 * Fetches one page of a partition and hands its records to the caller's sink.
 */
@FunctionalInterface
public interface PageSource {
    /**
     * @return number of records in the page, at most {@code limit}
     */
    int fetch(WorkItem item, long offset, int limit) throws IOException;
}
