/**
 * Per-partition progress guarded by compare-and-set on the stored offset.
 */
package io.partiscan.progress;
