/**
 * Partiscan source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.partiscan.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.partiscan.scan.DensityScanner} builds the density map from count probes.</li>
 *   <li>{@code io.partiscan.plan.PartitionPlanner} cuts the map into balanced partitions.</li>
 *   <li>{@code io.partiscan.progress.PartitionProgressTracker} guards per-partition offsets with compare-and-set.</li>
 *   <li>{@code io.partiscan.runtime.PartiscanRuntime} wires storage, settings and audit around them.</li>
 * </ul>
 */
package io.partiscan;
