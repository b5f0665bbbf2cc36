/**
 * Runtime orchestration package.
 *
 * <p>{@link io.partiscan.runtime.PartiscanRuntime} owns the scan-plan-record flow,
 * work item planning and the progress operations used by the CLI.
 */
package io.partiscan.runtime;
