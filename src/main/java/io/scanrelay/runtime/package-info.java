/**
 * Runtime orchestration package.
 *
 * <p>{@link io.scanrelay.runtime.JobQueueManager} is the producer side,
 * {@link io.scanrelay.runtime.WorkerPool} and {@link io.scanrelay.runtime.JobWorker}
 * the consumer side. {@link io.scanrelay.runtime.ScanRelayRuntime} wires both
 * to the stores for the CLI.
 */
package io.scanrelay.runtime;
