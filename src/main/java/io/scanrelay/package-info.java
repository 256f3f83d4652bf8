/**
 * ScanRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.scanrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.scanrelay.cli.ScanRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.scanrelay.runtime.ScanRelayRuntime} wires the queue, worker pool and classifier.</li>
 *   <li>{@code io.scanrelay.storage.JobStore} is the authoritative job persistence layer.</li>
 * </ul>
 */
package io.scanrelay;
