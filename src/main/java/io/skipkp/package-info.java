/**
 * SKIP key provider source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.skipkp.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.skipkp.cli.KeyProviderCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.skipkp.runtime.KeyProviderRuntime} wires storage, key lifecycle and peer sync.</li>
 *   <li>{@code io.skipkp.http.ProtocolHandler} serves the key provider endpoints.</li>
 *   <li>{@code io.skipkp.storage.SqliteKeyRecordRepository} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.skipkp;
