/**
 * SwarmMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.swarmmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.swarmmesh.cli.SwarmMeshCommand} maps commands to coordinator APIs.</li>
 *   <li>{@code io.swarmmesh.runtime.SwarmCoordinator} owns sessions, consensus requests and topology switches.</li>
 *   <li>{@code io.swarmmesh.storage.SwarmStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.swarmmesh;
