/**
 * Session orchestration package.
 *
 * <p>{@link io.swarmmesh.runtime.SwarmCoordinator} is the public face of the engine. Every session runs its
 * health, metrics and healing loop on its own worker thread ({@code SessionWorker}).
 */
package io.swarmmesh.runtime;
