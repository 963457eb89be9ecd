package io.swarmmesh.runtime;

import io.swarmmesh.config.EngineSettings;
import io.swarmmesh.consensus.ConsensusEngine;
import io.swarmmesh.observability.AuditLogger;
import io.swarmmesh.storage.SessionStateWriter;
import io.swarmmesh.storage.SwarmStore;
import io.swarmmesh.topology.TopologyManager;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Collaborators shared by every session of one coordinator.
 */
record EngineServices(
        EngineSettings settings,
        SwarmStore store,
        TopologyManager topology,
        ConsensusEngine consensus,
        SessionStateWriter stateWriter,
        AuditLogger audit,
        SwarmEventListener listener,
        ExecutorService probePool,
        Clock clock
) {
}
