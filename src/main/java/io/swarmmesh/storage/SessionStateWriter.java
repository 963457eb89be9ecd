package io.swarmmesh.storage;

import io.swarmmesh.config.SwarmMeshConfig;
import io.swarmmesh.error.StateStoreException;
import io.swarmmesh.model.AgentView;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.SessionStatus;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the per-session JSON snapshot under {@code sessions/}.
 *
 * <p>The file is written next to its target and renamed over it, so readers see either the old or the new
 * snapshot.
 */
public final class SessionStateWriter {
    private final SwarmMeshConfig config;

    public SessionStateWriter(SwarmMeshConfig config) {
        this.config = config;
    }

    public Path write(
            String sessionId,
            TopologyKind topology,
            ConsensusAlgorithm algorithm,
            SessionStatus status,
            List<AgentView> agents
    ) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("session_id", sessionId);
        doc.put("topology", topology.wireName());
        doc.put("consensus_algorithm", algorithm.wireName());
        doc.put("status", status.name());
        List<Map<String, Object>> agentRows = new ArrayList<>(agents.size());
        for (AgentView a : agents) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", a.agentId());
            row.put("state", a.state().name());
            agentRows.add(row);
        }
        doc.put("agents", agentRows);

        Path target = config.sessionStateFile(sessionId);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(tmp, Jsons.toJson(doc), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return target;
        } catch (IOException e) {
            throw new StateStoreException("Failed to write session state file " + target, e);
        }
    }

    public Map<String, Object> read(String sessionId) {
        Path file = config.sessionStateFile(sessionId);
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> doc = Jsons.mapper().readValue(file.toFile(), Map.class);
            return doc;
        } catch (IOException e) {
            throw new StateStoreException("Failed to read session state file " + file, e);
        }
    }
}
