package com.tickq.coordination;

import java.time.Duration;
import java.util.Set;

/**
 * Shared liveness registry. Each node only ever writes its own heartbeat.
 */
public interface CoordinationStore {

    /**
     * Writes the node's heartbeat with the given time-to-live and refreshes its registry entry.
     */
    void heartbeat(String nodeId, Duration ttl);

    /**
     * Registered nodes with an unexpired heartbeat.
     */
    Set<String> listLiveNodes();

    /**
     * Registered nodes whose heartbeat has expired.
     */
    Set<String> listDeadNodes();

    /**
     * Whether the node currently has an unexpired heartbeat.
     */
    boolean isLive(String nodeId);

    /**
     * Drops a node from the registry once its resources were released.
     */
    void forget(String nodeId);

    /**
     * Removes this node's own heartbeat and registry entry on orderly shutdown.
     */
    void resign(String nodeId);
}
