package com.tickq.coordination;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local store for single node deployments and tests. Nodes are only visible within the JVM.
 */
public class InMemoryCoordinationStore implements CoordinationStore {

    private final Clock clock;
    private final Duration registryTtl;
    private final Map<String, Instant> heartbeatExpiry = new ConcurrentHashMap<>();
    private final Map<String, Instant> registryExpiry = new ConcurrentHashMap<>();

    public InMemoryCoordinationStore(Clock clock, Duration registryTtl) {
        this.clock = clock;
        this.registryTtl = registryTtl;
    }

    @Override
    public void heartbeat(String nodeId, Duration ttl) {
        Instant now = clock.instant();
        heartbeatExpiry.put(nodeId, now.plus(ttl));
        registryExpiry.put(nodeId, now.plus(registryTtl));
    }

    @Override
    public Set<String> listLiveNodes() {
        return registeredNodes().stream().filter(this::isLive).collect(Collectors.toSet());
    }

    @Override
    public Set<String> listDeadNodes() {
        return registeredNodes().stream().filter(nodeId -> !isLive(nodeId)).collect(Collectors.toSet());
    }

    @Override
    public boolean isLive(String nodeId) {
        Instant expiresAt = heartbeatExpiry.get(nodeId);
        return expiresAt != null && expiresAt.isAfter(clock.instant());
    }

    @Override
    public void forget(String nodeId) {
        registryExpiry.remove(nodeId);
    }

    @Override
    public void resign(String nodeId) {
        heartbeatExpiry.remove(nodeId);
        registryExpiry.remove(nodeId);
    }

    private Set<String> registeredNodes() {
        Instant now = clock.instant();
        registryExpiry.entrySet().removeIf(entry -> !entry.getValue().isAfter(now));
        return Set.copyOf(registryExpiry.keySet());
    }
}
