package com.tickq.coordination;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Redis backed liveness registry.
 * <ul>
 * <li>{@code <prefix>:heartbeat:<node>}: string with the last heartbeat instant, expires after the TTL</li>
 * <li>{@code <prefix>:nodes}: set of known node ids, expiration refreshed on every heartbeat</li>
 * </ul>
 */
public class RedisCoordinationStore implements CoordinationStore {

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration registryTtl;

    public RedisCoordinationStore(StringRedisTemplate redisTemplate, Clock clock, String keyPrefix,
            Duration registryTtl) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "tickq" : keyPrefix.trim();
        this.registryTtl = registryTtl;
    }

    @Override
    public void heartbeat(String nodeId, Duration ttl) {
        redisTemplate.opsForValue().set(heartbeatKey(nodeId), clock.instant().toString(), ttl);
        redisTemplate.opsForSet().add(registryKey(), nodeId);
        redisTemplate.expire(registryKey(), registryTtl);
    }

    @Override
    public Set<String> listLiveNodes() {
        Set<String> live = new HashSet<>();
        for (String nodeId : registeredNodes()) {
            if (isLive(nodeId)) {
                live.add(nodeId);
            }
        }
        return live;
    }

    @Override
    public Set<String> listDeadNodes() {
        Set<String> dead = new HashSet<>();
        for (String nodeId : registeredNodes()) {
            if (!isLive(nodeId)) {
                dead.add(nodeId);
            }
        }
        return dead;
    }

    @Override
    public boolean isLive(String nodeId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(heartbeatKey(nodeId)));
    }

    @Override
    public void forget(String nodeId) {
        redisTemplate.opsForSet().remove(registryKey(), nodeId);
    }

    @Override
    public void resign(String nodeId) {
        redisTemplate.delete(heartbeatKey(nodeId));
        redisTemplate.opsForSet().remove(registryKey(), nodeId);
    }

    String heartbeatKey(String nodeId) {
        return keyPrefix + ":heartbeat:" + nodeId;
    }

    String registryKey() {
        return keyPrefix + ":nodes";
    }

    private Set<String> registeredNodes() {
        Set<String> members = redisTemplate.opsForSet().members(registryKey());
        return members == null ? Set.of() : members;
    }
}
