package com.tickq.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

public class TickQPropertiesTest {

    @EnableConfigurationProperties(TickQProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(Config.class);

    @Test
    void shouldMapDefaultTickqProperties() {
        contextRunner.run(context -> {
            TickQProperties properties = context.getBean(TickQProperties.class);
            assertTrue(properties.getScheduler().isEnabled());
            assertEquals(TickQProperties.StartMode.IMMEDIATE, properties.getScheduler().getStartMode());
            assertTrue(properties.getScheduler().isAutoStartup());
            assertTrue(properties.getSeeding().isAutomatic());
            assertTrue(properties.getScheduler().getMaxConcurrency() >= 1);
            assertNotNull(properties.getScheduler().getNodeIdentifier());
            assertEquals(Duration.ofMinutes(1), properties.getScheduler().getIdleWorkerTimeout());
            assertEquals(Duration.ofSeconds(30), properties.getScheduler().getFallbackInterval());
            assertEquals(ZoneId.systemDefault(), properties.getScheduler().resolveZone());
            assertEquals(Duration.ofSeconds(30), properties.getJobs().getDefaultRetryInterval());
            assertFalse(properties.getJobs().isCompressPayloads());
            assertFalse(properties.getCoordination().isRedisEnabled());
            assertEquals(Duration.ofMinutes(1), properties.getCoordination().getHeartbeatInterval());
            assertEquals(Duration.ofSeconds(80), properties.getCoordination().getHeartbeatTtl());
            assertEquals("tickq", properties.getCoordination().getKeyPrefix());
            assertEquals(Duration.ofHours(1), properties.getCoordination().getNodeRegistryTtl());
        });
    }

    @Test
    void shouldMapCustomTickqProperties() {
        contextRunner
                .withPropertyValues(
                        "tickq.scheduler.enabled=false",
                        "tickq.scheduler.start-mode=manual",
                        "tickq.seeding.automatic=false",
                        "tickq.scheduler.max-concurrency=8",
                        "tickq.scheduler.node-identifier=node-a",
                        "tickq.scheduler.idle-worker-timeout=10s",
                        "tickq.scheduler.fallback-interval=2s",
                        "tickq.scheduler.time-zone=UTC",
                        "tickq.jobs.default-retry-interval=5s",
                        "tickq.jobs.compress-payloads=true",
                        "tickq.coordination.redis-enabled=true",
                        "tickq.coordination.heartbeat-interval=15s",
                        "tickq.coordination.key-prefix=orders",
                        "tickq.coordination.node-registry-ttl=30m")
                .run(context -> {
                    TickQProperties properties = context.getBean(TickQProperties.class);
                    assertFalse(properties.getScheduler().isEnabled());
                    assertEquals(TickQProperties.StartMode.MANUAL, properties.getScheduler().getStartMode());
                    assertFalse(properties.getScheduler().isAutoStartup());
                    assertFalse(properties.getSeeding().isAutomatic());
                    assertEquals(8, properties.getScheduler().getMaxConcurrency());
                    assertEquals("node-a", properties.getScheduler().getNodeIdentifier());
                    assertEquals(Duration.ofSeconds(10), properties.getScheduler().getIdleWorkerTimeout());
                    assertEquals(Duration.ofSeconds(2), properties.getScheduler().getFallbackInterval());
                    assertEquals(ZoneId.of("UTC"), properties.getScheduler().resolveZone());
                    assertEquals(Duration.ofSeconds(5), properties.getJobs().getDefaultRetryInterval());
                    assertTrue(properties.getJobs().isCompressPayloads());
                    assertTrue(properties.getCoordination().isRedisEnabled());
                    assertEquals(Duration.ofSeconds(35), properties.getCoordination().getHeartbeatTtl());
                    assertEquals("orders", properties.getCoordination().getKeyPrefix());
                    assertEquals(Duration.ofMinutes(30), properties.getCoordination().getNodeRegistryTtl());
                });
    }

    @Test
    void shouldClampMaxConcurrency() {
        contextRunner.withPropertyValues("tickq.scheduler.max-concurrency=500").run(context -> assertEquals(
                TickQProperties.MAX_CONCURRENCY_LIMIT,
                context.getBean(TickQProperties.class).getScheduler().getMaxConcurrency()));

        contextRunner.withPropertyValues("tickq.scheduler.max-concurrency=0").run(context -> assertEquals(1,
                context.getBean(TickQProperties.class).getScheduler().getMaxConcurrency()));
    }
}
