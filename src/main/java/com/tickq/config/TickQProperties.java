package com.tickq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "tickq")
public class TickQProperties {

    static final int MAX_CONCURRENCY_LIMIT = 64;

    private final Scheduler scheduler = new Scheduler();
    private final Jobs jobs = new Jobs();
    private final Coordination coordination = new Coordination();
    private final Seeding seeding = new Seeding();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Coordination getCoordination() {
        return coordination;
    }

    public Seeding getSeeding() {
        return seeding;
    }

    /**
     * {@code IMMEDIATE} starts background processing with the application context; {@code MANUAL} waits
     * for {@code TickQScheduler.start()}.
     */
    public enum StartMode {
        IMMEDIATE,
        MANUAL
    }

    public static class Scheduler {
        private boolean enabled = true;
        private StartMode startMode = StartMode.IMMEDIATE;
        private int maxConcurrency = Runtime.getRuntime().availableProcessors();
        private String nodeIdentifier = defaultNodeIdentifier();
        private Duration idleWorkerTimeout = Duration.ofMinutes(1);
        private Duration fallbackInterval = Duration.ofSeconds(30);
        private String timeZone;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public StartMode getStartMode() {
            return startMode;
        }

        public void setStartMode(StartMode startMode) {
            this.startMode = startMode;
        }

        public boolean isAutoStartup() {
            return startMode != StartMode.MANUAL;
        }

        /**
         * Configured value clamped to [1, 64].
         */
        public int getMaxConcurrency() {
            return Math.max(1, Math.min(MAX_CONCURRENCY_LIMIT, maxConcurrency));
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public String getNodeIdentifier() {
            return nodeIdentifier;
        }

        public void setNodeIdentifier(String nodeIdentifier) {
            this.nodeIdentifier = nodeIdentifier;
        }

        public Duration getIdleWorkerTimeout() {
            return idleWorkerTimeout;
        }

        public void setIdleWorkerTimeout(Duration idleWorkerTimeout) {
            this.idleWorkerTimeout = idleWorkerTimeout;
        }

        public Duration getFallbackInterval() {
            return fallbackInterval;
        }

        public void setFallbackInterval(Duration fallbackInterval) {
            this.fallbackInterval = fallbackInterval;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }

        /**
         * Zone used for cron evaluation; the system default when not configured.
         */
        public ZoneId resolveZone() {
            if (timeZone == null || timeZone.isBlank()) {
                return ZoneId.systemDefault();
            }
            return ZoneId.of(timeZone.trim());
        }

        private static String defaultNodeIdentifier() {
            try {
                return InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                String fromEnv = System.getenv("HOSTNAME");
                return fromEnv == null || fromEnv.isBlank() ? "tickq-node" : fromEnv;
            }
        }
    }

    public static class Jobs {
        private Duration defaultRetryInterval = Duration.ofSeconds(30);
        private boolean compressPayloads = false;

        public Duration getDefaultRetryInterval() {
            return defaultRetryInterval;
        }

        public void setDefaultRetryInterval(Duration defaultRetryInterval) {
            this.defaultRetryInterval = defaultRetryInterval;
        }

        public boolean isCompressPayloads() {
            return compressPayloads;
        }

        public void setCompressPayloads(boolean compressPayloads) {
            this.compressPayloads = compressPayloads;
        }
    }

    public static class Coordination {
        /**
         * Grace period added to the heartbeat interval to form the heartbeat TTL.
         */
        public static final Duration HEARTBEAT_GRACE = Duration.ofSeconds(20);

        private boolean redisEnabled = false;
        private Duration heartbeatInterval = Duration.ofMinutes(1);
        private String keyPrefix = "tickq";
        private Duration nodeRegistryTtl = Duration.ofHours(1);

        public boolean isRedisEnabled() {
            return redisEnabled;
        }

        public void setRedisEnabled(boolean redisEnabled) {
            this.redisEnabled = redisEnabled;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getHeartbeatTtl() {
            return heartbeatInterval.plus(HEARTBEAT_GRACE);
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getNodeRegistryTtl() {
            return nodeRegistryTtl;
        }

        public void setNodeRegistryTtl(Duration nodeRegistryTtl) {
            this.nodeRegistryTtl = nodeRegistryTtl;
        }
    }

    public static class Seeding {
        /**
         * Whether cron jobs declared on {@code @TickerFunction(cron = ...)} are upserted on startup.
         */
        private boolean automatic = true;

        public boolean isAutomatic() {
            return automatic;
        }

        public void setAutomatic(boolean automatic) {
            this.automatic = automatic;
        }
    }
}
