package com.tickq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tickq.config.TickQProperties;
import com.tickq.coordination.CoordinationStore;
import com.tickq.coordination.InMemoryCoordinationStore;
import com.tickq.coordination.RedisCoordinationStore;
import com.tickq.internal.LoggingJobExceptionHandler;
import com.tickq.internal.TickQMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@AutoConfiguration(before = { HibernateJpaAutoConfiguration.class, JpaRepositoriesAutoConfiguration.class })
@AutoConfigurationPackage(basePackages = "com.tickq")
@ComponentScan("com.tickq")
@EnableConfigurationProperties(TickQProperties.class)
public class TickQAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TickQAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(name = "tickqObjectMapper")
    public ObjectMapper tickqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(name = "tickqClock")
    public Clock tickqClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(JobExceptionHandler.class)
    public JobExceptionHandler tickqJobExceptionHandler() {
        return new LoggingJobExceptionHandler();
    }

    @Bean
    @ConditionalOnMissingBean(CoordinationStore.class)
    public CoordinationStore tickqCoordinationStore(
            TickQProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplate,
            @Qualifier("tickqClock") Clock clock) {
        TickQProperties.Coordination coordination = properties.getCoordination();
        if (coordination.isRedisEnabled()) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException(
                        "tickq.coordination.redis-enabled=true but no StringRedisTemplate bean is available");
            }
            log.info("Using Redis coordination store with key prefix '{}'", coordination.getKeyPrefix());
            return new RedisCoordinationStore(template, clock, coordination.getKeyPrefix(),
                    coordination.getNodeRegistryTtl());
        }
        log.info("Using in-process coordination store; dead node detection is limited to this process");
        return new InMemoryCoordinationStore(clock, coordination.getNodeRegistryTtl());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class TickQMetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        public TickQMetrics tickqMetrics(TimeJobRepository timeJobRepository,
                CronOccurrenceRepository cronOccurrenceRepository, MeterRegistry meterRegistry) {
            return new TickQMetrics(timeJobRepository, cronOccurrenceRepository, meterRegistry);
        }
    }
}
