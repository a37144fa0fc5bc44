package com.vidnyan.dre.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.dre.application.port.out.AgentRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Spring configuration for the dynamic request engine.
 * Wires the shared infrastructure the hexagonal components run on.
 */
@Slf4j
@Configuration
public class DreConfiguration {

    /**
     * ObjectMapper for the HTTP surface and agent profiles: snake_case, ISO timestamps.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs request processing steps. Admission is bounded by the lifecycle manager,
     * so the pool only needs to absorb bursts.
     */
    @Bean
    public ThreadPoolTaskExecutor requestExecutor(DynamicRequestProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, Math.min(8, properties.getMaxConcurrentRequests())));
        executor.setThreadNamePrefix("dre-request-");
        executor.initialize();
        return executor;
    }

    /**
     * Single thread, so bus listeners see events in publish order.
     */
    @Bean
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("dre-event-");
        executor.initialize();
        return executor;
    }

    /**
     * Timeouts and simulated helper answers.
     */
    @Bean
    public ThreadPoolTaskScheduler dreScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("dre-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Log registered helper agents on startup.
     */
    @Bean
    public String logRegisteredAgents(AgentRegistry agentRegistry, DynamicRequestProperties properties) {
        log.info("Registered {} helper agents:", agentRegistry.snapshot().size());
        agentRegistry.snapshot().forEach(a -> log.info("  - {} {} (load {}, success {})",
                a.agentName(), a.capabilities(), a.currentLoad(), a.historicalSuccessRate()));
        log.info("Limits: {} concurrent requests, spawn depth {}, {} tokens per package",
                properties.getMaxConcurrentRequests(), properties.getMaxSpawnDepth(),
                properties.getMaxTokensPerPackage());
        return "agents-logged";
    }
}
