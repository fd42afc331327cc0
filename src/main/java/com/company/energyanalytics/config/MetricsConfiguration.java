package com.company.energyanalytics.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
public class MetricsConfiguration {

    @Bean
    public MeterBinder analyticsExecutorMetrics(@Qualifier("analyticsExecutor") ThreadPoolTaskExecutor executor) {
        return (reg) -> {
            // Channels currently being analyzed
            Gauge.builder("analytics.executor.active", executor, ThreadPoolTaskExecutor::getActiveCount)
                    .description("Number of per-channel analysis tasks currently running")
                    .register(reg);

            Gauge.builder("analytics.executor.queued", executor,
                            e -> e.getThreadPoolExecutor().getQueue().size())
                    .description("Number of per-channel analysis tasks waiting for a thread")
                    .register(reg);

            log.info("Analytics metrics registered");
        };
    }
}
