package com.taskgraph.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the engine.
 *
 * Configures:
 * - Common tags for all metrics
 * - The engine metrics binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "taskgraph");
    }

    @Bean
    public EngineMetrics engineMetrics() {
        return new EngineMetrics();
    }
}
