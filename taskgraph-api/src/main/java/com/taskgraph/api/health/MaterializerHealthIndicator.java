package com.taskgraph.api.health;

import com.taskgraph.api.config.TaskGraphProperties;
import com.taskgraph.core.repository.RecurringTaskRepository;
import com.taskgraph.scheduler.MaterializationReport;
import com.taskgraph.scheduler.RecurringTaskMaterializer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Health of recurring-task materialization.
 * Reports down when scheduled runs are enabled but the materializer is not running.
 */
@Component
public class MaterializerHealthIndicator implements HealthIndicator {

    private static final int STALE_AFTER_POLLS = 3;

    private final RecurringTaskMaterializer materializer;
    private final RecurringTaskRepository repository;
    private final TaskGraphProperties properties;
    private final Clock clock;

    public MaterializerHealthIndicator(
            RecurringTaskMaterializer materializer,
            RecurringTaskRepository repository,
            TaskGraphProperties properties,
            Clock clock) {
        this.materializer = materializer;
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        boolean enabled = properties.getMaterializer().isEnabled();

        try {
            details.put("scheduled", enabled);
            details.put("running", materializer.isRunning());
            details.put("activeGenerators", repository.countActive());
            checkLastRun(details);

            if (enabled && !materializer.isRunning()) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            return Health.up()
                .withDetails(details)
                .build();

        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private void checkLastRun(Map<String, Object> details) {
        Optional<MaterializationReport> lastRun = materializer.lastRun();
        if (lastRun.isEmpty()) {
            details.put("lastRun", "never");
            return;
        }

        MaterializationReport report = lastRun.get();
        details.put("lastRun", report.ranAt().toString());
        details.put("lastRunCreated", report.created());
        details.put("lastRunFailures", report.failures());

        Duration staleAfter = properties.getMaterializer().getPollInterval().multipliedBy(STALE_AFTER_POLLS);
        if (materializer.isRunning() && report.ranAt().plus(staleAfter).isBefore(clock.instant())) {
            details.put("lastRunWarning", "No run for more than " + staleAfter);
        }
    }
}
