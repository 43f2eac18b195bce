package com.taskgraph.api.config;

import com.taskgraph.core.model.automation.AutomationPolicy;
import com.taskgraph.core.model.dependency.SchedulingPolicy;
import com.taskgraph.core.model.workflow.WorkflowPolicy;
import com.taskgraph.scheduler.MaterializerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Engine configuration bound from the {@code taskgraph.*} properties.
 * Each section maps onto the policy record its component consumes.
 */
@Configuration
@ConfigurationProperties(prefix = "taskgraph")
public class TaskGraphProperties {

    private Scheduling scheduling = new Scheduling();

    private Workflow workflow = new Workflow();

    private Automation automation = new Automation();

    private Materializer materializer = new Materializer();

    private Authorization authorization = new Authorization();

    public Scheduling getScheduling() {
        return scheduling;
    }

    public void setScheduling(Scheduling scheduling) {
        this.scheduling = scheduling;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public void setWorkflow(Workflow workflow) {
        this.workflow = workflow;
    }

    public Automation getAutomation() {
        return automation;
    }

    public void setAutomation(Automation automation) {
        this.automation = automation;
    }

    public Materializer getMaterializer() {
        return materializer;
    }

    public void setMaterializer(Materializer materializer) {
        this.materializer = materializer;
    }

    public Authorization getAuthorization() {
        return authorization;
    }

    public void setAuthorization(Authorization authorization) {
        this.authorization = authorization;
    }

    /**
     * Dependency analysis.
     */
    public static class Scheduling {

        private int defaultDurationDays = 1;

        private List<String> completedStatuses = List.of("done", "completed");

        /**
         * Chains longer than this are reported by dependency validation.
         */
        private int longChainThreshold = 10;

        /**
         * Tasks touching more dependencies than this are reported by dependency validation.
         */
        private int denseTaskThreshold = 5;

        public SchedulingPolicy toPolicy() {
            return new SchedulingPolicy(defaultDurationDays, lowerCase(completedStatuses),
                longChainThreshold, denseTaskThreshold);
        }

        public int getDefaultDurationDays() {
            return defaultDurationDays;
        }

        public void setDefaultDurationDays(int defaultDurationDays) {
            this.defaultDurationDays = defaultDurationDays;
        }

        public List<String> getCompletedStatuses() {
            return completedStatuses;
        }

        public void setCompletedStatuses(List<String> completedStatuses) {
            this.completedStatuses = completedStatuses;
        }

        public int getLongChainThreshold() {
            return longChainThreshold;
        }

        public void setLongChainThreshold(int longChainThreshold) {
            this.longChainThreshold = longChainThreshold;
        }

        public int getDenseTaskThreshold() {
            return denseTaskThreshold;
        }

        public void setDenseTaskThreshold(int denseTaskThreshold) {
            this.denseTaskThreshold = denseTaskThreshold;
        }
    }

    /**
     * Workflow analytics.
     */
    public static class Workflow {

        private Duration abandonAfter = Duration.ofDays(30);

        public WorkflowPolicy toPolicy() {
            return new WorkflowPolicy(abandonAfter);
        }

        public Duration getAbandonAfter() {
            return abandonAfter;
        }

        public void setAbandonAfter(Duration abandonAfter) {
            this.abandonAfter = abandonAfter;
        }
    }

    /**
     * Rule execution.
     */
    public static class Automation {

        /**
         * Zone whose calendar day bounds a rule's daily execution cap.
         */
        private String zone = "UTC";

        private int maxChainDepth = 5;

        /**
         * How long a chained rule waits for the lock of the rule it runs.
         */
        private Duration chainLockTimeout = AutomationPolicy.DEFAULT_CHAIN_LOCK_TIMEOUT;

        public AutomationPolicy toPolicy() {
            return new AutomationPolicy(ZoneId.of(zone), maxChainDepth, chainLockTimeout);
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public int getMaxChainDepth() {
            return maxChainDepth;
        }

        public void setMaxChainDepth(int maxChainDepth) {
            this.maxChainDepth = maxChainDepth;
        }

        public Duration getChainLockTimeout() {
            return chainLockTimeout;
        }

        public void setChainLockTimeout(Duration chainLockTimeout) {
            this.chainLockTimeout = chainLockTimeout;
        }
    }

    /**
     * Recurring-task materializer.
     */
    public static class Materializer {

        /**
         * Whether scheduled runs start with the application. Manual runs are always available.
         */
        private boolean enabled = true;

        private Duration pollInterval = MaterializerSettings.DEFAULT_POLL_INTERVAL;

        private int batchSize = MaterializerSettings.DEFAULT_BATCH_SIZE;

        public MaterializerSettings toSettings() {
            return new MaterializerSettings(pollInterval, batchSize);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    /**
     * Transition and approval authorization cache.
     */
    public static class Authorization {

        private Duration cacheTtl = Duration.ofMinutes(5);

        private long cacheMaximumSize = 10_000;

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public long getCacheMaximumSize() {
            return cacheMaximumSize;
        }

        public void setCacheMaximumSize(long cacheMaximumSize) {
            this.cacheMaximumSize = cacheMaximumSize;
        }
    }

    private static Set<String> lowerCase(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        values.forEach(v -> result.add(v.toLowerCase()));
        return result;
    }
}
