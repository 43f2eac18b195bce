package com.taskgraph.api.config;

import com.taskgraph.api.notification.LoggingNotificationSink;
import com.taskgraph.core.spi.NotificationSink;
import com.taskgraph.engine.automation.StandardActionHandlers;
import com.taskgraph.engine.cache.AuthorizationCache;
import com.taskgraph.engine.concurrent.KeyedLocks;
import com.taskgraph.engine.coordinator.AutomationCoordinator;
import com.taskgraph.engine.coordinator.DependencyCoordinator;
import com.taskgraph.engine.coordinator.WorkflowCoordinator;
import com.taskgraph.engine.entity.TaskEntityAccessor;
import com.taskgraph.engine.events.InMemoryEventPublisher;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.metrics.MetricsConfiguration;
import com.taskgraph.engine.persistence.InMemoryAutomationLogRepository;
import com.taskgraph.engine.persistence.InMemoryAutomationRuleRepository;
import com.taskgraph.engine.persistence.InMemoryDependencyRepository;
import com.taskgraph.engine.persistence.InMemoryRecurringTaskRepository;
import com.taskgraph.engine.persistence.InMemoryTaskStore;
import com.taskgraph.engine.persistence.InMemoryUserDirectory;
import com.taskgraph.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.taskgraph.engine.persistence.InMemoryWorkflowInstanceRepository;
import com.taskgraph.engine.workflow.TransitionAuthorizer;
import com.taskgraph.scheduler.RecurrenceCalculator;
import com.taskgraph.scheduler.RecurringTaskCoordinator;
import com.taskgraph.scheduler.RecurringTaskMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;

/**
 * Wires the engine over in-memory stores.
 *
 * Configures:
 * - Shared infrastructure (clock, locks, authorization cache, event publisher)
 * - The dependency, workflow and automation coordinators
 * - The recurring-task materializer, started with the context when enabled
 */
@Configuration
@Import(MetricsConfiguration.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    private final TaskGraphProperties properties;

    public EngineConfiguration(TaskGraphProperties properties) {
        this.properties = properties;
    }

    // ========== Infrastructure ==========

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyedLocks keyedLocks() {
        return new KeyedLocks();
    }

    @Bean
    public AuthorizationCache authorizationCache() {
        TaskGraphProperties.Authorization authorization = properties.getAuthorization();
        return new AuthorizationCache(authorization.getCacheTtl(), authorization.getCacheMaximumSize());
    }

    @Bean
    public InMemoryEventPublisher eventPublisher() {
        return new InMemoryEventPublisher();
    }

    @Bean
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }

    // ========== Stores ==========

    @Bean
    public InMemoryTaskStore taskStore(Clock clock) {
        return new InMemoryTaskStore(clock);
    }

    @Bean
    public InMemoryUserDirectory userDirectory() {
        return new InMemoryUserDirectory();
    }

    @Bean
    public InMemoryDependencyRepository dependencyRepository() {
        return new InMemoryDependencyRepository();
    }

    @Bean
    public InMemoryWorkflowDefinitionRepository workflowDefinitionRepository() {
        return new InMemoryWorkflowDefinitionRepository();
    }

    @Bean
    public InMemoryWorkflowInstanceRepository workflowInstanceRepository() {
        return new InMemoryWorkflowInstanceRepository();
    }

    @Bean
    public InMemoryAutomationRuleRepository automationRuleRepository() {
        return new InMemoryAutomationRuleRepository();
    }

    @Bean
    public InMemoryAutomationLogRepository automationLogRepository() {
        return new InMemoryAutomationLogRepository();
    }

    @Bean
    public InMemoryRecurringTaskRepository recurringTaskRepository() {
        return new InMemoryRecurringTaskRepository();
    }

    @Bean
    public TaskEntityAccessor taskEntityAccessor(InMemoryTaskStore taskStore) {
        return new TaskEntityAccessor(taskStore);
    }

    // ========== Coordinators ==========

    @Bean
    public DependencyCoordinator dependencyCoordinator(
            InMemoryDependencyRepository dependencyRepository,
            InMemoryTaskStore taskStore,
            InMemoryEventPublisher eventPublisher,
            KeyedLocks locks,
            EngineMetrics metrics,
            Clock clock) {
        return new DependencyCoordinator(dependencyRepository, taskStore, eventPublisher,
            properties.getScheduling().toPolicy(), locks, metrics, clock);
    }

    @Bean
    public AutomationCoordinator automationCoordinator(
            InMemoryAutomationRuleRepository ruleRepository,
            InMemoryAutomationLogRepository logRepository,
            TaskEntityAccessor entities,
            InMemoryTaskStore taskStore,
            NotificationSink notificationSink,
            InMemoryEventPublisher eventPublisher,
            KeyedLocks locks,
            EngineMetrics metrics,
            Clock clock) {
        AutomationCoordinator automation = new AutomationCoordinator(
            ruleRepository, logRepository, entities,
            StandardActionHandlers.registry(entities, taskStore, notificationSink),
            properties.getAutomation().toPolicy(), locks, metrics, clock);
        eventPublisher.subscribe(automation);
        return automation;
    }

    @Bean
    public WorkflowCoordinator workflowCoordinator(
            InMemoryWorkflowDefinitionRepository definitionRepository,
            InMemoryWorkflowInstanceRepository instanceRepository,
            TaskEntityAccessor entities,
            InMemoryEventPublisher eventPublisher,
            AutomationCoordinator automation,
            AuthorizationCache authorizationCache,
            InMemoryUserDirectory userDirectory,
            KeyedLocks locks,
            EngineMetrics metrics,
            Clock clock) {
        return new WorkflowCoordinator(
            definitionRepository, instanceRepository, entities, eventPublisher, automation,
            authorizationCache, new TransitionAuthorizer(authorizationCache, userDirectory),
            properties.getWorkflow().toPolicy(), locks, metrics, clock);
    }

    // ========== Recurrence ==========

    @Bean
    public RecurrenceCalculator recurrenceCalculator() {
        return new RecurrenceCalculator();
    }

    @Bean(destroyMethod = "stop")
    public RecurringTaskMaterializer recurringTaskMaterializer(
            InMemoryRecurringTaskRepository repository,
            InMemoryTaskStore taskStore,
            RecurrenceCalculator calculator,
            KeyedLocks locks,
            EngineMetrics metrics,
            Clock clock) {
        RecurringTaskMaterializer materializer = new RecurringTaskMaterializer(
            repository, taskStore, calculator, locks, metrics, properties.getMaterializer().toSettings(), clock);
        if (properties.getMaterializer().isEnabled()) {
            materializer.start();
        } else {
            log.info("Scheduled materialization disabled; recurring tasks are only materialized on demand");
        }
        return materializer;
    }

    @Bean
    public RecurringTaskCoordinator recurringTaskCoordinator(
            InMemoryRecurringTaskRepository repository,
            InMemoryTaskStore taskStore,
            RecurrenceCalculator calculator,
            RecurringTaskMaterializer materializer,
            KeyedLocks locks,
            EngineMetrics metrics,
            Clock clock) {
        return new RecurringTaskCoordinator(repository, taskStore, calculator, materializer, locks, metrics, clock);
    }
}
