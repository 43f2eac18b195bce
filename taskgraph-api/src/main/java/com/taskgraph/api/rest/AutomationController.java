package com.taskgraph.api.rest;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.automation.AutomationAnalytics;
import com.taskgraph.core.model.automation.AutomationLog;
import com.taskgraph.core.model.automation.AutomationRule;
import com.taskgraph.core.model.automation.RuleTestResult;
import com.taskgraph.core.model.automation.TriggerType;
import com.taskgraph.engine.service.AutomationService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for automation rules.
 */
@RestController
@RequestMapping("/api/v1/automation")
public class AutomationController {

    private static final Duration DEFAULT_ANALYTICS_WINDOW = Duration.ofDays(30);

    private final AutomationService automationService;

    public AutomationController(AutomationService automationService) {
        this.automationService = automationService;
    }

    // ========== Rules ==========

    @PostMapping("/rules")
    public ResponseEntity<AutomationRule> createRule(@RequestBody AutomationRule rule) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(automationService.createRule(rule));
    }

    @PutMapping("/rules/{ruleId}")
    public ResponseEntity<AutomationRule> updateRule(
            @PathVariable String ruleId,
            @RequestBody AutomationRule rule) {
        return ResponseEntity.ok(automationService.updateRule(ruleId, rule));
    }

    @DeleteMapping("/rules/{ruleId}")
    public ResponseEntity<Void> deleteRule(@PathVariable String ruleId) {
        automationService.deleteRule(ruleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/rules/{ruleId}")
    public ResponseEntity<AutomationRule> getRule(@PathVariable String ruleId) {
        return ResponseEntity.ok(automationService.getRule(ruleId));
    }

    @GetMapping("/rules")
    public ResponseEntity<List<AutomationRule>> listRules() {
        return ResponseEntity.ok(automationService.listRules());
    }

    @PostMapping("/rules/{ruleId}/activate")
    public ResponseEntity<AutomationRule> activate(@PathVariable String ruleId) {
        return ResponseEntity.ok(automationService.setActive(ruleId, true));
    }

    @PostMapping("/rules/{ruleId}/deactivate")
    public ResponseEntity<AutomationRule> deactivate(@PathVariable String ruleId) {
        return ResponseEntity.ok(automationService.setActive(ruleId, false));
    }

    // ========== Execution ==========

    /**
     * Fire a trigger against an entity, running every matching rule.
     */
    @PostMapping("/events")
    public ResponseEntity<List<AutomationLog>> executeRules(@RequestBody TriggerEventRequest request) {
        if (request.triggerType() == null) {
            throw new ValidationException("triggerType", "is required");
        }
        return ResponseEntity.ok(automationService.executeRules(
            request.triggerType(),
            request.entityType(),
            request.entityId(),
            dataOf(request.triggerData())
        ));
    }

    /**
     * Run one rule directly. Responds 204 when the rule was not eligible to run.
     */
    @PostMapping("/rules/{ruleId}/execute")
    public ResponseEntity<AutomationLog> executeRule(
            @PathVariable String ruleId,
            @RequestBody RuleRunRequest request) {

        return automationService.executeRule(ruleId, request.entityType(), request.entityId(),
                dataOf(request.triggerData()))
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * Dry run: nothing is changed and no log is written.
     */
    @PostMapping("/rules/{ruleId}/test")
    public ResponseEntity<RuleTestResult> testRule(
            @PathVariable String ruleId,
            @RequestBody RuleRunRequest request) {

        return ResponseEntity.ok(automationService.testRule(
            ruleId,
            request.triggerType(),
            request.entityType(),
            request.entityId(),
            dataOf(request.triggerData())
        ));
    }

    // ========== History ==========

    @GetMapping("/rules/{ruleId}/logs")
    public ResponseEntity<List<AutomationLog>> logs(@PathVariable String ruleId) {
        return ResponseEntity.ok(automationService.logs(ruleId));
    }

    /**
     * Execution statistics of a rule; defaults to the last 30 days.
     */
    @GetMapping("/rules/{ruleId}/analytics")
    public ResponseEntity<AutomationAnalytics> analytics(
            @PathVariable String ruleId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        Instant end = to != null ? to : Instant.now();
        Instant start = from != null ? from : end.minus(DEFAULT_ANALYTICS_WINDOW);
        return ResponseEntity.ok(automationService.analytics(ruleId, start, end));
    }

    private static Map<String, FieldValue> dataOf(Map<String, FieldValue> triggerData) {
        return triggerData != null ? triggerData : Map.of();
    }

    // ========== DTOs ==========

    public record TriggerEventRequest(
        TriggerType triggerType,
        String entityType,
        String entityId,
        Map<String, FieldValue> triggerData
    ) {}

    public record RuleRunRequest(
        TriggerType triggerType,
        String entityType,
        String entityId,
        Map<String, FieldValue> triggerData
    ) {}
}
