package com.taskgraph.api.rest;

import com.jayway.jsonpath.JsonPath;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.engine.persistence.InMemoryTaskStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TaskGraphApiTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private InMemoryTaskStore taskStore;

    private String project() {
        return "p-" + UUID.randomUUID();
    }

    private String task(String projectId, String title) {
        String id = "t-" + UUID.randomUUID();
        taskStore.put(new TaskRecord(id, projectId, "b1", null, "todo", title, null, "u1", "medium",
            List.of(), LocalDate.of(2025, 1, 8), Instant.parse("2025-01-06T00:00:00Z"), Map.of()));
        return id;
    }

    private MvcResult post(String path, String json) throws Exception {
        return mvc.perform(MockMvcRequestBuilders.post(path).contentType(MediaType.APPLICATION_JSON).content(json)).andReturn();
    }

    private static String blocks(String source, String target) {
        return """
            {"sourceTaskId": "%s", "targetTaskId": "%s", "type": "BLOCKS", "actorId": "u1"}
            """.formatted(source, target);
    }

    // ========== Dependencies ==========

    @Nested
    @DisplayName("Dependencies")
    class DependencyTests {

        @Test
        @DisplayName("Adding a dependency returns 201 with the stored edge")
        void testAddDependency() throws Exception {
            String projectId = project();
            String a = task(projectId, "A");
            String b = task(projectId, "B");

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/dependencies").contentType(MediaType.APPLICATION_JSON).content(blocks(a, b)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.projectId").value(projectId))
                .andExpect(jsonPath("$.sourceTaskId").value(a))
                .andExpect(jsonPath("$.scheduling").value(true))
                .andExpect(jsonPath("$.lagDays").value(0));

            mvc.perform(get("/api/v1/projects/{projectId}/dependencies", projectId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        }

        @Test
        @DisplayName("A dependency closing a cycle is rejected with 409 and the cycle")
        void testCycleRejected() throws Exception {
            String projectId = project();
            String a = task(projectId, "A");
            String b = task(projectId, "B");
            assertThat(post("/api/v1/dependencies", blocks(a, b)).getResponse().getStatus()).isEqualTo(201);

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/dependencies").contentType(MediaType.APPLICATION_JSON).content(blocks(b, a)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CYCLE_DETECTED"))
                .andExpect(jsonPath("$.details.cycle").isArray());
        }

        @Test
        @DisplayName("Unknown tasks are reported as 404")
        void testUnknownTask() throws Exception {
            String projectId = project();
            String a = task(projectId, "A");

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/dependencies").contentType(MediaType.APPLICATION_JSON)
                    .content(blocks(a, "missing")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Critical path with explicit durations")
        void testCriticalPath() throws Exception {
            String projectId = project();
            String a = task(projectId, "A");
            String b = task(projectId, "B");
            String c = task(projectId, "C");
            post("/api/v1/dependencies", blocks(a, b));

            String body = """
                {"durations": {"%s": 2, "%s": 3, "%s": 1}, "startDate": "2025-01-06"}
                """.formatted(a, b, c);
            mvc.perform(MockMvcRequestBuilders.post("/api/v1/projects/{projectId}/critical-path", projectId)
                    .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.projectDurationDays").value(5))
                .andExpect(jsonPath("$.criticalTasks[0]").value(a))
                .andExpect(jsonPath("$.criticalTasks[1]").value(b))
                .andExpect(jsonPath("$.criticalTasks.length()").value(2));
        }

        @Test
        @DisplayName("Blocking tasks and start readiness")
        void testBlocking() throws Exception {
            String projectId = project();
            String a = task(projectId, "A");
            String b = task(projectId, "B");
            post("/api/v1/dependencies", blocks(a, b));

            mvc.perform(get("/api/v1/tasks/{taskId}/blocking", b))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canStart").value(false))
                .andExpect(jsonPath("$.blockedBy[0].taskId").value(a));
        }

        @Test
        @DisplayName("Malformed bodies are rejected with 400")
        void testMalformedBody() throws Exception {
            mvc.perform(MockMvcRequestBuilders.post("/api/v1/dependencies").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"type\": \"SOMETIMES\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
        }
    }

    // ========== Workflows ==========

    @Nested
    @DisplayName("Workflows")
    class WorkflowTests {

        private static final String DEFINITION = """
            {
              "name": "Review flow",
              "entityType": "task",
              "states": [
                {"id": "open", "name": "Open", "type": "INITIAL"},
                {"id": "review", "name": "Review", "type": "NORMAL"},
                {"id": "done", "name": "Done", "type": "FINAL"}
              ],
              "transitions": [
                {"id": "t1", "name": "Submit", "fromStateId": "open", "toStateId": "review", "allowAll": true},
                {"id": "t2", "name": "Finish", "fromStateId": "review", "toStateId": "done", "allowAll": true}
              ],
              "trackTimeInStates": true,
              "enforceTransitions": true,
              "active": true,
              "createdBy": "u1"
            }
            """;

        private String createWorkflow() throws Exception {
            MvcResult result = post("/api/v1/workflows", DEFINITION);
            assertThat(result.getResponse().getStatus()).isEqualTo(201);
            String json = result.getResponse().getContentAsString();
            return JsonPath.read(json, "$.id");
        }

        private String apply(String workflowId, String taskId) throws Exception {
            MvcResult result = post("/api/v1/workflows/" + workflowId + "/apply", """
                {"entityType": "task", "entityId": "%s", "actorId": "u1"}
                """.formatted(taskId));
            assertThat(result.getResponse().getStatus()).isEqualTo(201);
            return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
        }

        @Test
        @DisplayName("Created workflows start at version 1")
        void testCreateWorkflow() throws Exception {
            String workflowId = createWorkflow();

            mvc.perform(get("/api/v1/workflows/{workflowId}", workflowId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.states.length()").value(3));
        }

        @Test
        @DisplayName("Instances move along defined transitions until completed")
        void testTransitions() throws Exception {
            String workflowId = createWorkflow();
            String instanceId = apply(workflowId, task(project(), "Reviewed"));

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/workflow-instances/{id}/transitions", instanceId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"toStateId\": \"review\", \"actorId\": \"u1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentStateId").value("review"))
                .andExpect(jsonPath("$.previousStateId").value("open"));

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/workflow-instances/{id}/transitions", instanceId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"toStateId\": \"done\", \"actorId\": \"u1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.completed").value(true));
        }

        @Test
        @DisplayName("Undefined transitions are rejected with 422 and the reason")
        void testInvalidTransition() throws Exception {
            String workflowId = createWorkflow();
            String instanceId = apply(workflowId, task(project(), "Skipped"));

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/workflow-instances/{id}/transitions", instanceId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"toStateId\": \"done\", \"actorId\": \"u1\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.details.reason").value("NO_MATCHING_TRANSITION"));
        }

        @Test
        @DisplayName("Applying twice to the same entity is a conflict")
        void testDuplicateInstance() throws Exception {
            String workflowId = createWorkflow();
            String taskId = task(project(), "Twice");
            apply(workflowId, taskId);

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/workflows/{id}/apply", workflowId).contentType(MediaType.APPLICATION_JSON)
                    .content("{\"entityType\": \"task\", \"entityId\": \"" + taskId + "\", \"actorId\": \"u1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_ENTITY"));
        }
    }

    // ========== Automation ==========

    @Nested
    @DisplayName("Automation")
    class AutomationTests {

        private static final String RULE = """
            {
              "name": "Lower priority when done",
              "triggers": [{"type": "STATUS_CHANGED", "fromStatus": "todo", "toStatus": "done"}],
              "actions": [{"type": "UPDATE_FIELD", "fieldName": "priority", "fieldValue": "low"}],
              "active": true,
              "createdBy": "u1"
            }
            """;

        @Test
        @DisplayName("A matching event runs the rule and changes the task")
        void testEventRunsRule() throws Exception {
            MvcResult created = post("/api/v1/automation/rules", RULE);
            assertThat(created.getResponse().getStatus()).isEqualTo(201);
            String ruleId = JsonPath.read(created.getResponse().getContentAsString(), "$.id");
            String taskId = task(project(), "Automated");

            String event = """
                {
                  "triggerType": "STATUS_CHANGED",
                  "entityType": "task",
                  "entityId": "%s",
                  "triggerData": {"fromStatus": "todo", "toStatus": "done"}
                }
                """.formatted(taskId);
            mvc.perform(MockMvcRequestBuilders.post("/api/v1/automation/events").contentType(MediaType.APPLICATION_JSON).content(event))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].status").value("SUCCESS"))
                .andExpect(jsonPath("$[0].changes.length()").value(1));

            assertThat(taskStore.get(taskId)).get()
                .extracting(TaskRecord::priority)
                .isEqualTo("low");

            mvc.perform(get("/api/v1/automation/rules/{id}/logs", ruleId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/automation/rules/{id}/deactivate", ruleId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
        }

        @Test
        @DisplayName("A dry run plans changes without writing a log")
        void testDryRun() throws Exception {
            MvcResult created = post("/api/v1/automation/rules", RULE.replace("\"active\": true", "\"active\": false"));
            String ruleId = JsonPath.read(created.getResponse().getContentAsString(), "$.id");
            String taskId = task(project(), "Dry run");

            String run = """
                {"triggerType": "STATUS_CHANGED", "entityType": "task", "entityId": "%s",
                 "triggerData": {"fromStatus": "todo", "toStatus": "done"}}
                """.formatted(taskId);
            mvc.perform(MockMvcRequestBuilders.post("/api/v1/automation/rules/{id}/test", ruleId)
                    .contentType(MediaType.APPLICATION_JSON).content(run))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.triggerMatched").value(true))
                .andExpect(jsonPath("$.conditionsMet").value(true))
                .andExpect(jsonPath("$.plannedChanges.length()").value(1));

            assertThat(taskStore.get(taskId)).get()
                .extracting(TaskRecord::priority)
                .isEqualTo("medium");
            mvc.perform(get("/api/v1/automation/rules/{id}/logs", ruleId))
                .andExpect(jsonPath("$.length()").value(0));
        }

        @Test
        @DisplayName("Rules without actions are rejected")
        void testRuleWithoutActions() throws Exception {
            String body = """
                {"name": "Empty", "triggers": [{"type": "MANUAL"}], "active": true}
                """;
            mvc.perform(MockMvcRequestBuilders.post("/api/v1/automation/rules").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("actions"));
        }
    }

    // ========== Recurring Tasks ==========

    @Nested
    @DisplayName("Recurring tasks")
    class RecurrenceTests {

        @Test
        @DisplayName("Preview lists upcoming occurrences with a description")
        void testPreview() throws Exception {
            String body = """
                {
                  "pattern": {"frequency": "WEEKLY", "interval": 1, "weekDays": ["MONDAY", "WEDNESDAY"]},
                  "startDate": "2025-01-06",
                  "count": 4
                }
                """;
            mvc.perform(MockMvcRequestBuilders.post("/api/v1/recurring-tasks/preview").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.occurrences.length()").value(4))
                .andExpect(jsonPath("$.occurrences[1].dayOfWeek").value("WEDNESDAY"))
                .andExpect(jsonPath("$.description").value("Weekly on Monday, Wednesday"));
        }

        @Test
        @DisplayName("Invalid patterns are rejected with the offending field")
        void testInvalidPattern() throws Exception {
            String body = """
                {"pattern": {"frequency": "WEEKLY", "interval": 1}, "startDate": "2025-01-06", "count": 4}
                """;
            mvc.perform(MockMvcRequestBuilders.post("/api/v1/recurring-tasks/preview").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.field").value("weekDays"));
        }

        @Test
        @DisplayName("Creating a generator from an unknown template is 404")
        void testUnknownTemplate() throws Exception {
            String body = """
                {"templateTaskId": "missing", "pattern": {"frequency": "DAILY", "interval": 1}, "createdBy": "u1"}
                """;
            mvc.perform(MockMvcRequestBuilders.post("/api/v1/recurring-tasks").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Created generators are listed, materialized and deactivated")
        void testLifecycle() throws Exception {
            String projectId = project();
            String templateId = task(projectId, "Standup notes");
            String body = """
                {
                  "templateTaskId": "%s",
                  "pattern": {"frequency": "DAILY", "interval": 1},
                  "titleTemplate": "{title} {date}",
                  "autoCreateDaysAhead": 2,
                  "createdBy": "u1"
                }
                """.formatted(templateId);

            MvcResult created = post("/api/v1/recurring-tasks", body);
            assertThat(created.getResponse().getStatus()).isEqualTo(201);
            String id = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

            mvc.perform(get("/api/v1/recurring-tasks").param("projectId", projectId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(id))
                .andExpect(jsonPath("$[0].active").value(true));

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/recurring-tasks/materialize"))
                .andExpect(status().isOk());

            mvc.perform(get("/api/v1/recurring-tasks/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.occurrencesCreated").value(3));

            mvc.perform(MockMvcRequestBuilders.post("/api/v1/recurring-tasks/{id}/deactivate", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
        }
    }

    // ========== Health ==========

    @Test
    @DisplayName("Materializer health reports up when scheduled runs are disabled")
    void testMaterializerHealth() throws Exception {
        mvc.perform(get("/actuator/health/materializer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.details.scheduled").value(false));
    }
}
