package com.bko.team.orchestration.service;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.bko.team.orchestration.OrchestrationConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class PromptRenderingServiceTest {

    private final PromptRenderingService service = new PromptRenderingService();

    @Test
    void testRenderFillsPlaceholders() {
        String rendered = service.render(TASK_ASSIGNMENT_PROMPT, Map.of(
                "developerName", "Bruno",
                "projectContext", "Todo app",
                "specificTask", "Todo API",
                "constraints", "none",
                "interfaces", "- REST",
                "successCriteria", "works"));

        assertTrue(rendered.startsWith("Task assignment for Bruno:"));
        assertTrue(rendered.contains("YOUR TASK: Todo API"));
        assertTrue(rendered.contains("INTERFACES WITH OTHER COMPONENTS:\n- REST"));
        assertFalse(rendered.contains("{"));
    }

    @Test
    void testValuesAreNotInterpreted() {
        String rendered = service.render(DIRECT_SOLUTION_PROMPT, Map.of("task", "Expose GET /api/{id} and <b>bold</b>"));

        assertTrue(rendered.contains("Expose GET /api/{id} and <b>bold</b>"));
    }

    @Test
    void testNullValuesRenderEmpty() {
        Map<String, Object> values = new HashMap<>();
        values.put("task", null);

        String rendered = service.render(COMPLETE_SOLUTION_PROMPT, values);

        assertTrue(rendered.startsWith("Write a complete solution for the following task:"));
    }

    @Test
    void testEveryTemplateRendersWithItsVariables() {
        Map<String, Object> values = new HashMap<>();
        for (String name : new String[]{"task", "developerName", "projectContext", "specificTask", "constraints",
                "interfaces", "successCriteria", "originalTask", "submittedSolution", "frontendSolution",
                "backendSolution", "assignment", "feature", "context", "targetUsers", "requiredFeatures",
                "componentName", "specifications", "backendIntegration", "recommendedTechnologies",
                "functionalRequirements", "nonFunctionalRequirements", "apiName", "requiredEndpoints", "dataModel"}) {
            values.put(name, "value");
        }
        for (String template : new String[]{TASK_ANALYSIS_PROMPT, SUBTASK_EXTRACTION_PROMPT, TASK_ASSIGNMENT_PROMPT,
                REVIEW_PROMPT, INTEGRATION_PROMPT, COMPLETE_SOLUTION_PROMPT, DIRECT_SOLUTION_PROMPT,
                FRONTEND_CLASSIFICATION_PROMPT, BACKEND_CLASSIFICATION_PROMPT, FRONTEND_DESIGN_EXTRACTION_PROMPT,
                UI_DESIGN_PROMPT, COMPONENT_EXTRACTION_PROMPT, COMPONENT_IMPLEMENTATION_PROMPT, FRONTEND_MIXED_PROMPT,
                BACKEND_REQUIREMENTS_EXTRACTION_PROMPT, ARCHITECTURE_DESIGN_PROMPT, API_EXTRACTION_PROMPT,
                API_IMPLEMENTATION_PROMPT, BACKEND_MIXED_PROMPT}) {
            String rendered = assertDoesNotThrow(() -> service.render(template, values));
            assertFalse(rendered.contains("{"), () -> "Unrendered placeholder in: " + rendered);
        }
    }

    @Test
    void testMissingVariableIsRejected() {
        assertThrows(RuntimeException.class, () -> service.render(REVIEW_PROMPT, Map.of("developerName", "Bruno")));
    }
}
