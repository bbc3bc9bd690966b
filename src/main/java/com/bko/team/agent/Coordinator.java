package com.bko.team.agent;

import com.bko.team.config.AgentProfile;
import com.bko.team.orchestration.model.AssignmentResult;
import com.bko.team.orchestration.model.Review;
import com.bko.team.orchestration.model.Specialization;
import com.bko.team.orchestration.model.TaskAnalysis;
import com.bko.team.orchestration.model.TaskAssignment;
import com.bko.team.orchestration.review.ApprovalPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.bko.team.orchestration.OrchestrationConstants.*;

/**
 * Lead agent: decomposes a task, writes assignments for the workers, reviews their output and
 * merges the frontend and backend solutions.
 */
@Slf4j
public class Coordinator extends Agent {

    private static final String FRONTEND_TASKS = "frontend_tasks";
    private static final String BACKEND_TASKS = "backend_tasks";
    private static final String INTEGRATION_POINTS = "integration_points";

    private final ApprovalPolicy approvalPolicy;
    private final Map<Specialization, String> developerNames;

    public Coordinator(AgentProfile profile,
                       AgentRuntime runtime,
                       ApprovalPolicy approvalPolicy,
                       Map<Specialization, String> developerNames) {
        super(AgentRole.COORDINATOR, profile, runtime);
        this.approvalPolicy = approvalPolicy;
        this.developerNames = new EnumMap<>(developerNames);
    }

    /**
     * Runs the decomposition prompt, then asks for the sub-tasks as JSON. Output that cannot be
     * parsed yields an analysis without sub-tasks; only transport failures escape.
     */
    public TaskAnalysis analyzeTask(String task) {
        Map<String, Object> context = Map.of("task", task);
        log.info("Analysing task: {}", abbreviate(task, 50));
        String analysisText = process(render(TASK_ANALYSIS_PROMPT, Map.of("task", task)), context);
        String extraction = process(render(SUBTASK_EXTRACTION_PROMPT, Map.of("task", task)), context);

        JsonNode parsed = runtime.jsonService().parseJsonResponse("task decomposition", extraction, JsonNode.class);
        Map<Specialization, List<String>> subtasks = new EnumMap<>(Specialization.class);
        subtasks.put(Specialization.FRONTEND, textList(parsed, FRONTEND_TASKS));
        subtasks.put(Specialization.BACKEND, textList(parsed, BACKEND_TASKS));
        TaskAnalysis analysis = new TaskAnalysis(task, analysisText, subtasks, textList(parsed, INTEGRATION_POINTS));

        log.info("Task split into {} frontend and {} backend sub-tasks",
                analysis.subtasksFor(Specialization.FRONTEND).size(), analysis.subtasksFor(Specialization.BACKEND).size());
        return analysis;
    }

    public AssignmentResult createTaskAssignment(TaskAnalysis analysis, Specialization specialization, int index) {
        List<String> tasks = analysis.subtasksFor(specialization);
        if (index < 0 || index >= tasks.size()) {
            String message = "Invalid sub-task index " + index + " for " + specialization.label()
                    + " tasks (size " + tasks.size() + ")";
            log.error(message);
            return AssignmentResult.invalidIndex(message);
        }
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(TaskAssignment.PROJECT_CONTEXT, analysis.originalTask());
        context.put(TaskAssignment.SPECIFIC_TASK, tasks.get(index));
        context.put(TaskAssignment.CONSTRAINTS, DEFAULT_CONSTRAINTS);
        context.put(TaskAssignment.INTERFACES, bulletList(analysis.integrationPoints()));
        context.put(TaskAssignment.SUCCESS_CRITERIA, DEFAULT_SUCCESS_CRITERIA);

        Map<String, Object> variables = new LinkedHashMap<>(context);
        variables.put("developerName", developerName(specialization));
        String rendered = render(TASK_ASSIGNMENT_PROMPT, variables);
        return AssignmentResult.valid(new TaskAssignment(rendered, context, specialization, index));
    }

    public Review reviewWork(TaskAnalysis analysis, Specialization specialization, String solution) {
        String developerName = developerName(specialization);
        String prompt = render(REVIEW_PROMPT, Map.of(
                "developerName", developerName,
                "originalTask", analysis.originalTask(),
                "submittedSolution", solution));
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("taskAnalysis", analysis);
        context.put("specialization", specialization.label());
        String evaluation = process(prompt, context);
        boolean approved = approvalPolicy.approve(evaluation);
        runtime.metrics().recordReview(approved);
        log.info("Review of {} work: {}", specialization.label(), approved ? "approved" : "rejected");
        return new Review(specialization, developerName, analysis.originalTask(), evaluation, approved);
    }

    /**
     * Merges both solutions. With neither available the whole task is solved from scratch; a
     * missing side is replaced by a placeholder line.
     */
    public String integrateSolutions(TaskAnalysis analysis, @Nullable String frontendSolution, @Nullable String backendSolution) {
        Map<String, Object> context = Map.of("taskAnalysis", analysis);
        boolean noFrontend = !StringUtils.hasText(frontendSolution);
        boolean noBackend = !StringUtils.hasText(backendSolution);
        if (noFrontend && noBackend) {
            log.info("No worker solution to integrate, asking for a complete solution");
            return process(render(COMPLETE_SOLUTION_PROMPT, Map.of("task", analysis.originalTask())), context);
        }
        String prompt = render(INTEGRATION_PROMPT, Map.of(
                "task", analysis.originalTask(),
                "frontendSolution", noFrontend ? Specialization.FRONTEND.missingSolutionText() : frontendSolution,
                "backendSolution", noBackend ? Specialization.BACKEND.missingSolutionText() : backendSolution));
        return process(prompt, context);
    }

    public String solveDirectly(String description) {
        return process(render(DIRECT_SOLUTION_PROMPT, Map.of("task", description)), Map.of("task", description));
    }

    public String developerName(Specialization specialization) {
        return developerNames.getOrDefault(specialization, specialization.role().displayName());
    }

    private static List<String> textList(@Nullable JsonNode root, String field) {
        if (root == null || !root.isObject()) {
            return List.of();
        }
        JsonNode value = root.get(field);
        if (value == null || !value.isArray()) {
            if (value != null && !value.isNull()) {
                log.warn("Expected a list for {} but got {}", field, value.getNodeType());
            }
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            String text = item.isValueNode() ? item.asText() : item.toString();
            if (!item.isNull() && StringUtils.hasText(text)) {
                items.add(text.trim());
            }
        }
        return items;
    }

    private static String bulletList(List<String> items) {
        return items.stream().map(item -> "- " + item).collect(Collectors.joining("\n"));
    }
}
