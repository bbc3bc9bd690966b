package com.bko.team.agent;

import com.bko.team.config.AgentProfile;
import com.bko.team.orchestration.model.Specialization;
import com.bko.team.orchestration.model.TaskAssignment;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Domain specialist. Each assignment is first classified as design, implementation or mixed
 * work, then solved with the matching strategy.
 */
@Slf4j
public abstract class Worker extends Agent {

    protected Worker(AgentRole role, AgentProfile profile, AgentRuntime runtime) {
        super(role, profile, runtime);
    }

    public abstract Specialization specialization();

    public String executeTask(TaskAssignment assignment) {
        TaskKind kind = classify(assignment);
        log.info("{} task classified as {}: {}", specialization().label(), kind, abbreviate(assignment.specificTask(), 50));
        String result = switch (kind) {
            case DESIGN -> design(assignment);
            case IMPLEMENTATION -> implement(assignment);
            case MIXED -> process(render(mixedPrompt(), assignmentVariables(assignment)), assignment.context());
        };
        log.info("{} task executed: {}", specialization().label(), abbreviate(assignment.specificTask(), 50));
        return result;
    }

    TaskKind classify(TaskAssignment assignment) {
        String answer = process(render(classificationPrompt(), assignmentVariables(assignment)),
                Map.of("assignment", assignment.renderedPrompt()));
        return TaskKind.classify(answer, designKeywords(), implementationKeywords());
    }

    protected String extract(String extractionPrompt, TaskAssignment assignment) {
        return process(render(extractionPrompt, assignmentVariables(assignment)),
                Map.of("assignment", assignment.renderedPrompt()));
    }

    protected static Map<String, Object> assignmentVariables(TaskAssignment assignment) {
        return Map.of("assignment", assignment.renderedPrompt());
    }

    protected abstract String classificationPrompt();

    protected abstract String mixedPrompt();

    protected abstract List<String> designKeywords();

    protected abstract List<String> implementationKeywords();

    protected abstract String design(TaskAssignment assignment);

    protected abstract String implement(TaskAssignment assignment);
}
