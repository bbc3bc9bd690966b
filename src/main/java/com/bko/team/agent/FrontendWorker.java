package com.bko.team.agent;

import com.bko.team.config.AgentProfile;
import com.bko.team.orchestration.model.Specialization;
import com.bko.team.orchestration.model.TaskAssignment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.bko.team.orchestration.OrchestrationConstants.*;

@Slf4j
public class FrontendWorker extends Worker {

    public FrontendWorker(AgentProfile profile, AgentRuntime runtime) {
        super(AgentRole.FRONTEND, profile, runtime);
    }

    @Override
    public Specialization specialization() {
        return Specialization.FRONTEND;
    }

    @Override
    protected String classificationPrompt() {
        return FRONTEND_CLASSIFICATION_PROMPT;
    }

    @Override
    protected String mixedPrompt() {
        return FRONTEND_MIXED_PROMPT;
    }

    @Override
    protected List<String> designKeywords() {
        return FRONTEND_DESIGN_KEYWORDS;
    }

    @Override
    protected List<String> implementationKeywords() {
        return FRONTEND_IMPLEMENTATION_KEYWORDS;
    }

    @Override
    protected String design(TaskAssignment assignment) {
        String extraction = extract(FRONTEND_DESIGN_EXTRACTION_PROMPT, assignment);
        SectionExtractor.Sections sections = SectionExtractor.split(extraction, TARGET_USERS_MARKERS, REQUIRED_FEATURES_MARKERS);
        String targetUsers = StringUtils.hasText(sections.first()) ? sections.first() : DEFAULT_TARGET_USERS;
        String requiredFeatures = StringUtils.hasText(sections.second()) ? sections.second() : DEFAULT_REQUIRED_FEATURES;

        Map<String, Object> context = new LinkedHashMap<>(assignment.context());
        context.put("targetUsers", targetUsers);
        context.put("requiredFeatures", requiredFeatures);
        String design = process(render(UI_DESIGN_PROMPT, Map.of(
                "feature", assignment.specificTask(),
                "context", assignment.projectContext(),
                "targetUsers", targetUsers,
                "requiredFeatures", requiredFeatures)), context);
        log.info("UI design created for: {}", abbreviate(assignment.specificTask(), 50));
        return design;
    }

    @Override
    protected String implement(TaskAssignment assignment) {
        String componentName = SectionExtractor.nameBeforeColon(assignment.specificTask(), DEFAULT_COMPONENT_NAME);
        String extraction = extract(COMPONENT_EXTRACTION_PROMPT, assignment);
        SectionExtractor.Sections sections = SectionExtractor.split(extraction, SPECIFICATIONS_MARKERS, TECHNOLOGIES_MARKERS);
        List<String> items = SectionExtractor.bullets(sections.first());
        String specifications = items.isEmpty()
                ? assignment.specificTask()
                : items.stream().map(item -> "- " + item).collect(Collectors.joining("\n"));
        String technologies = StringUtils.hasText(sections.second()) ? sections.second() : DEFAULT_TECHNOLOGIES;
        String backendIntegration = StringUtils.hasText(assignment.interfaces())
                ? assignment.interfaces()
                : DEFAULT_BACKEND_INTEGRATION;

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("componentName", componentName);
        context.put("specifications", specifications);
        context.put("backendIntegration", backendIntegration);
        context.put("recommendedTechnologies", technologies);
        String implementation = process(render(COMPONENT_IMPLEMENTATION_PROMPT, context), context);
        log.info("Frontend component implemented: {}", componentName);
        return implementation;
    }
}
