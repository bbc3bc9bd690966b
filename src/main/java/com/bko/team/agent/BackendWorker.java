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
public class BackendWorker extends Worker {

    public BackendWorker(AgentProfile profile, AgentRuntime runtime) {
        super(AgentRole.BACKEND, profile, runtime);
    }

    @Override
    public Specialization specialization() {
        return Specialization.BACKEND;
    }

    @Override
    protected String classificationPrompt() {
        return BACKEND_CLASSIFICATION_PROMPT;
    }

    @Override
    protected String mixedPrompt() {
        return BACKEND_MIXED_PROMPT;
    }

    @Override
    protected List<String> designKeywords() {
        return BACKEND_DESIGN_KEYWORDS;
    }

    @Override
    protected List<String> implementationKeywords() {
        return BACKEND_IMPLEMENTATION_KEYWORDS;
    }

    @Override
    protected String design(TaskAssignment assignment) {
        String requirements = extract(BACKEND_REQUIREMENTS_EXTRACTION_PROMPT, assignment);
        SectionExtractor.Sections sections = SectionExtractor.split(requirements, FUNCTIONAL_MARKERS, NON_FUNCTIONAL_MARKERS);
        String functional = StringUtils.hasText(sections.first()) ? sections.first() : DEFAULT_FUNCTIONAL_REQUIREMENTS;
        String nonFunctional = StringUtils.hasText(sections.second()) ? sections.second() : DEFAULT_NON_FUNCTIONAL_REQUIREMENTS;

        Map<String, Object> context = new LinkedHashMap<>(assignment.context());
        context.put("functionalRequirements", functional);
        context.put("nonFunctionalRequirements", nonFunctional);
        String design = process(render(ARCHITECTURE_DESIGN_PROMPT, Map.of(
                "feature", assignment.specificTask(),
                "context", assignment.projectContext(),
                "functionalRequirements", functional,
                "nonFunctionalRequirements", nonFunctional)), context);
        log.info("Backend architecture designed for: {}", abbreviate(assignment.specificTask(), 50));
        return design;
    }

    @Override
    protected String implement(TaskAssignment assignment) {
        String apiName = SectionExtractor.nameBeforeColon(assignment.specificTask(), DEFAULT_API_NAME);
        String details = extract(API_EXTRACTION_PROMPT, assignment);
        SectionExtractor.Sections sections = SectionExtractor.split(details, ENDPOINT_MARKERS, DATA_MODEL_MARKERS);
        List<String> endpoints = SectionExtractor.bullets(sections.first());
        if (endpoints.isEmpty()) {
            endpoints = DEFAULT_ENDPOINTS;
        }
        String dataModel = StringUtils.hasText(sections.second()) ? sections.second() : DEFAULT_DATA_MODEL;
        String constraints = StringUtils.hasText(assignment.constraints()) ? assignment.constraints() : DEFAULT_API_CONSTRAINTS;

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("apiName", apiName);
        context.put("requiredEndpoints", endpoints);
        context.put("dataModel", dataModel);
        context.put("constraints", constraints);
        String implementation = process(render(API_IMPLEMENTATION_PROMPT, Map.of(
                "apiName", apiName,
                "requiredEndpoints", endpoints.stream().map(endpoint -> "- " + endpoint).collect(Collectors.joining("\n")),
                "dataModel", dataModel,
                "constraints", constraints)), context);
        log.info("Backend API implemented: {}", apiName);
        return implementation;
    }
}
