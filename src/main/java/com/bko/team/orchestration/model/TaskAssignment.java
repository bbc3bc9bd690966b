package com.bko.team.orchestration.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TaskAssignment(String renderedPrompt,
                             Map<String, Object> context,
                             Specialization specialization,
                             int subtaskIndex) {

    public static final String PROJECT_CONTEXT = "projectContext";
    public static final String SPECIFIC_TASK = "specificTask";
    public static final String CONSTRAINTS = "constraints";
    public static final String INTERFACES = "interfaces";
    public static final String SUCCESS_CRITERIA = "successCriteria";

    public TaskAssignment {
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    public String projectContext() {
        return text(PROJECT_CONTEXT);
    }

    public String specificTask() {
        return text(SPECIFIC_TASK);
    }

    public String constraints() {
        return text(CONSTRAINTS);
    }

    public String interfaces() {
        return text(INTERFACES);
    }

    private String text(String key) {
        Object value = context.get(key);
        return value != null ? value.toString() : "";
    }
}
