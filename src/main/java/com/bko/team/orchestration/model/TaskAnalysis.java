package com.bko.team.orchestration.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Decomposition of one task into per-specialization sub-tasks and the integration points
 * between them. Immutable once built.
 */
public record TaskAnalysis(String originalTask,
                           String analysisText,
                           Map<Specialization, List<String>> subtasks,
                           List<String> integrationPoints) {

    public TaskAnalysis {
        originalTask = originalTask != null ? originalTask : "";
        analysisText = analysisText != null ? analysisText : "";
        EnumMap<Specialization, List<String>> copy = new EnumMap<>(Specialization.class);
        for (Specialization specialization : Specialization.values()) {
            List<String> items = subtasks != null ? subtasks.get(specialization) : null;
            copy.put(specialization, items != null ? List.copyOf(items) : List.of());
        }
        subtasks = Collections.unmodifiableMap(copy);
        integrationPoints = integrationPoints != null ? List.copyOf(integrationPoints) : List.of();
    }

    public static TaskAnalysis empty(String originalTask, String analysisText) {
        return new TaskAnalysis(originalTask, analysisText, Map.of(), List.of());
    }

    public List<String> subtasksFor(Specialization specialization) {
        return subtasks.getOrDefault(specialization, List.of());
    }

    public boolean hasSubtasks() {
        return subtasks.values().stream().anyMatch(list -> !list.isEmpty());
    }
}
