package com.bko.team.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one pipeline run. Written by the orchestrator thread and by sub-task
 * threads, read by status lookups, so every accessor is synchronized.
 */
public class PipelineState {

    private final String taskId;
    private final String description;
    private final Instant startTime;
    private final Map<Specialization, List<SubtaskResult>> results = new EnumMap<>(Specialization.class);
    private PipelineStatus status = PipelineStatus.ANALYZING;
    private TaskAnalysis analysis;
    private Instant endTime;
    private String finalSolution;
    private String errorMessage;

    public PipelineState(String taskId, String description, Instant startTime) {
        this.taskId = taskId;
        this.description = description;
        this.startTime = startTime;
        for (Specialization specialization : Specialization.values()) {
            results.put(specialization, new ArrayList<>());
        }
    }

    public String getTaskId() {
        return taskId;
    }

    public String getDescription() {
        return description;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public synchronized PipelineStatus getStatus() {
        return status;
    }

    public synchronized void setStatus(PipelineStatus status) {
        this.status = status;
    }

    public synchronized @Nullable TaskAnalysis getAnalysis() {
        return analysis;
    }

    public synchronized void setAnalysis(TaskAnalysis analysis) {
        this.analysis = analysis;
    }

    public synchronized void setResults(Specialization specialization, List<SubtaskResult> subtaskResults) {
        results.put(specialization, new ArrayList<>(subtaskResults));
    }

    public synchronized List<SubtaskResult> getResults(Specialization specialization) {
        return List.copyOf(results.get(specialization));
    }

    public synchronized @Nullable Instant getEndTime() {
        return endTime;
    }

    public synchronized @Nullable Duration getDuration() {
        return endTime != null ? Duration.between(startTime, endTime) : null;
    }

    public synchronized @Nullable String getFinalSolution() {
        return finalSolution;
    }

    public synchronized @Nullable String getErrorMessage() {
        return errorMessage;
    }

    public synchronized void complete(String finalSolution, Instant endTime) {
        this.status = PipelineStatus.COMPLETED;
        this.finalSolution = finalSolution;
        this.endTime = endTime;
    }

    public synchronized void fail(String errorMessage, String errorReport, Instant endTime) {
        this.status = PipelineStatus.FAILED;
        this.errorMessage = errorMessage;
        this.finalSolution = errorReport;
        this.endTime = endTime;
    }
}
