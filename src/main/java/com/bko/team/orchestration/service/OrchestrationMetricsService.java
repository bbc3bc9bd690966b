package com.bko.team.orchestration.service;

import com.bko.team.orchestration.model.Specialization;
import com.bko.team.orchestration.model.TaskAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong completionRequestCount = new AtomicLong();
    private final AtomicLong analysisCount = new AtomicLong();
    private final AtomicLong subtaskReceivedCount = new AtomicLong();
    private final AtomicLong subtaskExecutedCount = new AtomicLong();
    private final AtomicLong rejectedReviewCount = new AtomicLong();

    public void recordCompletionRequest(String agentName, String role) {
        long count = completionRequestCount.incrementAndGet();
        log.debug("Completion request #{} sent by {} (role={}).", count, agentName, role);
    }

    public void recordAnalysis(TaskAnalysis analysis) {
        long analyses = analysisCount.incrementAndGet();
        int subtasks = analysis.subtasksFor(Specialization.FRONTEND).size()
                + analysis.subtasksFor(Specialization.BACKEND).size();
        long totalSubtasks = subtaskReceivedCount.addAndGet(subtasks);
        log.info("Analysis #{} produced {} sub-tasks. Total sub-tasks received={}.", analyses, subtasks, totalSubtasks);
    }

    public void recordSubtasksExecuted(Specialization specialization, int executedCount) {
        if (executedCount <= 0) {
            return;
        }
        long totalExecuted = subtaskExecutedCount.addAndGet(executedCount);
        log.info("Collected {} {} solutions. Total sub-tasks executed so far={}.",
                executedCount, specialization.label(), totalExecuted);
    }

    public void recordReview(boolean approved) {
        if (!approved) {
            rejectedReviewCount.incrementAndGet();
        }
    }

    public long completionRequests() {
        return completionRequestCount.get();
    }

    public void logSummary() {
        log.info("Pipeline stats: completionRequests={}, analyses={}, subtasksReceived={}, subtasksExecuted={}, rejectedReviews={}.",
                completionRequestCount.get(), analysisCount.get(), subtaskReceivedCount.get(),
                subtaskExecutedCount.get(), rejectedReviewCount.get());
    }
}
