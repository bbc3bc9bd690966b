package com.bko.team.orchestration.review;

import com.bko.team.config.AgentTeamProperties;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

@Service
public class ApprovalPolicyService {

    private static final ApprovalPolicy ALWAYS_APPROVE = evaluation -> true;

    private final AgentTeamProperties properties;

    public ApprovalPolicyService(AgentTeamProperties properties) {
        this.properties = properties;
    }

    public ApprovalPolicy activePolicy() {
        return policyFor(properties.getReview().getApprovalStrategy());
    }

    public ApprovalPolicy policyFor(ApprovalStrategy strategy) {
        if (strategy == null) {
            return ALWAYS_APPROVE;
        }
        return switch (strategy) {
            case KEYWORD_VERDICT -> keywordVerdict(properties.getReview().getRejectionKeywords());
            case ALWAYS_APPROVE -> ALWAYS_APPROVE;
        };
    }

    private ApprovalPolicy keywordVerdict(List<String> rejectionKeywords) {
        List<String> keywords = rejectionKeywords == null ? List.of() : rejectionKeywords.stream()
                .filter(StringUtils::hasText)
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .toList();
        return evaluation -> {
            if (!StringUtils.hasText(evaluation)) {
                return true;
            }
            String normalized = evaluation.toLowerCase(Locale.ROOT);
            return keywords.stream().noneMatch(normalized::contains);
        };
    }
}
