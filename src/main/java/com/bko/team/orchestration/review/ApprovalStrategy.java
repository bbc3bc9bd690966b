package com.bko.team.orchestration.review;

public enum ApprovalStrategy {
    ALWAYS_APPROVE("Always approve"),
    KEYWORD_VERDICT("Keyword verdict");

    private final String label;

    ApprovalStrategy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
