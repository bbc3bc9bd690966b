package com.bko.team.orchestration.review;

import org.springframework.lang.Nullable;

/**
 * Decides whether a reviewed solution may flow into integration.
 */
@FunctionalInterface
public interface ApprovalPolicy {

    /**
     * @param evaluation the coordinator's review text, possibly empty
     * @return {@code true} when the solution is accepted
     */
    boolean approve(@Nullable String evaluation);
}
