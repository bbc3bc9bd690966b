package com.bko.team.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record SolveTaskRequest(
        @NotBlank String description,
        @Positive Long timeoutSeconds
) {
}
