package com.bko.team.api;

import jakarta.validation.constraints.NotBlank;

public record PullModelRequest(@NotBlank String name) {
}
