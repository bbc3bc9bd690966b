package com.bko.team.orchestration.model;

public record Review(Specialization specialization,
                     String developerName,
                     String originalTask,
                     String evaluationText,
                     boolean approved) {
}
