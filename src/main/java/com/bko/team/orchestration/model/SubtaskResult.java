package com.bko.team.orchestration.model;

public record SubtaskResult(String task, String solution, Review review, boolean approved) {
}
