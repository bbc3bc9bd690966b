package com.bko.team.bus;

public enum MessageType {
    TEXT,
    TASK,
    ASSIGNMENT,
    SOLUTION,
    REVIEW,
    RESULT,
    ERROR
}
