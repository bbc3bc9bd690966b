package com.bko.team.agent;

import org.junit.jupiter.api.Test;

import static com.bko.team.orchestration.OrchestrationConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class TaskKindTest {

    @Test
    void testDigitsTakePrecedenceInOrder() {
        assertEquals(TaskKind.DESIGN, classifyBackend("1"));
        assertEquals(TaskKind.DESIGN, classifyBackend("2 or maybe 1"));
        assertEquals(TaskKind.IMPLEMENTATION, classifyBackend(" 2\n"));
        assertEquals(TaskKind.IMPLEMENTATION, classifyBackend("3 then 2"));
        assertEquals(TaskKind.MIXED, classifyBackend("3"));
        assertEquals(TaskKind.MIXED, classifyBackend("3: the design and the api"));
    }

    @Test
    void testKeywordsAreWholeWordsAndCaseInsensitive() {
        assertEquals(TaskKind.DESIGN, classifyBackend("Architecture"));
        assertEquals(TaskKind.IMPLEMENTATION, classifyBackend("mostly API work"));
        assertEquals(TaskKind.DESIGN, classifyFrontend("UI work"));
        assertEquals(TaskKind.IMPLEMENTATION, classifyFrontend("a Component"));
        assertEquals(TaskKind.MIXED, classifyFrontend("follow the guide"));
        assertEquals(TaskKind.MIXED, classifyBackend("rapid prototyping"));
    }

    @Test
    void testDesignKeywordsBeforeImplementationKeywords() {
        assertEquals(TaskKind.DESIGN, classifyBackend("api architecture"));
        assertEquals(TaskKind.DESIGN, classifyFrontend("component design"));
    }

    @Test
    void testUnknownOrMissingAnswerIsMixed() {
        assertEquals(TaskKind.MIXED, classifyBackend("I am not sure"));
        assertEquals(TaskKind.MIXED, classifyBackend(""));
        assertEquals(TaskKind.MIXED, classifyBackend(null));
    }

    private static TaskKind classifyBackend(String answer) {
        return TaskKind.classify(answer, BACKEND_DESIGN_KEYWORDS, BACKEND_IMPLEMENTATION_KEYWORDS);
    }

    private static TaskKind classifyFrontend(String answer) {
        return TaskKind.classify(answer, FRONTEND_DESIGN_KEYWORDS, FRONTEND_IMPLEMENTATION_KEYWORDS);
    }
}
