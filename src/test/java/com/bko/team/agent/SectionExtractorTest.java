package com.bko.team.agent;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bko.team.orchestration.OrchestrationConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class SectionExtractorTest {

    @Test
    void testEndpointsAndFrenchDataModel() {
        String answer = "ENDPOINTS:\n- GET /x\n- POST /y\nMODÈLE DE DONNÉES\nfoo";

        SectionExtractor.Sections sections = SectionExtractor.split(answer, ENDPOINT_MARKERS, DATA_MODEL_MARKERS);

        assertEquals(List.of("GET /x", "POST /y"), SectionExtractor.bullets(sections.first()));
        assertEquals("foo", sections.second());
    }

    @Test
    void testSecondMarkerContainingFirstIsSplitFirst() {
        String answer = """
                FUNCTIONAL REQUIREMENTS:
                - users can sign up
                NON-FUNCTIONAL REQUIREMENTS:
                - p99 under 200 ms
                """;

        SectionExtractor.Sections sections = SectionExtractor.split(answer, FUNCTIONAL_MARKERS, NON_FUNCTIONAL_MARKERS);

        assertEquals("- users can sign up", sections.first());
        assertEquals("- p99 under 200 ms", sections.second());
    }

    @Test
    void testFrenchRequirementMarkers() {
        String answer = "EXIGENCES FONCTIONNELLES:\n- a\nEXIGENCES NON-FONCTIONNELLES:\n- b";

        SectionExtractor.Sections sections = SectionExtractor.split(answer, FUNCTIONAL_MARKERS, NON_FUNCTIONAL_MARKERS);

        assertEquals("- a", sections.first());
        assertEquals("- b", sections.second());
    }

    @Test
    void testMissingMarkersYieldEmptySections() {
        SectionExtractor.Sections sections = SectionExtractor.split("no headings at all", ENDPOINT_MARKERS, DATA_MODEL_MARKERS);

        assertEquals("", sections.first());
        assertEquals("", sections.second());
        assertEquals(new SectionExtractor.Sections("", ""), SectionExtractor.split(null, ENDPOINT_MARKERS, DATA_MODEL_MARKERS));
    }

    @Test
    void testOnlySecondSectionPresent() {
        SectionExtractor.Sections sections = SectionExtractor.split("intro\nDATA MODEL: User(id, email)", ENDPOINT_MARKERS, DATA_MODEL_MARKERS);

        assertEquals("", sections.first());
        assertEquals("User(id, email)", sections.second());
    }

    @Test
    void testBulletsAcceptDashAndStarWithIndentation() {
        String section = "  - GET /users\n* POST /users\n-not a bullet\nplain line\n   *   DELETE /users/{id}  ";

        assertEquals(List.of("GET /users", "POST /users", "DELETE /users/{id}"), SectionExtractor.bullets(section));
        assertTrue(SectionExtractor.bullets(null).isEmpty());
    }

    @Test
    void testNameBeforeColon() {
        assertEquals("Users API", SectionExtractor.nameBeforeColon("Users API: CRUD for accounts", "API"));
        assertEquals("API", SectionExtractor.nameBeforeColon("Build the users endpoints", "API"));
        assertEquals("API", SectionExtractor.nameBeforeColon(": leading colon", "API"));
    }
}
