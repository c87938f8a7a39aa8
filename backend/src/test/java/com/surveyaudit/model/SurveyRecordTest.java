package com.surveyaudit.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.surveyaudit.TestDatasets.*;
import static org.junit.jupiter.api.Assertions.*;

class SurveyRecordTest {

    @Test
    void shouldTakeRecordIdFromRespondentField() {
        Dataset withId = dataset("ds", List.of(withRole("rid", FieldType.IDENTIFIER, FieldRole.RESPONDENT_ID), numeric("q1")),
                List.of(row("rid", "A-17", "q1", 1)));
        Dataset withoutId = dataset("ds", List.of(numeric("q1")), List.of(row("q1", 1), row("q1", 2)));

        assertEquals("A-17", withId.record(0).recordId());
        assertEquals("r1", withoutId.record(1).recordId());
    }

    @Test
    void shouldRejectUndeclaredFieldsAndBlankId() {
        assertThrows(IllegalArgumentException.class,
                () -> dataset("ds", List.of(numeric("q1")), List.of(row("q1", 1, "q9", 2))));
        assertThrows(IllegalArgumentException.class,
                () -> dataset(" ", List.of(numeric("q1")), List.of()));
    }

    @Test
    void shouldCoerceNumericAndDatetimeValues() {
        Dataset ds = dataset("ds", List.of(numeric("a"), numeric("b"), numeric("c"), text("d1"), text("d2"), numeric("d3")),
                List.of(row("a", " 4.5 ", "b", "abc", "c", true,
                        "d1", "2024-05-01T10:00:00+02:00", "d2", "2024-05-01", "d3", 0)));
        SurveyRecord r = ds.record(0);

        assertEquals(4.5, r.numeric("a"));
        assertNull(r.numeric("b"));
        assertEquals(1.0, r.numeric("c"));
        assertEquals(Instant.parse("2024-05-01T08:00:00Z"), r.datetime("d1"));
        assertEquals(Instant.parse("2024-05-01T00:00:00Z"), r.datetime("d2"));
        assertEquals(Instant.EPOCH, r.datetime("d3"));
    }

    @Test
    void shouldTreatBlankAsMissingAndMissingAsConforming() {
        Dataset ds = dataset("ds", List.of(text("t"), numeric("n"), text("blank")),
                List.of(row("t", 42, "n", "x", "blank", "   ")));
        SurveyRecord r = ds.record(0);

        assertTrue(r.isMissing("blank"));
        assertNull(r.text("blank"));
        assertTrue(r.conformsTo("blank", FieldType.NUMERIC));
        assertFalse(r.conformsTo("t", FieldType.TEXT));
        assertFalse(r.conformsTo("n", FieldType.NUMERIC));
        assertTrue(r.conformsTo("t", FieldType.CATEGORICAL));
    }

    @Test
    void shouldComputeTimingFromStartAndEnd() {
        Dataset ds = dataset("ds", List.of(
                        withRole("start", FieldType.DATETIME, FieldRole.START_TIME),
                        withRole("end", FieldType.DATETIME, FieldRole.END_TIME),
                        numeric("q1")),
                List.of(row("start", "2024-05-01T10:00:00Z", "end", "2024-05-01T10:10:00Z", "q1", 3)));

        assertEquals(600.0, ds.record(0).metadata().completionSeconds());
    }

    @Test
    void shouldPreferDurationFieldOverTimestamps() {
        Dataset ds = dataset("ds", List.of(
                        withRole("secs", FieldType.NUMERIC, FieldRole.DURATION_SECONDS),
                        withRole("start", FieldType.DATETIME, FieldRole.START_TIME),
                        withRole("end", FieldType.DATETIME, FieldRole.END_TIME)),
                List.of(row("secs", 95, "start", "2024-05-01T10:00:00Z", "end", "2024-05-01T10:10:00Z")));

        assertEquals(95.0, ds.record(0).metadata().completionSeconds());
    }

    @Test
    void shouldDeriveGapsSectionsAndTokens() {
        Dataset ds = dataset("ds", List.of(
                        FieldDefinition.builder().name("t1").type(FieldType.DATETIME).role(FieldRole.QUESTION_TIMESTAMP).section("A").build(),
                        FieldDefinition.builder().name("t2").type(FieldType.DATETIME).role(FieldRole.QUESTION_TIMESTAMP).section("A").build(),
                        FieldDefinition.builder().name("t3").type(FieldType.DATETIME).role(FieldRole.QUESTION_TIMESTAMP).section("B").build(),
                        FieldDefinition.builder().name("q1").type(FieldType.NUMERIC).section("B").build(),
                        text("comment")),
                List.of(row("t1", "2024-05-01T10:00:00Z", "t2", "2024-05-01T10:00:30Z", "t3", "2024-05-01T10:02:00Z",
                        "comment", "fast and easy survey")));

        RecordMetadata meta = ds.record(0).metadata();

        assertEquals(List.of(30.0, 90.0), meta.questionGaps());
        assertEquals(120.0, meta.completionSeconds());
        assertEquals(Map.of("A", 1.0, "B", 0.5), meta.sectionFillRates());
        assertEquals(30.0, meta.sectionSeconds().get("A"));
        assertEquals(4, meta.tokenCounts().get("comment"));
        assertEquals(0.2, meta.missingRatio(), 1e-9);
        assertSame(meta, ds.record(0).metadata());
    }
}
