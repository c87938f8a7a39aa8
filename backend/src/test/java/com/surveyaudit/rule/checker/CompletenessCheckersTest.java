package com.surveyaudit.rule.checker;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CompletenessCheckersTest {

    private final Dataset dataset = TestDatasets.dataset("sections", List.of(
            field("a1", "A"), field("a2", "A"), field("b1", "B"), field("b2", "B")), List.of(
            TestDatasets.row("a1", 1, "a2", 2, "b1", 3, "b2", 4),
            TestDatasets.row("a1", 1, "a2", "", "b1", 3, "b2", 4),
            TestDatasets.row("a1", 1, "a2", 2, "b1", "", "b2", " "),
            TestDatasets.row("a1", "", "a2", "", "b1", "", "b2", 4)));

    @Test
    void shouldFlagMissingRequiredFields() {
        RequiredFieldsChecker checker = new RequiredFieldsChecker();

        CheckOutcome outcome = checker.check(context(Map.of("fields", List.of("a1", "a2"))));

        assertEquals(3, outcome.findings().size());
        assertEquals("a2", outcome.findings().get(0).key());
        assertEquals(1, outcome.findings().get(0).recordIndex());
    }

    @Test
    void shouldDoNothingWithoutRequiredFields() {
        assertTrue(new RequiredFieldsChecker().check(context(Map.of())).findings().isEmpty());
    }

    @Test
    void shouldFlagSectionsBelowFillRate() {
        SectionCompletenessChecker checker = new SectionCompletenessChecker();

        CheckOutcome outcome = checker.check(context(Map.of("minFillRate", 0.6)));

        assertEquals(4, outcome.findings().size());
        assertTrue(outcome.findings().stream().anyMatch(f -> f.recordIndex() == 2 && f.key().equals("B")));
        assertEquals(2, outcome.findings().stream().filter(f -> f.recordIndex() == 3).count());
    }

    @Test
    void shouldLimitToConfiguredSections() {
        SectionCompletenessChecker checker = new SectionCompletenessChecker();

        CheckOutcome outcome = checker.check(context(Map.of("minFillRate", 0.6, "sections", List.of("A"))));

        assertEquals(List.of(1, 3), outcome.findings().stream().map(Finding::recordIndex).toList());
    }

    @Test
    void shouldFlagRecordsAboveMissingRatio() {
        MissingRateChecker checker = new MissingRateChecker();

        CheckOutcome outcome = checker.check(context(checker.defaultParameters()));

        assertEquals(List.of(2, 3), outcome.findings().stream().map(Finding::recordIndex).toList());
        assertEquals(0.75, (double) outcome.findings().get(1).details().get("missingRatio"), 1e-9);
    }

    private CheckContext context(Map<String, Object> parameters) {
        return CheckContext.builder()
                .dataset(dataset)
                .parameters(CheckParameters.of(parameters))
                .build();
    }

    private static FieldDefinition field(String name, String section) {
        return FieldDefinition.builder().name(name).type(FieldType.NUMERIC).section(section).build();
    }
}
