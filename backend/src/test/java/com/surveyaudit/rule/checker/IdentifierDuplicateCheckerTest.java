package com.surveyaudit.rule.checker;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.model.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierDuplicateCheckerTest {

    private final IdentifierDuplicateChecker checker = new IdentifierDuplicateChecker();

    @Test
    void shouldFlagLaterRecordsOfSharedEmailAgainstFirstImported() {
        CheckOutcome outcome = run(TestDatasets.emailDuplicates(), Map.of("fields", List.of("email")));

        assertEquals(2, outcome.findings().size());
        Finding first = outcome.findings().get(0);
        Finding second = outcome.findings().get(1);
        assertEquals(47, first.recordIndex());
        assertEquals(81, second.recordIndex());
        assertEquals(3, first.details().get("canonicalRecordIndex"));
        assertEquals("R3", first.details().get("canonicalRecordId"));
        assertEquals(List.of(3, 47, 81), first.details().get("clusterMembers"));
        assertEquals(List.of("email"), first.details().get("matchedFields"));
    }

    @Test
    void shouldPickSameCanonicalUnderAnyImportPermutationOfValues() {
        List<Map<String, Object>> rows = new ArrayList<>();
        String[] emails = {"a@x.com", "b@x.com", "A@X.com", "c@x.com", "a+survey@x.com"};
        for (int i = 0; i < emails.length; i++) {
            rows.add(TestDatasets.row("email", emails[i]));
        }
        Dataset dataset = TestDatasets.dataset("perm", List.of(TestDatasets.identifier("email")), rows);

        CheckOutcome outcome = run(dataset, Map.of());

        assertEquals(List.of(2, 4), outcome.findings().stream().map(Finding::recordIndex).toList());
        outcome.findings().forEach(f -> assertEquals(0, f.details().get("canonicalRecordIndex")));
    }

    @Test
    void shouldKeepCaseWhenConfiguredCaseSensitive() {
        Dataset dataset = TestDatasets.dataset("case", List.of(TestDatasets.identifier("panel")), List.of(
                TestDatasets.row("panel", "ABC"),
                TestDatasets.row("panel", "abc")));

        CheckOutcome outcome = run(dataset, Map.of("caseInsensitive", false));

        assertTrue(outcome.findings().isEmpty());
    }

    @Test
    void shouldRequireAllFieldsInAllMode() {
        Dataset dataset = TestDatasets.dataset("all", List.of(
                TestDatasets.identifier("email"), TestDatasets.identifier("ip")), List.of(
                TestDatasets.row("email", "a@x.com", "ip", "1.1.1.1"),
                TestDatasets.row("email", "a@x.com", "ip", "2.2.2.2"),
                TestDatasets.row("email", "a@x.com", "ip", "1.1.1.1")));

        CheckOutcome any = run(dataset, Map.of());
        CheckOutcome all = run(dataset, Map.of("matchMode", "ALL"));

        assertEquals(2, any.findings().size());
        assertEquals(1, all.findings().size());
        assertEquals(2, all.findings().get(0).recordIndex());
    }

    @Test
    void shouldIgnoreMissingIdentifierValues() {
        Map<String, Object> blank = new HashMap<>();
        blank.put("email", null);
        Dataset dataset = TestDatasets.dataset("nulls", List.of(TestDatasets.identifier("email")),
                List.of(blank, TestDatasets.row("email", ""), TestDatasets.row("email", "  ")));

        assertTrue(run(dataset, Map.of()).findings().isEmpty());
    }

    private CheckOutcome run(Dataset dataset, Map<String, Object> overrides) {
        return checker.check(CheckContext.builder()
                .dataset(dataset)
                .parameters(CheckParameters.of(checker.defaultParameters()).merge(overrides))
                .build());
    }
}
