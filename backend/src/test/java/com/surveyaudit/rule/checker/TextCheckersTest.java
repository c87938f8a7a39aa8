package com.surveyaudit.rule.checker;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.config.EngineProperties;
import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.*;
import com.surveyaudit.nlp.NlpEngine;
import com.surveyaudit.nlp.TextModel;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TextCheckersTest {

    private static final TextModel MODEL = TextModel.loadDefault(0.5);
    private static final ModelVersion VERSION = new ModelVersion("text@v1", ModelFamily.TEXT, 1,
            TextModel.DEFAULT_LOCATION, Map.of(), null, Instant.parse("2024-01-01T00:00:00Z"));

    private final NlpEngine nlpEngine = new NlpEngine(new EngineProperties());

    private final Dataset dataset = TestDatasets.dataset("feedback", List.of(
            TestDatasets.numeric("rating"), TestDatasets.text("liked"), TestDatasets.text("improve")), List.of(
            TestDatasets.row("rating", 5, "liked", "The staff were friendly and the room was clean",
                    "improve", "Breakfast could start a little earlier"),
            TestDatasets.row("rating", 5, "liked", "qwerty!!!! zzzzzzz", "improve", "ok"),
            TestDatasets.row("rating", 5, "liked", "This hotel is shit and the staff were awful",
                    "improve", "Terrible awful noisy rooms"),
            TestDatasets.row("rating", 4, "liked", "the staff were friendly and the room was clean!",
                    "improve", "El desayuno es muy caro y la comida no es buena"),
            TestDatasets.row("rating", 3, "liked", "", "improve", "")));

    @Test
    void shouldFlagGarbageText() {
        CheckOutcome outcome = run(new GarbageTextChecker(), Map.of());

        assertEquals(1, outcome.findings().size());
        assertEquals(1, outcome.findings().get(0).recordIndex());
        assertEquals("liked", outcome.findings().get(0).key());
    }

    @Test
    void shouldFlagBriefAnswersButSkipEmptyOnes() {
        CheckOutcome outcome = run(new TextBrevityChecker(), Map.of("textFields", List.of("improve")));

        assertEquals(1, outcome.findings().size());
        assertEquals(1, outcome.findings().get(0).recordIndex());
        assertEquals(1, outcome.findings().get(0).details().get("words"));
    }

    @Test
    void shouldFlagProfanity() {
        CheckOutcome outcome = run(new ProfanityChecker(), Map.of());

        assertEquals(1, outcome.findings().size());
        assertEquals(2, outcome.findings().get(0).recordIndex());
        assertEquals(List.of("shit"), outcome.findings().get(0).details().get("terms"));
    }

    @Test
    void shouldFlagAnswersInUnexpectedLanguage() {
        LanguageMismatchChecker checker = new LanguageMismatchChecker();

        CheckOutcome outcome = run(checker, checker.defaultParameters());
        CheckOutcome withSpanish = run(checker, Map.of("expectedLanguages", List.of("en", "es")));

        assertTrue(outcome.findings().stream()
                .anyMatch(f -> f.recordIndex() == 3 && f.key().equals("improve")
                        && "es".equals(f.details().get("language"))));
        assertTrue(withSpanish.findings().stream().noneMatch(f -> f.recordIndex() == 3));
    }

    @Test
    void shouldClusterCopiedOpenEnds() {
        OpenEndSimilarityChecker checker = new OpenEndSimilarityChecker();

        CheckOutcome outcome = run(checker, Map.of("textFields", List.of("liked")));

        assertEquals(1, outcome.findings().size());
        Finding finding = outcome.findings().get(0);
        assertEquals(3, finding.recordIndex());
        assertEquals(0, finding.details().get("canonicalRecordIndex"));
    }

    @Test
    void shouldFlagRatingContradictingSentiment() {
        SentimentConsistencyChecker checker = new SentimentConsistencyChecker();

        CheckOutcome outcome = run(checker, Map.of("ratingField", "rating", "textFields", List.of("improve")));

        assertTrue(outcome.findings().stream().anyMatch(f -> f.recordIndex() == 2 && f.key().equals("rating")));
        assertTrue(outcome.findings().stream().noneMatch(f -> f.recordIndex() == 0));
    }

    @Test
    void shouldRequirePinnedTextModel() {
        CheckContext ctx = CheckContext.builder()
                .dataset(dataset)
                .nlpEngine(nlpEngine)
                .modelVersion(VERSION)
                .build();

        assertThrows(MisconfiguredCheckException.class, () -> new GarbageTextChecker().check(ctx));
    }

    private CheckOutcome run(QualityChecker checker, Map<String, Object> parameters) {
        return checker.check(CheckContext.builder()
                .dataset(dataset)
                .parameters(CheckParameters.of(checker.defaultParameters()).merge(parameters))
                .modelVersion(VERSION)
                .modelArtifact(MODEL)
                .nlpEngine(nlpEngine)
                .build());
    }
}
