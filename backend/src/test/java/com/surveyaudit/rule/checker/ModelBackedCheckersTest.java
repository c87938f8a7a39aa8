package com.surveyaudit.rule.checker;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.ml.DefaultModels;
import com.surveyaudit.ml.ModelArtifact;
import com.surveyaudit.model.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelBackedCheckersTest {

    private static final Instant START = Instant.parse("2024-04-20T10:00:00Z");

    @Test
    void shouldFlagBotLikeRecordsWithMemberBreakdown() {
        BotEnsembleChecker checker = new BotEnsembleChecker();
        Dataset dataset = botDataset();

        CheckOutcome outcome = checker.check(context(dataset, checker.defaultParameters(), DefaultModels.bot(), "bot@v1"));

        assertEquals(List.of(6, 7, 8, 9), outcome.findings().stream().map(Finding::recordIndex).toList());
        Finding finding = outcome.findings().get(0);
        assertTrue(finding.confidence() >= 0.7);
        Map<?, ?> members = (Map<?, ?>) finding.details().get("members");
        assertEquals(List.of("forest", "logistic", "timing"), List.copyOf(members.keySet()));
        Map<?, ?> features = (Map<?, ?>) finding.details().get("features");
        assertEquals(1.0, (double) features.get("fastGapRatio"), 1e-9);
        assertEquals(0.75, (double) features.get("ipReuse"), 1e-9);
    }

    @Test
    void shouldRejectForeignModelArtifact() {
        BotEnsembleChecker checker = new BotEnsembleChecker();

        assertThrows(MisconfiguredCheckException.class, () -> checker.check(
                context(botDataset(), checker.defaultParameters(), DefaultModels.pattern(), "pattern@v1")));
    }

    @Test
    void shouldFlagIsolatedRecordOnlyInsideOwnRange() {
        IsolationAnomalyChecker checker = new IsolationAnomalyChecker();
        Dataset dataset = anomalyDataset(60, 30);

        CheckOutcome whole = checker.check(context(dataset, Map.of(), DefaultModels.anomaly(), "anomaly@v1"));
        CheckOutcome head = checker.check(CheckContext.builder()
                .dataset(dataset)
                .toIndex(20)
                .modelArtifact(DefaultModels.anomaly())
                .build());

        assertTrue(whole.findings().stream().anyMatch(f -> f.recordIndex() == 30));
        assertTrue(head.findings().stream().allMatch(f -> f.recordIndex() < 20));
    }

    @Test
    void shouldRefuseToScoreTinyDatasets() {
        IsolationAnomalyChecker checker = new IsolationAnomalyChecker();

        CheckOutcome outcome = checker.check(context(anomalyDataset(5, -1), Map.of(), DefaultModels.anomaly(), "anomaly@v1"));

        assertTrue(outcome.isInsufficientData());
        assertTrue(outcome.findings().isEmpty());
    }

    @Test
    void shouldFlagSatisficingSequences() {
        SatisficingPatternChecker checker = new SatisficingPatternChecker();
        Dataset dataset = TestDatasets.battery("satisficing", List.of(
                new double[]{3, 3, 3, 3, 3, 3, 3, 3, 3, 3},
                new double[]{2, 4, 1, 5, 3, 3, 2, 5, 1, 4},
                new double[]{3, 3, 3}));

        CheckOutcome outcome = checker.check(context(dataset, checker.defaultParameters(), DefaultModels.pattern(), "pattern@v1"));

        assertEquals(1, outcome.findings().size());
        assertEquals(0, outcome.findings().get(0).recordIndex());
        assertTrue(outcome.findings().get(0).confidence() > 0.9);
    }

    private static CheckContext context(Dataset dataset, Map<String, Object> parameters,
                                        ModelArtifact artifact, String versionId) {
        ModelVersion version = new ModelVersion(versionId, artifact.family(), 1, "memory:" + versionId,
                Map.of(), null, START);
        return CheckContext.builder()
                .dataset(dataset)
                .parameters(CheckParameters.of(parameters))
                .modelVersion(version)
                .modelArtifact(artifact)
                .build();
    }

    /**
     * 前 6 条为正常作答，后 4 条共用内网 IP、题间隔 0.5 秒、乱敲文本
     */
    private static Dataset botDataset() {
        List<FieldDefinition> fields = new ArrayList<>();
        fields.add(TestDatasets.withRole("ip", FieldType.IDENTIFIER, FieldRole.IP_ADDRESS));
        fields.add(TestDatasets.withRole("duration", FieldType.NUMERIC, FieldRole.DURATION_SECONDS));
        fields.add(TestDatasets.text("comment"));
        for (int t = 1; t <= 6; t++) {
            fields.add(TestDatasets.withRole("t" + t, FieldType.DATETIME, FieldRole.QUESTION_TIMESTAMP));
        }
        String[] comments = {
                "The staff were friendly and helpful",
                "Delivery took longer than promised",
                "Prices went up since last year",
                "Great selection of fresh produce",
                "Checkout lines move slowly on weekends",
                "Parking is hard to find downtown"};
        long[] humanGaps = {20, 45, 13, 60, 30};

        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            boolean bot = i >= 6;
            Map<String, Object> row = TestDatasets.row(
                    "ip", bot ? "10.0.0.1" : "8.8." + i + ".1",
                    "duration", bot ? 30 : 600,
                    "comment", bot ? "asdf asdf asdf asdf" : comments[i]);
            Instant t = START.plusSeconds(3600L * i);
            row.put("t1", t.toString());
            for (int q = 2; q <= 6; q++) {
                t = bot ? t.plusMillis(500) : t.plusSeconds(humanGaps[q - 2]);
                row.put("t" + q, t.toString());
            }
            rows.add(row);
        }
        return TestDatasets.dataset("bots", fields, rows);
    }

    private static Dataset anomalyDataset(int size, int outlier) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            rows.add(i == outlier
                    ? TestDatasets.row("q1", 1000, "q2", 1000)
                    : TestDatasets.row("q1", i % 5 + 1, "q2", (i * 3) % 7 + 1));
        }
        return TestDatasets.dataset("anomaly", List.of(TestDatasets.numeric("q1"), TestDatasets.numeric("q2")), rows);
    }
}
