package com.surveyaudit.ml;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.Dataset;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyDetectorTest {

    private final AnomalyDetector detector = new AnomalyDetector();

    @Test
    void shouldReportInsufficientDataBelowMinimumFold() {
        List<AnomalyScore> scores = detector.score(dataset(5, -1), List.of(), DefaultModels.anomaly());

        assertEquals(5, scores.size());
        for (AnomalyScore s : scores) {
            assertTrue(s.insufficientData());
            assertNull(s.score());
            assertFalse(s.flagged());
        }
    }

    @Test
    void shouldFlagExtremeRecord() {
        List<AnomalyScore> scores = detector.score(dataset(60, 30), List.of(), DefaultModels.anomaly());

        AnomalyScore top = scores.stream().max(Comparator.comparingDouble(AnomalyScore::score)).orElseThrow();
        assertEquals(30, top.recordIndex());
        assertTrue(top.flagged());
        assertTrue(scores.stream().filter(AnomalyScore::flagged).count() < 10);
    }

    @Test
    void shouldProduceSameScoresOnRepeatedRuns() {
        Dataset dataset = dataset(40, 7);

        List<AnomalyScore> first = detector.score(dataset, List.of("q1", "q2"), DefaultModels.anomaly());
        List<AnomalyScore> second = detector.score(dataset, List.of("q1", "q2"), DefaultModels.anomaly());

        assertEquals(first, second);
    }

    @Test
    void shouldRejectUnknownFeatureField() {
        assertThrows(MisconfiguredCheckException.class,
                () -> detector.score(dataset(20, -1), List.of("income"), DefaultModels.anomaly()));
    }

    private static Dataset dataset(int size, int outlier) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (i == outlier) {
                rows.add(TestDatasets.row("q1", 1000, "q2", 1000, "q3", -1000));
            } else {
                rows.add(TestDatasets.row("q1", i % 5 + 1, "q2", (i * 3) % 7 + 1, "q3", (i * 2) % 4 + 1));
            }
        }
        return TestDatasets.dataset("anomaly-" + size, List.of(
                TestDatasets.numeric("q1"), TestDatasets.numeric("q2"), TestDatasets.numeric("q3")), rows);
    }
}
