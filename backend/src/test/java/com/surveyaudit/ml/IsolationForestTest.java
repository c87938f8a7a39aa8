package com.surveyaudit.ml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IsolationForestTest {

    @Test
    void shouldScoreIsolatedPointAboveCluster() {
        double[][] data = new double[50][];
        for (int i = 0; i < 49; i++) {
            data[i] = new double[]{(i % 7) * 0.1, (i % 5) * 0.1};
        }
        data[49] = new double[]{25.0, -25.0};

        IsolationForest forest = IsolationForest.fit(data, 100, 256, 42L);

        double outlier = forest.score(data[49]);
        for (int i = 0; i < 49; i++) {
            assertTrue(outlier > forest.score(data[i]));
        }
        assertTrue(outlier > 0.6);
    }

    @Test
    void shouldBeDeterministicForFixedSeed() {
        double[][] data = new double[30][];
        for (int i = 0; i < 30; i++) {
            data[i] = new double[]{i, (i * 17) % 11};
        }

        IsolationForest first = IsolationForest.fit(data, 50, 16, 7L);
        IsolationForest second = IsolationForest.fit(data, 50, 16, 7L);

        for (double[] row : data) {
            assertEquals(first.score(row), second.score(row), 0.0);
        }
    }

    @Test
    void shouldUseHarmonicAveragePathLength() {
        assertEquals(0.0, IsolationForest.averagePathLength(1), 1e-12);
        assertEquals(1.0, IsolationForest.averagePathLength(2), 1e-12);
        assertEquals(2.0 * (Math.log(255) + 0.5772156649) - 2.0 * 255 / 256,
                IsolationForest.averagePathLength(256), 1e-9);
    }

    @Test
    void shouldRejectEmptyTrainingData() {
        assertThrows(IllegalArgumentException.class, () -> IsolationForest.fit(new double[0][], 10, 8, 1L));
    }
}
