package com.surveyaudit.ml;

import java.util.List;
import java.util.Map;

/**
 * 各模型族的创世制品
 */
public final class DefaultModels {

    private DefaultModels() {
    }

    public static BotEnsembleModel bot() {
        LogisticModel logistic = new LogisticModel(-4.0,
                new double[]{1.5, 1.5, 1.0, 1.5, 2.5, 1.5, 2.0, 2.0, 1.5});
        StumpForest forest = new StumpForest(List.of(
                new DecisionStump(BotFeatureExtractor.FAST_GAP_RATIO, 0.5, 0.1, 0.9),
                new DecisionStump(BotFeatureExtractor.TIMING_REGULARITY, 0.7, 0.1, 0.8),
                new DecisionStump(BotFeatureExtractor.SPEED, 0.6, 0.1, 0.85),
                new DecisionStump(BotFeatureExtractor.IP_REUSE, 0.3, 0.1, 0.8),
                new DecisionStump(BotFeatureExtractor.REPETITION, 0.5, 0.1, 0.8),
                new DecisionStump(BotFeatureExtractor.KEYBOARD, 0.5, 0.15, 0.9),
                new DecisionStump(BotFeatureExtractor.LOW_ENTROPY, 0.6, 0.1, 0.7)));
        LogisticModel timing = new LogisticModel(-3.5, new double[]{3.0, 2.0, 2.5});
        return new BotEnsembleModel(logistic, forest, timing,
                Map.of(BotEnsembleModel.LOGISTIC, 0.4, BotEnsembleModel.FOREST, 0.35, BotEnsembleModel.TIMING, 0.25),
                8.0, -4.0);
    }

    public static AnomalyModel anomaly() {
        return new AnomalyModel(100, 256, 42L, 95.0, 0.5, 10);
    }

    public static PatternModel pattern() {
        return new PatternModel(new LogisticModel(-5.0, new double[]{2.0, 3.0, 3.0, 3.0, 1.5, 2.0}));
    }
}
