package com.surveyaudit.ml;

import com.surveyaudit.model.ModelFamily;

import java.util.*;

/**
 * 机器人识别集成模型：全特征逻辑回归 + 决策树桩森林 + 时序逻辑回归，
 * 加权软投票后做 Platt 校准。
 */
public final class BotEnsembleModel implements ModelArtifact {

    public static final String LOGISTIC = "logistic";
    public static final String FOREST = "forest";
    public static final String TIMING = "timing";

    /** 时序子模型使用的特征列：快速作答占比、节奏规律性、相对速度 */
    static final int[] TIMING_FEATURES = {
            BotFeatureExtractor.FAST_GAP_RATIO,
            BotFeatureExtractor.TIMING_REGULARITY,
            BotFeatureExtractor.SPEED
    };

    private final LogisticModel logistic;
    private final StumpForest forest;
    private final LogisticModel timing;
    private final Map<String, Double> weights;
    private final double plattA;
    private final double plattB;

    public BotEnsembleModel(LogisticModel logistic, StumpForest forest, LogisticModel timing,
                            Map<String, Double> weights, double plattA, double plattB) {
        if (logistic.dimension() != BotFeatureExtractor.DIMENSION) {
            throw new IllegalArgumentException("逻辑回归成员维度应为 " + BotFeatureExtractor.DIMENSION);
        }
        if (timing.dimension() != TIMING_FEATURES.length) {
            throw new IllegalArgumentException("时序成员维度应为 " + TIMING_FEATURES.length);
        }
        this.logistic = logistic;
        this.forest = forest;
        this.timing = timing;
        this.weights = normalize(weights);
        this.plattA = plattA;
        this.plattB = plattB;
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.BOT;
    }

    public BotScore score(double[] features) {
        Map<String, Double> outputs = memberOutputs(features);
        Map<String, BotScore.MemberScore> members = new LinkedHashMap<>();
        double raw = 0.0;
        for (Map.Entry<String, Double> e : outputs.entrySet()) {
            double w = weights.get(e.getKey());
            double contribution = w * e.getValue();
            raw += contribution;
            members.put(e.getKey(), new BotScore.MemberScore(e.getValue(), w, contribution));
        }
        double calibrated = LogisticModel.sigmoid(plattA * raw + plattB);
        return new BotScore(calibrated, raw, Collections.unmodifiableMap(members));
    }

    private Map<String, Double> memberOutputs(double[] features) {
        Map<String, Double> outputs = new LinkedHashMap<>();
        outputs.put(LOGISTIC, logistic.probability(features));
        outputs.put(FOREST, forest.probability(features));
        outputs.put(TIMING, timing.probability(LogisticModel.project(features, TIMING_FEATURES)));
        return outputs;
    }

    /**
     * 增量训练：逻辑回归成员 SGD、森林叶值重估，并按各成员在样本上的准确率重新分配投票权重
     */
    public BotEnsembleModel withUpdate(List<LabeledSample> samples, double learningRate, int epochs) {
        LogisticModel nextLogistic = logistic.withUpdate(samples, learningRate, epochs);
        StumpForest nextForest = forest.withReestimatedLeaves(samples);
        LogisticModel nextTiming = timing.withUpdate(samples, TIMING_FEATURES, learningRate, epochs);
        BotEnsembleModel candidate = new BotEnsembleModel(nextLogistic, nextForest, nextTiming, weights, plattA, plattB);

        Map<String, Double> accuracy = new LinkedHashMap<>();
        for (String member : weights.keySet()) {
            accuracy.put(member, 0.0);
        }
        for (LabeledSample sample : samples) {
            candidate.memberOutputs(sample.features()).forEach((member, p) -> {
                if ((p >= 0.5) == sample.positive()) {
                    accuracy.merge(member, 1.0, Double::sum);
                }
            });
        }
        Map<String, Double> nextWeights = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            // 旧权重作为平滑先验，防止单个成员权重归零
            double acc = samples.isEmpty() ? 0.5 : accuracy.get(e.getKey()) / samples.size();
            nextWeights.put(e.getKey(), 0.5 * e.getValue() + 0.5 * acc);
        }
        return new BotEnsembleModel(nextLogistic, nextForest, nextTiming, nextWeights, plattA, plattB);
    }

    private static Map<String, Double> normalize(Map<String, Double> weights) {
        for (String member : List.of(LOGISTIC, FOREST, TIMING)) {
            if (!weights.containsKey(member) || weights.get(member) < 0) {
                throw new IllegalArgumentException("缺少或非法的成员权重: " + member);
            }
        }
        double total = weights.get(LOGISTIC) + weights.get(FOREST) + weights.get(TIMING);
        if (total <= 0) {
            throw new IllegalArgumentException("成员权重之和必须大于 0");
        }
        Map<String, Double> normalized = new LinkedHashMap<>();
        normalized.put(LOGISTIC, weights.get(LOGISTIC) / total);
        normalized.put(FOREST, weights.get(FOREST) / total);
        normalized.put(TIMING, weights.get(TIMING) / total);
        return Collections.unmodifiableMap(normalized);
    }

    public Map<String, Double> weights() {
        return weights;
    }

    public LogisticModel logistic() {
        return logistic;
    }

    public StumpForest forest() {
        return forest;
    }

    public LogisticModel timing() {
        return timing;
    }
}
