package com.surveyaudit.ml;

import com.surveyaudit.model.ModelFamily;

import java.util.List;

/**
 * 敷衍作答模式模型：序列特征上的逻辑回归。推理无状态，不跨记录记忆。
 */
public final class PatternModel implements ModelArtifact {

    private final LogisticModel classifier;

    public PatternModel(LogisticModel classifier) {
        if (classifier.dimension() != PatternFeatures.DIMENSION) {
            throw new IllegalArgumentException("模式模型维度应为 " + PatternFeatures.DIMENSION);
        }
        this.classifier = classifier;
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.PATTERN;
    }

    public double probability(double[] features) {
        return classifier.probability(features);
    }

    public PatternModel withUpdate(List<LabeledSample> samples, double learningRate, int epochs) {
        return new PatternModel(classifier.withUpdate(samples, learningRate, epochs));
    }

    public LogisticModel classifier() {
        return classifier;
    }
}
