package com.surveyaudit.ml;

import java.util.Arrays;
import java.util.List;

/**
 * 逻辑回归。不可变，增量训练返回新实例。
 */
public final class LogisticModel {

    private final double bias;
    private final double[] weights;

    public LogisticModel(double bias, double[] weights) {
        this.bias = bias;
        this.weights = weights.clone();
    }

    public double probability(double[] x) {
        return sigmoid(bias + dot(x));
    }

    /**
     * 在当前参数基础上按样本顺序做 SGD，返回新模型
     */
    public LogisticModel withUpdate(List<LabeledSample> samples, double learningRate, int epochs) {
        return withUpdate(samples, null, learningRate, epochs);
    }

    /**
     * 只使用 featureIndexes 指定的特征列训练（子模型）
     */
    public LogisticModel withUpdate(List<LabeledSample> samples, int[] featureIndexes, double learningRate, int epochs) {
        double b = bias;
        double[] w = weights.clone();
        for (int epoch = 0; epoch < epochs; epoch++) {
            for (LabeledSample sample : samples) {
                double[] x = project(sample.features(), featureIndexes);
                double z = b;
                for (int i = 0; i < w.length; i++) {
                    z += w[i] * x[i];
                }
                double error = sigmoid(z) - sample.label();
                b -= learningRate * error;
                for (int i = 0; i < w.length; i++) {
                    w[i] -= learningRate * error * x[i];
                }
            }
        }
        return new LogisticModel(b, w);
    }

    static double[] project(double[] features, int[] indexes) {
        if (indexes == null) {
            return features;
        }
        double[] x = new double[indexes.length];
        for (int i = 0; i < indexes.length; i++) {
            x[i] = features[indexes[i]];
        }
        return x;
    }

    private double dot(double[] x) {
        if (x.length != weights.length) {
            throw new IllegalArgumentException("特征维度 " + x.length + " 与模型维度 " + weights.length + " 不符");
        }
        double z = 0.0;
        for (int i = 0; i < weights.length; i++) {
            z += weights[i] * x[i];
        }
        return z;
    }

    public static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }

    public double bias() {
        return bias;
    }

    public double[] weights() {
        return weights.clone();
    }

    public int dimension() {
        return weights.length;
    }

    @Override
    public String toString() {
        return "LogisticModel{bias=" + bias + ", weights=" + Arrays.toString(weights) + "}";
    }
}
