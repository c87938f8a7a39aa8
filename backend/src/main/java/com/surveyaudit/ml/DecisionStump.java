package com.surveyaudit.ml;

/**
 * 单层决策树：feature ≤ threshold 取左叶，否则取右叶；叶值为正例概率
 */
public record DecisionStump(int feature, double threshold, double leftValue, double rightValue) {

    public double predict(double[] x) {
        return x[feature] <= threshold ? leftValue : rightValue;
    }

    public boolean goesLeft(double[] x) {
        return x[feature] <= threshold;
    }
}
