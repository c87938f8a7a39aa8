package com.surveyaudit.ml;

import java.util.ArrayList;
import java.util.List;

/**
 * 决策树桩森林，输出各树叶值的平均
 */
public final class StumpForest {

    /** 叶值重估时旧叶值折算的伪样本数 */
    private static final double PRIOR_WEIGHT = 2.0;

    private final List<DecisionStump> stumps;

    public StumpForest(List<DecisionStump> stumps) {
        if (stumps.isEmpty()) {
            throw new IllegalArgumentException("森林至少需要一棵树");
        }
        this.stumps = List.copyOf(stumps);
    }

    public double probability(double[] x) {
        double sum = 0.0;
        for (DecisionStump stump : stumps) {
            sum += stump.predict(x);
        }
        return sum / stumps.size();
    }

    /**
     * 保持分裂点不变，用标注样本重估叶值，返回新森林
     */
    public StumpForest withReestimatedLeaves(List<LabeledSample> samples) {
        List<DecisionStump> updated = new ArrayList<>(stumps.size());
        for (DecisionStump stump : stumps) {
            double leftPos = 0, leftCount = 0, rightPos = 0, rightCount = 0;
            for (LabeledSample sample : samples) {
                if (stump.goesLeft(sample.features())) {
                    leftPos += sample.label();
                    leftCount++;
                } else {
                    rightPos += sample.label();
                    rightCount++;
                }
            }
            double left = (PRIOR_WEIGHT * stump.leftValue() + leftPos) / (PRIOR_WEIGHT + leftCount);
            double right = (PRIOR_WEIGHT * stump.rightValue() + rightPos) / (PRIOR_WEIGHT + rightCount);
            updated.add(new DecisionStump(stump.feature(), stump.threshold(), left, right));
        }
        return new StumpForest(updated);
    }

    public List<DecisionStump> stumps() {
        return stumps;
    }
}
