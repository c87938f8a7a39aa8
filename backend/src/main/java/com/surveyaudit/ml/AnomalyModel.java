package com.surveyaudit.ml;

import com.surveyaudit.model.ModelFamily;

/**
 * 异常检测模型参数：森林规模、子样本、随机种子，以及判定阈值（分位数 + 最低分）
 *
 * @param numTrees         树的数量
 * @param subsampleSize    每棵树的子样本数 ψ
 * @param seed             随机种子
 * @param cutoffPercentile 分位数阈值，得分不低于该分位数才标记
 * @param minScore         最低异常分
 * @param minFoldSize      最小训练样本数，低于此值不评分
 */
public record AnomalyModel(
        int numTrees,
        int subsampleSize,
        long seed,
        double cutoffPercentile,
        double minScore,
        int minFoldSize) implements ModelArtifact {

    public AnomalyModel {
        if (numTrees <= 0 || subsampleSize < 2) {
            throw new IllegalArgumentException("numTrees 必须为正且 subsampleSize 不小于 2");
        }
        if (cutoffPercentile <= 0 || cutoffPercentile > 100) {
            throw new IllegalArgumentException("cutoffPercentile 超出范围 (0,100]: " + cutoffPercentile);
        }
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.ANOMALY;
    }

    public AnomalyModel withCalibration(double cutoffPercentile, double minScore) {
        return new AnomalyModel(numTrees, subsampleSize, seed, cutoffPercentile, minScore, minFoldSize);
    }
}
