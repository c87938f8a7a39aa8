package com.surveyaudit.ml;

/**
 * 审核结果转换得到的训练样本：APPROVED 为正例，REJECTED 为负例
 */
public record LabeledSample(int recordIndex, double[] features, boolean positive) {

    public double label() {
        return positive ? 1.0 : 0.0;
    }
}
