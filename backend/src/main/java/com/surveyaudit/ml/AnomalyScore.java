package com.surveyaudit.ml;

/**
 * 单条记录的异常评分。数据不足时 score 为 null，不给出数值。
 */
public record AnomalyScore(int recordIndex, Double score, boolean flagged, boolean insufficientData) {

    public static AnomalyScore insufficient(int recordIndex) {
        return new AnomalyScore(recordIndex, null, false, true);
    }
}
