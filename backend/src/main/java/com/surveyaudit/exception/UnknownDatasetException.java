package com.surveyaudit.exception;

public class UnknownDatasetException extends RuntimeException {

    public UnknownDatasetException(String datasetId) {
        super("数据集不存在: " + datasetId);
    }
}
