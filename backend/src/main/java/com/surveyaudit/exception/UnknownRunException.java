package com.surveyaudit.exception;

public class UnknownRunException extends RuntimeException {

    public UnknownRunException(String runId) {
        super("检测运行不存在: " + runId);
    }
}
