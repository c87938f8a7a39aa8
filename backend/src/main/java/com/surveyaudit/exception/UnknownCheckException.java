package com.surveyaudit.exception;

/**
 * 引用了不存在的检查项
 */
public class UnknownCheckException extends RuntimeException {

    private final String checkId;

    public UnknownCheckException(String checkId) {
        super("未知的检查项: " + checkId);
        this.checkId = checkId;
    }

    public String getCheckId() {
        return checkId;
    }
}
