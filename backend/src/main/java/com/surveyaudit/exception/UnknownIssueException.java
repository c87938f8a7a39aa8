package com.surveyaudit.exception;

public class UnknownIssueException extends RuntimeException {

    public UnknownIssueException(String issueId) {
        super("问题不存在: " + issueId);
    }
}
