package com.surveyaudit.exception;

/**
 * 激活或回滚引用了检查项版本链之外的版本
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }
}
