package com.surveyaudit.exception;

/**
 * 已处于创世版本，无法继续回滚
 */
public class NoPriorVersionException extends VersionConflictException {

    public NoPriorVersionException(String checkId) {
        super("检查项 " + checkId + " 已是创世版本，无可回滚的版本");
    }
}
