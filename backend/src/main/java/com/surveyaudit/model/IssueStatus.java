package com.surveyaudit.model;

/**
 * 问题审核状态，仅由外部审核流程修改
 */
public enum IssueStatus {
    OPEN, APPROVED, REJECTED, RESOLVED
}
