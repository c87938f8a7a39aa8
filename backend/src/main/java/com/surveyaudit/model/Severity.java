package com.surveyaudit.model;

/**
 * 问题严重等级
 */
public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL
}
