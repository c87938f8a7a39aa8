package com.surveyaudit.model;

/**
 * 检查项分类
 */
public enum CheckCategory {
    DUPLICATE, PATTERN, CONTENT_QUALITY, BEHAVIORAL, DOMAIN_SPECIFIC, SENTIMENT
}
