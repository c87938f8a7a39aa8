package com.surveyaudit.model;

/**
 * 检查项来源: DEFAULT（内置默认）, CUSTOM（用户注册）
 */
public enum CheckSource {
    DEFAULT, CUSTOM
}
