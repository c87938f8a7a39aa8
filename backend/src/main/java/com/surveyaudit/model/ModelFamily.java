package com.surveyaudit.model;

/**
 * 模型族，每次运行为每个族固定一个模型版本
 */
public enum ModelFamily {
    BOT, ANOMALY, PATTERN, TEXT
}
