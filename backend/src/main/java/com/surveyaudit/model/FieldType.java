package com.surveyaudit.model;

/**
 * 字段声明类型
 */
public enum FieldType {
    NUMERIC, CATEGORICAL, TEXT, DATETIME, IDENTIFIER
}
