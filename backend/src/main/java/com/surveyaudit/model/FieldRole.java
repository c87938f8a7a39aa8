package com.surveyaudit.model;

/**
 * 字段在问卷中的语义角色，用于计时、去重和机器人特征提取
 */
public enum FieldRole {
    NONE,
    /** 受访者编号，作为记录 ID */
    RESPONDENT_ID,
    START_TIME,
    END_TIME,
    DURATION_SECONDS,
    /** 每道题的作答时间戳 */
    QUESTION_TIMESTAMP,
    IP_ADDRESS
}
