package com.surveyaudit.rule.checker;

/**
 * 检查器可声明依赖的共享派生数据
 */
public enum DerivedInput {
    /** 计时、章节完成度、缺失率等记录元数据 */
    RECORD_METADATA,
    /** 文本字段的 NLP 分析结果（按固定的文本模型版本） */
    TEXT_ANALYSIS
}
