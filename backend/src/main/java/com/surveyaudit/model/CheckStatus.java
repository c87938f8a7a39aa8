package com.surveyaudit.model;

/**
 * 单个检查项在一次运行中的结果状态
 */
public enum CheckStatus {
    COMPLETED,
    /** 检查项、规则版本或模型版本无法解析，跳过执行 */
    MISCONFIGURED,
    /** 检查内部异常，已隔离 */
    FAILED,
    /** 超出时间预算，部分结果已丢弃 */
    TIMEOUT,
    /** 数据量不足，检测器拒绝打分 */
    INSUFFICIENT_DATA,
    /** 运行被取消 */
    CANCELLED,
    /** 当前激活版本为停用状态 */
    DISABLED
}
