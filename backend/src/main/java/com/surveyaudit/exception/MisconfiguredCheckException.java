package com.surveyaudit.exception;

/**
 * 检查器发现参数与数据集不匹配（如绑定了不存在的字段）。
 * 由调度器捕获并标记为 MISCONFIGURED，不影响其他检查项。
 */
public class MisconfiguredCheckException extends RuntimeException {

    public MisconfiguredCheckException(String message) {
        super(message);
    }
}
