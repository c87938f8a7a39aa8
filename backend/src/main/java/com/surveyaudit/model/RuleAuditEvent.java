package com.surveyaudit.model;

import java.time.Instant;
import java.util.Map;

/**
 * 规则配置审计事件。审计日志只追加，是“哪套配置产生了这些问题”的唯一依据。
 *
 * @param sequence    全局顺序号
 * @param action      操作
 * @param checkId     检查项
 * @param fromVersion 操作前激活的版本，可为 null
 * @param toVersion   操作涉及的版本
 * @param author      操作人
 * @param timestamp   时间
 * @param diff        参数差异：键 → {old, new}
 */
public record RuleAuditEvent(
        long sequence,
        Action action,
        String checkId,
        String fromVersion,
        String toVersion,
        String author,
        Instant timestamp,
        Map<String, Map<String, Object>> diff) {

    public enum Action {
        PROPOSE, ACTIVATE, ROLLBACK
    }
}
