package com.surveyaudit.service;

import java.util.Map;

/**
 * 两个规则版本的参数差异
 *
 * @param fromVersion 基准版本
 * @param toVersion   对比版本
 * @param added       新增参数
 * @param removed     删除参数
 * @param modified    修改参数：键 → {old, new}
 */
public record RuleVersionDiff(
        String fromVersion,
        String toVersion,
        Map<String, Object> added,
        Map<String, Object> removed,
        Map<String, Map<String, Object>> modified) {

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }
}
