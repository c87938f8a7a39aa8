package com.surveyaudit.service;

/**
 * 一次运行中选中的检查项
 *
 * @param checkId       检查项 ID
 * @param ruleVersionId 固定的规则版本，为 null 时使用当前激活版本
 */
public record CheckSelection(String checkId, String ruleVersionId) {

    public static CheckSelection active(String checkId) {
        return new CheckSelection(checkId, null);
    }
}
