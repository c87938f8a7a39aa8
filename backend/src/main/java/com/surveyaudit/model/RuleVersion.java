package com.surveyaudit.model;

import java.time.Instant;

/**
 * 检查项配置的不可变快照。新版本只追加，回滚即重新激活旧版本。
 *
 * @param id            版本 ID，格式 {@code <checkId>@v<n>}
 * @param checkId       所属检查项
 * @param versionNumber 版本号，从 1 开始
 * @param severity      严重等级
 * @param enabled       是否启用
 * @param parameters    参数快照
 * @param author        作者
 * @param comment       变更说明
 * @param createdAt     创建时间
 */
public record RuleVersion(
        String id,
        String checkId,
        int versionNumber,
        Severity severity,
        boolean enabled,
        CheckParameters parameters,
        String author,
        String comment,
        Instant createdAt) {

    public static String idOf(String checkId, int versionNumber) {
        return checkId + "@v" + versionNumber;
    }
}
