package com.surveyaudit.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * 模型制品的不可变版本引用
 *
 * @param id               版本 ID，格式 {@code <family>@v<n>}
 * @param family           模型族
 * @param versionNumber    版本号
 * @param artifactLocation 制品位置，由模型存储协作方解析
 * @param metrics          训练/校准指标
 * @param parentVersionId  增量训练的父版本，创世版本为 null
 * @param createdAt        发布时间
 */
public record ModelVersion(
        String id,
        ModelFamily family,
        int versionNumber,
        String artifactLocation,
        Map<String, Double> metrics,
        String parentVersionId,
        Instant createdAt) {

    public ModelVersion {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static String idOf(ModelFamily family, int versionNumber) {
        return family.name().toLowerCase(Locale.ROOT) + "@v" + versionNumber;
    }
}
