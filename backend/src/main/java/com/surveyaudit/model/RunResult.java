package com.surveyaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 一次检测运行的结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResult {

    /** 运行 ID */
    private String runId;

    /** 数据集 ID */
    private String datasetId;

    private Instant startedAt;

    private Instant finishedAt;

    /** 总耗时（毫秒） */
    private long elapsedMillis;

    /** 记录总数 */
    private int totalRecords;

    /** 本次运行产生的全部问题 */
    private List<Issue> issues;

    /** 各检查项执行状态 */
    private List<CheckExecution> checkStatuses;

    /** 模型族 → 固定的模型版本 ID */
    private Map<ModelFamily, String> modelPins;

    /** 各严重等级问题数 */
    private Map<Severity, Integer> severityCounts;

    /** 运行是否被取消 */
    private boolean cancelled;
}
