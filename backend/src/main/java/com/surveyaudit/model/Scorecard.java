package com.surveyaudit.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 质量评分卡：始终由当前有效问题集合投影得到，不作为持久化数据源
 */
@Value
@Builder
public class Scorecard {

    String datasetId;

    int totalRecords;

    /** 参与计分的问题数（排除已驳回、已解决） */
    int activeIssues;

    double meanScore;

    double medianScore;

    /** 低分位得分，分位数可配置 */
    double lowPercentileScore;

    /** 至少有一个有效问题的记录占比 */
    double flaggedRatio;

    Map<Severity, Integer> severityCounts;

    Map<CheckCategory, Integer> categoryCounts;

    List<RecordScore> records;
}
