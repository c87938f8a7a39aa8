package com.surveyaudit.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 单条记录的质量得分
 */
@Value
@Builder
public class RecordScore {

    int recordIndex;

    String recordId;

    /** 0 ~ 100，越高越好 */
    double score;

    int issueCount;

    /** 分类 → 扣分 */
    Map<CheckCategory, Double> deductions;
}
