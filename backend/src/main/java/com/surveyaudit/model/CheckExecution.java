package com.surveyaudit.model;

import lombok.Builder;
import lombok.Value;

/**
 * 单个检查项的执行记录
 */
@Value
@Builder
public class CheckExecution {

    String checkId;

    String checkerName;

    String ruleVersionId;

    String modelVersionId;

    CheckStatus status;

    /** 非 COMPLETED 状态时的原因 */
    String reason;

    int issueCount;

    long elapsedMillis;

    /** 执行分片数，未分片时为 1 */
    int partitions;
}
