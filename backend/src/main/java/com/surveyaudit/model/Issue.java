package com.surveyaudit.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 单条质量问题：某条记录未通过某个检查项。
 * <p>
 * 引擎创建后不再修改；审核状态变更通过 {@code toBuilder()} 生成新值替换。
 */
@Value
@Builder(toBuilder = true)
public class Issue {

    /** 确定性 ID：相同数据集、规则版本和记录总是得到相同 ID */
    String id;

    String datasetId;

    /** 记录在导入顺序中的位置 */
    int recordIndex;

    String recordId;

    String checkId;

    String checkerName;

    CheckCategory category;

    /** 检测时激活的规则版本 */
    String ruleVersionId;

    /** 模型驱动检查项使用的模型版本，确定性检查为 null */
    String modelVersionId;

    Severity severity;

    /** 置信度，范围 [0,1] */
    double confidence;

    /** 可读的问题说明 */
    String explanation;

    /** 命中的字段或文本片段 */
    String matchedText;

    /** 附加信息，如集成模型各成员贡献、重复簇信息 */
    Map<String, Object> details;

    @Builder.Default
    IssueStatus status = IssueStatus.OPEN;

    Instant detectedAt;

    String reviewedBy;

    Instant reviewedAt;
}
