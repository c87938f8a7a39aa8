package com.surveyaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 检查项定义。具体阈值与开关由当前激活的 {@link RuleVersion} 决定。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityCheck {

    /** 检查项唯一标识 */
    private String id;

    /** 检查项名称 */
    private String name;

    /** 检查项描述 */
    private String description;

    /** 分类 */
    private CheckCategory category;

    /** 默认严重等级，写入创世版本 */
    private Severity severity;

    /** 绑定的内置检查器名称 */
    private String checkerName;

    /** 创世版本参数，未给出的键使用检查器默认值 */
    private Map<String, Object> defaultParameters;

    /** 来源: DEFAULT, CUSTOM */
    private CheckSource source;
}
