package com.surveyaudit.service;

import com.surveyaudit.model.ModelFamily;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 检测运行请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

    /** 运行 ID，为空时自动生成 */
    private String runId;

    private String datasetId;

    /** 选中的检查项，为空时运行全部检查项 */
    private List<String> checkIds;

    /** 检查项 → 固定的规则版本，未列出的使用当前激活版本 */
    private Map<String, String> ruleVersions;

    /** 模型族 → 固定的模型版本，未列出的族取提交时的当前版本 */
    private Map<ModelFamily, String> modelPins;

    /** 日期类检查的参考时间 */
    private Instant referenceTime;
}
