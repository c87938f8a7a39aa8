package com.surveyaudit.service;

import com.surveyaudit.exception.UnknownCheckException;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.CheckSource;
import com.surveyaudit.model.QualityCheck;
import com.surveyaudit.model.Severity;
import com.surveyaudit.rule.checker.ModelBackedChecker;
import com.surveyaudit.rule.checker.QualityChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 检查项注册表：内置检查器策略 + 默认检查项目录 + 自定义检查项
 */
@Service
public class RuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<String, QualityChecker> checkerMap;
    private final Map<String, QualityCheck> checks = new ConcurrentHashMap<>();

    public RuleRegistry(List<QualityChecker> checkers) {
        this.checkerMap = checkers.stream()
                .collect(Collectors.toMap(QualityChecker::name, c -> c, (a, b) -> {
                    throw new IllegalStateException("检查器名称重复: " + a.name());
                }, TreeMap::new));
        for (QualityCheck check : buildDefaultChecks()) {
            if (!checkerMap.containsKey(check.getCheckerName())) {
                log.warn("默认检查项 {} 绑定的检查器 {} 未注册", check.getId(), check.getCheckerName());
            }
            checks.put(check.getId(), check);
        }
        log.info("加载了 {} 个内置检查器, {} 条默认检查项", checkerMap.size(), checks.size());
    }

    /**
     * 全部检查项，按 ID 排序
     */
    public List<QualityCheck> all() {
        return checks.values().stream()
                .sorted(Comparator.comparing(QualityCheck::getId))
                .toList();
    }

    public Optional<QualityCheck> find(String checkId) {
        return Optional.ofNullable(checks.get(checkId));
    }

    public QualityCheck get(String checkId) {
        QualityCheck check = checks.get(checkId);
        if (check == null) {
            throw new UnknownCheckException(checkId);
        }
        return check;
    }

    public Optional<QualityChecker> checker(String checkerName) {
        return Optional.ofNullable(checkerMap.get(checkerName));
    }

    public Set<String> checkerNames() {
        return Collections.unmodifiableSet(checkerMap.keySet());
    }

    /**
     * 绑定到指定检查器的检查项
     */
    public List<QualityCheck> checksForChecker(String checkerName) {
        return all().stream().filter(c -> checkerName.equals(c.getCheckerName())).toList();
    }

    /**
     * 注册自定义检查项。只能绑定已注册的检查器，不能覆盖默认检查项。
     */
    public QualityCheck register(QualityCheck check) {
        if (check.getId() == null || check.getId().isBlank()) {
            throw new IllegalArgumentException("检查项 ID 不能为空");
        }
        QualityChecker checker = checkerMap.get(check.getCheckerName());
        if (checker == null) {
            throw new IllegalArgumentException("未知的检查器: " + check.getCheckerName());
        }
        QualityCheck existing = checks.get(check.getId());
        if (existing != null && existing.getSource() == CheckSource.DEFAULT) {
            throw new IllegalArgumentException("不能覆盖默认检查项: " + check.getId());
        }
        QualityCheck normalized = QualityCheck.builder()
                .id(check.getId())
                .name(check.getName() != null ? check.getName() : check.getId())
                .description(check.getDescription())
                .category(check.getCategory() != null ? check.getCategory() : checker.category())
                .severity(check.getSeverity() != null ? check.getSeverity() : Severity.MEDIUM)
                .checkerName(check.getCheckerName())
                .defaultParameters(check.getDefaultParameters() != null ? check.getDefaultParameters() : Map.of())
                .source(CheckSource.CUSTOM)
                .build();
        checks.put(normalized.getId(), normalized);
        log.info("注册自定义检查项 {} -> {}", normalized.getId(), normalized.getCheckerName());
        return normalized;
    }

    /**
     * 创世版本参数：检查器默认值被检查项默认参数覆盖
     */
    public Map<String, Object> genesisParameters(QualityCheck check) {
        Map<String, Object> params = new TreeMap<>();
        checker(check.getCheckerName()).ifPresent(c -> params.putAll(c.defaultParameters()));
        if (check.getDefaultParameters() != null) {
            params.putAll(check.getDefaultParameters());
        }
        return params;
    }

    public boolean isModelBacked(QualityCheck check) {
        return checker(check.getCheckerName()).map(c -> c instanceof ModelBackedChecker).orElse(false);
    }

    private List<QualityCheck> buildDefaultChecks() {
        List<QualityCheck> list = new ArrayList<>();

        // ========== 重复 ==========
        list.add(check("QC_DUP_01", "标识字段重复", "邮箱、IP、样本库 ID 等标识字段归一化后相同",
                CheckCategory.DUPLICATE, Severity.HIGH, "IDENTIFIER_DUPLICATE", Map.of()));
        list.add(check("QC_DUP_02", "作答内容重复", "作答向量一致率达到阈值的近似重复记录",
                CheckCategory.DUPLICATE, Severity.HIGH, "RESPONSE_VECTOR_DUPLICATE", Map.of()));

        // ========== 作答模式 ==========
        list.add(check("QC_PAT_01", "直线作答", "矩阵题组作答方差过低",
                CheckCategory.PATTERN, Severity.MEDIUM, "STRAIGHTLINER", Map.of()));
        list.add(check("QC_PAT_02", "锯齿/对角线作答", "题组作答呈交替或等差序列",
                CheckCategory.PATTERN, Severity.MEDIUM, "ZIGZAG_PATTERN", Map.of()));
        list.add(check("QC_PAT_03", "敷衍作答模式", "基于模式特征的敷衍作答概率模型",
                CheckCategory.PATTERN, Severity.MEDIUM, "SATISFICING_PATTERN", Map.of()));

        // ========== 作答行为 ==========
        list.add(check("QC_BEH_01", "作答过快", "完成耗时低于绝对下限、分位数或中位数比例",
                CheckCategory.BEHAVIORAL, Severity.HIGH, "SPEEDER", Map.of()));
        list.add(check("QC_BEH_02", "作答过慢", "完成耗时超过 均值 + k·标准差",
                CheckCategory.BEHAVIORAL, Severity.LOW, "SLOW_RESPONSE", Map.of()));
        list.add(check("QC_BEH_03", "机器人作答", "多模型集成的机器人作答概率",
                CheckCategory.BEHAVIORAL, Severity.CRITICAL, "BOT_ENSEMBLE", Map.of()));
        list.add(check("QC_BEH_04", "异常记录", "孤立森林异常得分位于高分位",
                CheckCategory.BEHAVIORAL, Severity.MEDIUM, "ISOLATION_ANOMALY", Map.of()));

        // ========== 领域规则 ==========
        list.add(check("QC_DOM_01", "数值越界", "数值超出声明的取值范围",
                CheckCategory.DOMAIN_SPECIFIC, Severity.MEDIUM, "NUMERIC_RANGE", Map.of()));
        list.add(check("QC_DOM_02", "选项越界", "分类题答案不在允许的选项内",
                CheckCategory.DOMAIN_SPECIFIC, Severity.MEDIUM, "CATEGORY_DOMAIN", Map.of()));
        list.add(check("QC_DOM_03", "逻辑矛盾", "交叉字段的声明式逻辑规则不成立",
                CheckCategory.DOMAIN_SPECIFIC, Severity.HIGH, "LOGICAL_CONSISTENCY", Map.of()));
        list.add(check("QC_DOM_04", "日期异常", "未来日期、过早日期或结束早于开始",
                CheckCategory.DOMAIN_SPECIFIC, Severity.MEDIUM, "DATE_ANOMALY", Map.of()));
        list.add(check("QC_DOM_05", "非目标人群", "人口属性不满足目标人群条件",
                CheckCategory.DOMAIN_SPECIFIC, Severity.HIGH, "TARGET_AUDIENCE", Map.of()));
        list.add(check("QC_DOM_06", "主题认知不足", "知识题答对数量不足",
                CheckCategory.DOMAIN_SPECIFIC, Severity.MEDIUM, "TOPIC_AWARENESS", Map.of()));
        list.add(check("QC_DOM_07", "品牌回忆无效", "品牌回答不在预期品牌列表中",
                CheckCategory.DOMAIN_SPECIFIC, Severity.MEDIUM, "BRAND_RECALL", Map.of()));
        list.add(check("QC_DOM_08", "封闭题与开放题矛盾", "开放题回答未体现封闭题的选择",
                CheckCategory.DOMAIN_SPECIFIC, Severity.MEDIUM, "CLOSED_OPEN_CONSISTENCY", Map.of()));

        // ========== 内容质量 ==========
        list.add(check("QC_CON_01", "必答题缺失", "必答字段未作答",
                CheckCategory.CONTENT_QUALITY, Severity.HIGH, "REQUIRED_FIELDS", Map.of()));
        list.add(check("QC_CON_02", "章节未完成", "章节作答比例过低",
                CheckCategory.CONTENT_QUALITY, Severity.MEDIUM, "SECTION_COMPLETENESS", Map.of()));
        list.add(check("QC_CON_03", "缺失率过高", "整条记录缺失字段占比过高",
                CheckCategory.CONTENT_QUALITY, Severity.MEDIUM, "MISSING_RATE", Map.of()));
        list.add(check("QC_CON_04", "数值离群", "数值字段 Z 分数超过阈值",
                CheckCategory.CONTENT_QUALITY, Severity.LOW, "ZSCORE_OUTLIER", Map.of()));
        list.add(check("QC_CON_05", "类型不符", "值无法按声明类型解释",
                CheckCategory.CONTENT_QUALITY, Severity.HIGH, "DATA_TYPE", Map.of()));
        list.add(check("QC_CON_06", "格式不一致", "值不符合字段格式正则",
                CheckCategory.CONTENT_QUALITY, Severity.LOW, "FORMAT_CONSISTENCY", Map.of()));
        list.add(check("QC_CON_07", "开放题过短", "开放题回答词数过少",
                CheckCategory.CONTENT_QUALITY, Severity.LOW, "TEXT_BREVITY", Map.of()));
        list.add(check("QC_CON_08", "无意义文本", "键盘乱敲、重复字符等无意义回答",
                CheckCategory.CONTENT_QUALITY, Severity.HIGH, "GARBAGE_TEXT", Map.of()));
        list.add(check("QC_CON_09", "不当用语", "开放题含脏话或侮辱性用语",
                CheckCategory.CONTENT_QUALITY, Severity.MEDIUM, "PROFANITY", Map.of()));
        list.add(check("QC_CON_10", "语言不符", "开放题语言不在预期语言之内",
                CheckCategory.CONTENT_QUALITY, Severity.MEDIUM, "LANGUAGE_MISMATCH", Map.of()));
        list.add(check("QC_CON_11", "文本质量低", "开放题的可读性与语法质量过低",
                CheckCategory.CONTENT_QUALITY, Severity.LOW, "LOW_TEXT_QUALITY", Map.of()));
        list.add(check("QC_CON_12", "开放题雷同", "开放题回答之间 TF-IDF 相似度过高",
                CheckCategory.CONTENT_QUALITY, Severity.HIGH, "OPEN_END_SIMILARITY", Map.of()));

        // ========== 情感 ==========
        list.add(check("QC_SEN_01", "极端情感", "开放题情感得分极端",
                CheckCategory.SENTIMENT, Severity.LOW, "EXTREME_SENTIMENT", Map.of()));
        list.add(check("QC_SEN_02", "情感矛盾", "开放题之间或与评分之间情感矛盾",
                CheckCategory.SENTIMENT, Severity.MEDIUM, "SENTIMENT_CONSISTENCY", Map.of()));

        return list;
    }

    private static QualityCheck check(String id, String name, String description, CheckCategory category,
                                      Severity severity, String checkerName, Map<String, Object> params) {
        return QualityCheck.builder()
                .id(id).name(name).description(description)
                .category(category).severity(severity)
                .checkerName(checkerName).defaultParameters(params)
                .source(CheckSource.DEFAULT).build();
    }
}
