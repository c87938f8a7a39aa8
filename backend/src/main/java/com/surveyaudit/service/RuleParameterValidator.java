package com.surveyaudit.service;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.rule.checker.Condition;
import com.surveyaudit.rule.checker.QualityChecker;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 规则参数校验：与检查器默认值的类型兼容、正则可编译、数值范围合法、声明式条件可解析。
 * 校验失败抛出 {@link IllegalArgumentException}，错误信息汇总全部问题。
 */
@Component
public class RuleParameterValidator {

    /** 取值必须在 [0,1] 的参数 */
    private static final Set<String> UNIT_INTERVAL = Set.of(
            "similarityThreshold", "threshold", "garbageThreshold", "minQuality", "minFillRate",
            "maxMissingRatio", "extremeThreshold", "minRatio", "medianRatio");

    /** 取值必须在 (0,100] 的参数 */
    private static final Set<String> PERCENTILES = Set.of("percentile", "cutoffPercentile");

    /** 必须为正整数的参数 */
    private static final Set<String> POSITIVE_INTEGERS = Set.of(
            "minItems", "minRecords", "minWords", "minTokens", "minAnswered", "ipReuseSaturation", "timeoutMillis");

    public void validate(QualityChecker checker, Map<String, ?> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return;
        }
        List<String> errors = new ArrayList<>();
        Map<String, Object> defaults = checker.defaultParameters();
        for (Map.Entry<String, ?> e : parameters.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (value == null) {
                continue;
            }
            Object reference = defaults.get(key);
            if (reference != null && !compatible(reference, value)) {
                errors.add(key + " 类型应为 " + typeName(reference) + "，实际为 " + typeName(value));
                continue;
            }
            checkBounds(key, value, errors);
        }
        checkPatterns(parameters.get("patterns"), errors);
        checkRules(parameters.get("rules"), errors);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("参数校验失败: " + String.join("; ", errors));
        }
    }

    private boolean compatible(Object reference, Object value) {
        if (reference instanceof Number) {
            return value instanceof Number || isNumeric(value);
        }
        if (reference instanceof Boolean) {
            return value instanceof Boolean
                    || "true".equalsIgnoreCase(value.toString()) || "false".equalsIgnoreCase(value.toString());
        }
        if (reference instanceof Collection) {
            return value instanceof Collection || value instanceof String;
        }
        if (reference instanceof Map) {
            return value instanceof Map;
        }
        return true;
    }

    private void checkBounds(String key, Object value, List<String> errors) {
        Double number = value instanceof Number n ? Double.valueOf(n.doubleValue())
                : isNumeric(value) ? Double.valueOf(value.toString().trim()) : null;
        if (number == null) {
            if (UNIT_INTERVAL.contains(key) || PERCENTILES.contains(key) || POSITIVE_INTEGERS.contains(key)) {
                errors.add(key + " 必须为数值");
            }
            return;
        }
        if (number.isNaN() || number.isInfinite()) {
            errors.add(key + " 不是有限数值");
        } else if (UNIT_INTERVAL.contains(key) && (number < 0 || number > 1)) {
            errors.add(key + " 必须在 [0,1] 内: " + number);
        } else if (PERCENTILES.contains(key) && (number <= 0 || number > 100)) {
            errors.add(key + " 必须在 (0,100] 内: " + number);
        } else if (POSITIVE_INTEGERS.contains(key) && (number < 1 || number != Math.floor(number))) {
            errors.add(key + " 必须为正整数: " + number);
        } else if (number < 0) {
            errors.add(key + " 不能为负数: " + number);
        }
    }

    private void checkPatterns(Object patterns, List<String> errors) {
        if (patterns == null) {
            return;
        }
        if (!(patterns instanceof Map<?, ?> map)) {
            errors.add("patterns 必须是 字段 → 正则 的对象");
            return;
        }
        map.forEach((field, regex) -> {
            try {
                Pattern.compile(String.valueOf(regex));
            } catch (PatternSyntaxException ex) {
                errors.add("字段 " + field + " 的正则无法编译: " + ex.getDescription());
            }
        });
    }

    private void checkRules(Object rules, List<String> errors) {
        if (rules == null) {
            return;
        }
        if (!(rules instanceof Collection<?> list)) {
            errors.add("rules 必须是规则列表");
            return;
        }
        int i = 0;
        for (Object rule : list) {
            i++;
            if (!(rule instanceof Map<?, ?> spec)) {
                errors.add("第 " + i + " 条规则必须是对象");
                continue;
            }
            try {
                Condition.parse(spec.get("if"));
                Condition.parse(spec.get("then"));
            } catch (MisconfiguredCheckException ex) {
                errors.add("第 " + i + " 条规则无效: " + ex.getMessage());
            }
        }
    }

    private static boolean isNumeric(Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            return false;
        }
        try {
            Double.parseDouble(s.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String typeName(Object value) {
        if (value instanceof Number) {
            return "数值";
        }
        if (value instanceof Boolean) {
            return "布尔";
        }
        if (value instanceof Collection) {
            return "列表";
        }
        if (value instanceof Map) {
            return "对象";
        }
        return "字符串";
    }
}
