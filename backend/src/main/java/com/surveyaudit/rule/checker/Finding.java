package com.surveyaudit.rule.checker;

import com.surveyaudit.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 检查器产出的单条发现，由调度器转换为 Issue
 *
 * @param recordIndex 记录下标
 * @param key         同一记录上区分多条发现的键（如字段名），参与 Issue ID 计算
 * @param confidence  置信度 [0,1]
 * @param message     说明
 * @param matchedText 命中内容
 * @param details     附加信息
 * @param severity    覆盖规则版本的严重等级，可为 null
 */
public record Finding(
        int recordIndex,
        String key,
        double confidence,
        String message,
        String matchedText,
        Map<String, Object> details,
        Severity severity) {

    public Finding {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("置信度超出 [0,1]: " + confidence);
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Finding of(int recordIndex, String key, double confidence, String message, String matchedText) {
        return new Finding(recordIndex, key, confidence, message, matchedText, Map.of(), null);
    }

    public Finding withDetails(Map<String, Object> details) {
        return new Finding(recordIndex, key, confidence, message, matchedText, details, severity);
    }

    public Finding withSeverity(Severity severity) {
        return new Finding(recordIndex, key, confidence, message, matchedText, details, severity);
    }
}
