package com.surveyaudit.rule.checker;

import java.util.ArrayList;
import java.util.List;

/**
 * 检查器执行结果：发现列表，或“数据不足、拒绝评分”
 */
public record CheckOutcome(List<Finding> findings, String insufficientDataReason) {

    public static CheckOutcome of(List<Finding> findings) {
        return new CheckOutcome(List.copyOf(findings), null);
    }

    public static CheckOutcome empty() {
        return new CheckOutcome(List.of(), null);
    }

    public static CheckOutcome insufficientData(String reason) {
        return new CheckOutcome(List.of(), reason);
    }

    public boolean isInsufficientData() {
        return insufficientDataReason != null;
    }

    /**
     * 合并同一检查项各分片的结果；任一分片数据不足则整体数据不足
     */
    public static CheckOutcome merge(List<CheckOutcome> parts) {
        List<Finding> all = new ArrayList<>();
        for (CheckOutcome part : parts) {
            if (part.isInsufficientData()) {
                return part;
            }
            all.addAll(part.findings());
        }
        return of(all);
    }
}
