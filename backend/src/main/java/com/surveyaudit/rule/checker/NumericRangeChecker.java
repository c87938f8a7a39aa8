package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.CheckParameters;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 数值超出声明区间。参数 ranges: 字段 → {min, max}
 */
@Component
public class NumericRangeChecker implements QualityChecker {

    @Override
    public String name() {
        return "NUMERIC_RANGE";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.DOMAIN_SPECIFIC;
    }

    @Override
    public boolean partitionable() {
        return true;
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        CheckParameters rangeParams = CheckParameters.of(ctx.parameters().getMap("ranges"));
        Map<String, Object> ranges = rangeParams.asMap();
        ctx.requireFields(ranges.keySet());

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            for (Map.Entry<String, Object> e : ranges.entrySet()) {
                Double v = r.numeric(e.getKey());
                if (v == null || !(e.getValue() instanceof Map<?, ?>)) {
                    continue;
                }
                CheckParameters range = CheckParameters.of(rangeParams.getMap(e.getKey()));
                double min = range.getDouble("min", Double.NEGATIVE_INFINITY);
                double max = range.getDouble("max", Double.POSITIVE_INFINITY);
                if (v < min || v > max) {
                    findings.add(Finding.of(r.index(), e.getKey(), 1.0,
                                    "字段 " + e.getKey() + " 的值 " + v + " 超出区间 [" + min + ", " + max + "]",
                                    String.valueOf(r.raw(e.getKey())))
                            .withDetails(Map.of("field", e.getKey(), "value", v, "min", min, "max", max)));
                }
            }
        }
        return CheckOutcome.of(findings);
    }
}
