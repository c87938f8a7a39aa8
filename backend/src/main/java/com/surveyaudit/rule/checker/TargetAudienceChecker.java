package com.surveyaudit.rule.checker;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 目标人群筛选：参数 criteria 为 字段 → {allowed: [...]} 或 {min, max}，
 * 不满足任一条件的记录视为不在目标人群内
 */
@Component
public class TargetAudienceChecker implements QualityChecker {

    @Override
    public String name() {
        return "TARGET_AUDIENCE";
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
    public Map<String, Object> defaultParameters() {
        return Map.of("flagMissing", false);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        Map<String, Object> criteria = ctx.parameters().getMap("criteria");
        ctx.requireFields(criteria.keySet());
        boolean flagMissing = ctx.parameters().getBoolean("flagMissing", false);
        Map<String, Criterion> parsed = new TreeMap<>();
        criteria.forEach((field, spec) -> parsed.put(field, Criterion.parse(field, spec)));

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            List<String> failed = new ArrayList<>();
            for (Map.Entry<String, Criterion> e : parsed.entrySet()) {
                String field = e.getKey();
                if (r.isMissing(field)) {
                    if (flagMissing) {
                        failed.add(field);
                    }
                    continue;
                }
                if (!e.getValue().accepts(r, field)) {
                    failed.add(field);
                }
            }
            if (!failed.isEmpty()) {
                StringBuilder matched = new StringBuilder();
                for (String f : failed) {
                    if (matched.length() > 0) {
                        matched.append(", ");
                    }
                    matched.append(f).append('=').append(r.raw(f));
                }
                findings.add(Finding.of(r.index(), "audience", 1.0,
                                "不符合目标人群条件: " + String.join(", ", failed), matched.toString())
                        .withDetails(Map.of("failedCriteria", failed)));
            }
        }
        return CheckOutcome.of(findings);
    }

    private record Criterion(Set<String> allowed, Double min, Double max) {

        static Criterion parse(String field, Object spec) {
            if (!(spec instanceof Map<?, ?> m)) {
                throw new MisconfiguredCheckException("字段 " + field + " 的目标人群条件必须是对象");
            }
            Set<String> allowed = null;
            if (m.get("allowed") instanceof Collection<?> c) {
                allowed = new HashSet<>();
                for (Object v : c) {
                    allowed.add(String.valueOf(v).trim().toLowerCase(Locale.ROOT));
                }
            }
            Double min = toDouble(field, m.get("min"));
            Double max = toDouble(field, m.get("max"));
            if (allowed == null && min == null && max == null) {
                throw new MisconfiguredCheckException("字段 " + field + " 的目标人群条件缺少 allowed 或 min/max");
            }
            return new Criterion(allowed, min, max);
        }

        boolean accepts(SurveyRecord r, String field) {
            if (allowed != null && !allowed.contains(String.valueOf(r.raw(field)).trim().toLowerCase(Locale.ROOT))) {
                return false;
            }
            if (min != null || max != null) {
                Double v = r.numeric(field);
                if (v == null) {
                    return false;
                }
                return (min == null || v >= min) && (max == null || v <= max);
            }
            return true;
        }

        private static Double toDouble(String field, Object v) {
            if (v == null) {
                return null;
            }
            if (v instanceof Number n) {
                return n.doubleValue();
            }
            try {
                return Double.parseDouble(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new MisconfiguredCheckException("字段 " + field + " 的范围不是数值: " + v);
            }
        }
    }
}
