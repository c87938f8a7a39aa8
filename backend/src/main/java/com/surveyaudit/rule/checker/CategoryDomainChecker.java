package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 分类取值不在允许集合内。参数 allowedValues: 字段 → 允许值列表
 */
@Component
public class CategoryDomainChecker implements QualityChecker {

    @Override
    public String name() {
        return "CATEGORY_DOMAIN";
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
        return Map.of("caseInsensitive", true);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        Map<String, Object> allowed = ctx.parameters().getMap("allowedValues");
        ctx.requireFields(allowed.keySet());
        boolean caseInsensitive = ctx.parameters().getBoolean("caseInsensitive", true);

        Map<String, Set<String>> domains = new LinkedHashMap<>();
        allowed.forEach((field, values) -> {
            Set<String> domain = new HashSet<>();
            if (values instanceof Collection<?> c) {
                c.forEach(v -> domain.add(normalize(String.valueOf(v), caseInsensitive)));
            }
            domains.put(field, domain);
        });

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            for (Map.Entry<String, Set<String>> e : domains.entrySet()) {
                String v = r.text(e.getKey());
                if (v == null || e.getValue().contains(normalize(v, caseInsensitive))) {
                    continue;
                }
                findings.add(Finding.of(r.index(), e.getKey(), 1.0,
                                "字段 " + e.getKey() + " 的取值 \"" + v + "\" 不在允许范围内", v)
                        .withDetails(Map.of("field", e.getKey(), "allowedValues", new TreeSet<>(e.getValue()))));
            }
        }
        return CheckOutcome.of(findings);
    }

    private static String normalize(String v, boolean caseInsensitive) {
        String t = v.trim();
        return caseInsensitive ? t.toLowerCase(Locale.ROOT) : t;
    }
}
