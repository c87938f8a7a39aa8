package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 章节完成度低于 minFillRate
 */
@Component
public class SectionCompletenessChecker implements QualityChecker {

    @Override
    public String name() {
        return "SECTION_COMPLETENESS";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.CONTENT_QUALITY;
    }

    @Override
    public boolean partitionable() {
        return true;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("minFillRate", 0.5);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        double minFillRate = ctx.parameters().getDouble("minFillRate", 0.5);
        Set<String> only = new HashSet<>(ctx.parameters().getStringList("sections"));

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            for (Map.Entry<String, Double> e : r.metadata().sectionFillRates().entrySet()) {
                if (!only.isEmpty() && !only.contains(e.getKey())) {
                    continue;
                }
                double rate = e.getValue();
                if (rate < minFillRate) {
                    double confidence = minFillRate <= 0 ? 1.0 : Math.min(1.0, 0.5 + 0.5 * (minFillRate - rate) / minFillRate);
                    findings.add(Finding.of(r.index(), e.getKey(), confidence,
                                    String.format(Locale.ROOT, "章节 %s 完成度 %.0f%% 低于 %.0f%%",
                                            e.getKey(), rate * 100, minFillRate * 100),
                                    null)
                            .withDetails(Map.of("section", e.getKey(), "fillRate", rate)));
                }
            }
        }
        return CheckOutcome.of(findings);
    }
}
