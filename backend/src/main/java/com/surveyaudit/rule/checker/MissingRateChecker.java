package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 整条记录的缺失率超过 maxMissingRatio
 */
@Component
public class MissingRateChecker implements QualityChecker {

    @Override
    public String name() {
        return "MISSING_RATE";
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
        return Map.of("maxMissingRatio", 0.3);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        double max = ctx.parameters().getDouble("maxMissingRatio", 0.3);

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            double ratio = r.metadata().missingRatio();
            if (ratio > max) {
                double confidence = max >= 1.0 ? 1.0 : Math.min(1.0, 0.5 + 0.5 * (ratio - max) / (1.0 - max));
                findings.add(Finding.of(r.index(), "record", confidence,
                                String.format(Locale.ROOT, "缺失率 %.0f%% 超过 %.0f%%", ratio * 100, max * 100),
                                null)
                        .withDetails(Map.of("missingRatio", ratio)));
            }
        }
        return CheckOutcome.of(findings);
    }
}
