package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.FieldType;
import com.surveyaudit.model.SurveyRecord;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 直线作答：题组内作答的总体方差不超过阈值
 */
@Component
public class StraightlinerChecker implements QualityChecker {

    @Override
    public String name() {
        return "STRAIGHTLINER";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.PATTERN;
    }

    @Override
    public boolean partitionable() {
        return true;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("varianceThreshold", 0.01, "minItems", 3);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        List<String> battery = ctx.fields("fields", () -> ctx.answerFieldsOfType(FieldType.NUMERIC));
        double threshold = ctx.parameters().getDouble("varianceThreshold", 0.01);
        int minItems = ctx.parameters().getInt("minItems", 3);

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            DescriptiveStatistics stats = new DescriptiveStatistics();
            for (String f : battery) {
                Double v = r.numeric(f);
                if (v != null) {
                    stats.addValue(v);
                }
            }
            if (stats.getN() < minItems) {
                continue;
            }
            double variance = stats.getPopulationVariance();
            if (variance <= threshold) {
                double confidence = threshold <= 0 ? 1.0 : 1.0 - 0.5 * (variance / threshold);
                findings.add(Finding.of(r.index(), "battery", confidence,
                                String.format(Locale.ROOT, "题组 %d 题作答方差 %.4f 不超过阈值 %.4f",
                                        stats.getN(), variance, threshold),
                                Arrays.toString(stats.getValues()))
                        .withDetails(Map.of("variance", variance, "items", stats.getN())));
            }
        }
        return CheckOutcome.of(findings);
    }
}
