package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 异常缓慢作答：完成耗时超过 均值 + k·标准差
 */
@Component
public class SlowResponseChecker implements QualityChecker {

    @Override
    public String name() {
        return "SLOW_RESPONSE";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.BEHAVIORAL;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("k", 3.0, "minRecords", 10);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        double k = ctx.parameters().getDouble("k", 3.0);
        int minRecords = ctx.parameters().getInt("minRecords", 10);

        DescriptiveStatistics stats = new DescriptiveStatistics();
        Map<Integer, Double> seconds = new TreeMap<>();
        for (SurveyRecord r : ctx.records()) {
            Double secs = r.metadata().completionSeconds();
            if (secs != null) {
                stats.addValue(secs);
                seconds.put(r.index(), secs);
            }
        }
        if (stats.getN() < minRecords) {
            return CheckOutcome.insufficientData("计时记录数 " + stats.getN() + " 少于 " + minRecords);
        }
        double mean = stats.getMean();
        double std = stats.getStandardDeviation();
        if (std == 0) {
            return CheckOutcome.empty();
        }
        double limit = mean + k * std;

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<Integer, Double> e : seconds.entrySet()) {
            ctx.checkCancelled();
            if (e.getValue() > limit) {
                double z = (e.getValue() - mean) / std;
                double confidence = Math.min(1.0, 0.5 + 0.5 * (z - k) / Math.max(k, 1.0));
                findings.add(Finding.of(e.getKey(), "total", confidence,
                                String.format(Locale.ROOT, "完成耗时 %.1f 秒，超过上限 %.1f 秒", e.getValue(), limit),
                                String.format(Locale.ROOT, "%.1fs", e.getValue()))
                        .withDetails(Map.of("seconds", e.getValue(), "zScore", z)));
            }
        }
        return CheckOutcome.of(findings);
    }
}
