package com.surveyaudit.rule.checker;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 超速作答：总耗时或章节耗时低于阈值。
 * <ul>
 *   <li>ABSOLUTE：低于 minSeconds</li>
 *   <li>PERCENTILE：低于全体耗时的 percentile 分位</li>
 *   <li>MEDIAN_RATIO：低于中位数 × medianRatio</li>
 * </ul>
 */
@Component
public class SpeederChecker implements QualityChecker {

    enum Mode {
        ABSOLUTE, PERCENTILE, MEDIAN_RATIO
    }

    @Override
    public String name() {
        return "SPEEDER";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.BEHAVIORAL;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("mode", "MEDIAN_RATIO", "scope", "TOTAL", "minSeconds", 60,
                "percentile", 5.0, "medianRatio", 0.4);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        Mode mode = parseMode(ctx.parameters().getString("mode", "MEDIAN_RATIO"));
        boolean sectionScope = "SECTION".equalsIgnoreCase(ctx.parameters().getString("scope", "TOTAL"));

        Map<String, Map<Integer, Double>> series = new LinkedHashMap<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            if (sectionScope) {
                r.metadata().sectionSeconds().forEach((section, secs) ->
                        series.computeIfAbsent(section, k -> new TreeMap<>()).put(r.index(), secs));
            } else if (r.metadata().completionSeconds() != null) {
                series.computeIfAbsent("total", k -> new TreeMap<>()).put(r.index(), r.metadata().completionSeconds());
            }
        }
        if (series.isEmpty()) {
            return CheckOutcome.insufficientData("数据集缺少计时信息");
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, Map<Integer, Double>> e : series.entrySet()) {
            double threshold = threshold(mode, e.getValue().values(), ctx);
            if (threshold <= 0) {
                continue;
            }
            for (Map.Entry<Integer, Double> rec : e.getValue().entrySet()) {
                double secs = rec.getValue();
                if (secs < threshold) {
                    double confidence = Math.min(1.0, 0.5 + 0.5 * (1.0 - secs / threshold));
                    String scope = "total".equals(e.getKey()) ? "总" : "章节 " + e.getKey() + " ";
                    findings.add(Finding.of(rec.getKey(), e.getKey(), confidence,
                                    String.format(Locale.ROOT, "%s耗时 %.1f 秒，低于阈值 %.1f 秒", scope, secs, threshold),
                                    String.format(Locale.ROOT, "%.1fs", secs))
                            .withDetails(Map.of("seconds", secs, "threshold", threshold, "mode", mode.name())));
                }
            }
        }
        return CheckOutcome.of(findings);
    }

    private double threshold(Mode mode, Collection<Double> values, CheckContext ctx) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        values.forEach(stats::addValue);
        return switch (mode) {
            case ABSOLUTE -> ctx.parameters().getDouble("minSeconds", 60);
            case PERCENTILE -> stats.getPercentile(ctx.parameters().getDouble("percentile", 5.0));
            case MEDIAN_RATIO -> stats.getPercentile(50) * ctx.parameters().getDouble("medianRatio", 0.4);
        };
    }

    private Mode parseMode(String mode) {
        try {
            return Mode.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MisconfiguredCheckException("不支持的超速判定模式: " + mode);
        }
    }
}
