package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.FieldType;
import com.surveyaudit.model.SurveyRecord;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 数值字段 Z 分数离群。统计量基于整个数据集，因此不可拆分。
 */
@Component
public class ZScoreOutlierChecker implements QualityChecker {

    @Override
    public String name() {
        return "ZSCORE_OUTLIER";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.CONTENT_QUALITY;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("zThreshold", 3.0, "minRecords", 10);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        List<String> fields = ctx.fields("fields", () -> ctx.answerFieldsOfType(FieldType.NUMERIC));
        double threshold = ctx.parameters().getDouble("zThreshold", 3.0);
        int minRecords = ctx.parameters().getInt("minRecords", 10);
        if (ctx.dataset().size() < minRecords) {
            return CheckOutcome.insufficientData("记录数 " + ctx.dataset().size() + " 少于 " + minRecords);
        }

        List<Finding> findings = new ArrayList<>();
        for (String f : fields) {
            DescriptiveStatistics stats = new DescriptiveStatistics();
            for (SurveyRecord r : ctx.dataset().records()) {
                Double v = r.numeric(f);
                if (v != null) {
                    stats.addValue(v);
                }
            }
            double std = stats.getStandardDeviation();
            if (stats.getN() < minRecords || std == 0 || Double.isNaN(std)) {
                continue;
            }
            double mean = stats.getMean();
            for (SurveyRecord r : ctx.records()) {
                ctx.checkCancelled();
                Double v = r.numeric(f);
                if (v == null) {
                    continue;
                }
                double z = (v - mean) / std;
                if (Math.abs(z) > threshold) {
                    double confidence = Math.min(1.0, 0.5 + 0.5 * (Math.abs(z) - threshold) / threshold);
                    findings.add(Finding.of(r.index(), f, confidence,
                                    String.format(Locale.ROOT, "字段 %s 的值 %s 偏离均值 %.2f 个标准差",
                                            f, r.raw(f), z),
                                    String.valueOf(r.raw(f)))
                            .withDetails(Map.of("field", f, "zScore", z, "mean", mean, "std", std)));
                }
            }
        }
        return CheckOutcome.of(findings);
    }
}
