package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.SentimentScore;
import com.surveyaudit.nlp.TextAnalysis;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 情感一致性：
 * <ul>
 *     <li>同一记录多个开放题的情感得分相差超过 maxDifference</li>
 *     <li>配置 ratingField 时，评分（归一化到 [-1,1]）与开放题平均情感相差超过 ratingThreshold</li>
 * </ul>
 */
@Component
public class SentimentConsistencyChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "SENTIMENT_CONSISTENCY";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.SENTIMENT;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("maxDifference", 1.0, "ratingMin", 1, "ratingMax", 5, "ratingThreshold", 1.2);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        List<String> fields = textFields(ctx);
        String ratingField = ctx.optionalField("ratingField");
        double maxDifference = ctx.parameters().getDouble("maxDifference", 1.0);
        double ratingMin = ctx.parameters().getDouble("ratingMin", 1);
        double ratingMax = ctx.parameters().getDouble("ratingMax", 5);
        double ratingThreshold = ctx.parameters().getDouble("ratingThreshold", 1.2);

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            Map<String, Double> compounds = new LinkedHashMap<>();
            for (String f : fields) {
                TextAnalysis analysis = ctx.text(r, f);
                if (!analysis.isEmpty() && !SentimentScore.NEUTRAL.equals(analysis.sentiment().label())) {
                    compounds.put(f, analysis.sentiment().compound());
                }
            }
            if (compounds.isEmpty()) {
                continue;
            }

            if (compounds.size() >= 2) {
                double min = Collections.min(compounds.values());
                double max = Collections.max(compounds.values());
                if (max - min > maxDifference) {
                    findings.add(Finding.of(r.index(), "text-fields", Math.min(1.0, (max - min) / 2.0),
                                    String.format(Locale.ROOT, "开放题之间情感相互矛盾（%.2f 与 %.2f）", min, max),
                                    compounds.toString())
                            .withDetails(Map.of("compounds", compounds, "difference", max - min)));
                }
            }

            if (ratingField != null && ratingMax > ratingMin) {
                Double rating = r.numeric(ratingField);
                if (rating != null) {
                    double normalized = 2.0 * (rating - ratingMin) / (ratingMax - ratingMin) - 1.0;
                    double mean = compounds.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
                    double gap = Math.abs(normalized - mean);
                    if (gap > ratingThreshold) {
                        findings.add(Finding.of(r.index(), "rating", Math.min(1.0, gap / 2.0),
                                        String.format(Locale.ROOT, "评分 %s 与开放题情感 %.2f 不一致", r.raw(ratingField), mean),
                                        String.valueOf(r.raw(ratingField)))
                                .withDetails(Map.of("rating", rating, "normalizedRating", normalized,
                                        "meanCompound", mean, "gap", gap)));
                    }
                }
            }
        }
        return CheckOutcome.of(findings);
    }
}
