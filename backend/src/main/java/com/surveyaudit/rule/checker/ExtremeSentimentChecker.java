package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.SentimentScore;
import com.surveyaudit.nlp.TextAnalysis;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * 极端情感：综合得分绝对值不低于 extremeThreshold
 */
@Component
public class ExtremeSentimentChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "EXTREME_SENTIMENT";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.SENTIMENT;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("extremeThreshold", 0.8);
    }

    @Override
    protected Finding inspect(CheckContext ctx, SurveyRecord record, String field, TextAnalysis analysis) {
        double threshold = ctx.parameters().getDouble("extremeThreshold", 0.8);
        SentimentScore sentiment = analysis.sentiment();
        if (Math.abs(sentiment.compound()) < threshold) {
            return null;
        }
        return Finding.of(record.index(), field, Math.min(1.0, Math.abs(sentiment.compound())),
                        String.format(Locale.ROOT, "字段 %s 情感极端（%s，%.2f）", field, sentiment.label(), sentiment.compound()),
                        analysis.text())
                .withDetails(Map.of("field", field, "label", sentiment.label(), "compound", sentiment.compound()));
    }
}
