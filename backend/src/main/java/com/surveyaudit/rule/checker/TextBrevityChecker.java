package com.surveyaudit.rule.checker;

import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.TextAnalysis;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * 开放题回答过短
 */
@Component
public class TextBrevityChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "TEXT_BREVITY";
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("minWords", 3);
    }

    @Override
    protected Finding inspect(CheckContext ctx, SurveyRecord record, String field, TextAnalysis analysis) {
        int minWords = ctx.parameters().getInt("minWords", 3);
        int words = analysis.tokenCount();
        if (words >= minWords) {
            return null;
        }
        double confidence = 1.0 - 0.5 * words / Math.max(1, minWords);
        return Finding.of(record.index(), field, confidence,
                        String.format(Locale.ROOT, "字段 %s 仅 %d 个词，少于 %d", field, words, minWords),
                        analysis.text())
                .withDetails(Map.of("field", field, "words", words));
    }
}
