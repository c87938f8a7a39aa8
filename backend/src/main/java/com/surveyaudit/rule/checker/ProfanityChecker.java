package com.surveyaudit.rule.checker;

import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.TextAnalysis;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 不当用语
 */
@Component
public class ProfanityChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "PROFANITY";
    }

    @Override
    protected Finding inspect(CheckContext ctx, SurveyRecord record, String field, TextAnalysis analysis) {
        if (analysis.profanity().isEmpty()) {
            return null;
        }
        return Finding.of(record.index(), field, 1.0,
                        "字段 " + field + " 含不当用语: " + String.join(", ", analysis.profanity()),
                        String.join(", ", analysis.profanity()))
                .withDetails(Map.of("field", field, "terms", analysis.profanity()));
    }
}
