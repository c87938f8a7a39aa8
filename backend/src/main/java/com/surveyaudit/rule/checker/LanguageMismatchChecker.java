package com.surveyaudit.rule.checker;

import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.LanguageGuess;
import com.surveyaudit.nlp.TextAnalysis;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 作答语言不在预期语言之内。置信度不足的识别结果为 unknown，默认不标记。
 */
@Component
public class LanguageMismatchChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "LANGUAGE_MISMATCH";
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("expectedLanguages", List.of("en"), "flagUnknown", false, "minTokens", 3);
    }

    @Override
    protected Finding inspect(CheckContext ctx, SurveyRecord record, String field, TextAnalysis analysis) {
        if (analysis.tokenCount() < ctx.parameters().getInt("minTokens", 3)) {
            return null;
        }
        Set<String> expected = new TreeSet<>();
        for (String lang : ctx.parameters().getStringList("expectedLanguages")) {
            expected.add(lang.toLowerCase(Locale.ROOT));
        }
        if (expected.isEmpty()) {
            expected.add("en");
        }
        LanguageGuess guess = analysis.language();
        if (!guess.isKnown()) {
            if (!ctx.parameters().getBoolean("flagUnknown", false)) {
                return null;
            }
            return Finding.of(record.index(), field, 0.5,
                            "字段 " + field + " 的语言无法识别", analysis.text())
                    .withDetails(Map.of("field", field, "language", guess.language(), "expected", List.copyOf(expected)));
        }
        if (expected.contains(guess.language())) {
            return null;
        }
        return Finding.of(record.index(), field, Math.min(1.0, guess.confidence()),
                        String.format(Locale.ROOT, "字段 %s 的语言为 %s，预期 %s", field, guess.language(), expected),
                        analysis.text())
                .withDetails(Map.of("field", field, "language", guess.language(),
                        "languageConfidence", guess.confidence(), "expected", List.copyOf(expected)));
    }
}
