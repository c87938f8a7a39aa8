package com.surveyaudit.rule.checker;

import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.Readability;
import com.surveyaudit.nlp.TextAnalysis;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * 文本综合质量（长度、词汇多样性、语法启发式）低于 minQuality
 */
@Component
public class LowTextQualityChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "LOW_TEXT_QUALITY";
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("minQuality", 0.35, "minTokens", 3);
    }

    @Override
    protected Finding inspect(CheckContext ctx, SurveyRecord record, String field, TextAnalysis analysis) {
        if (analysis.tokenCount() < ctx.parameters().getInt("minTokens", 3)) {
            return null;
        }
        double minQuality = ctx.parameters().getDouble("minQuality", 0.35);
        Readability readability = analysis.readability();
        if (readability.quality() >= minQuality) {
            return null;
        }
        double confidence = minQuality <= 0 ? 1.0 : 1.0 - 0.5 * readability.quality() / minQuality;
        return Finding.of(record.index(), field, confidence,
                        String.format(Locale.ROOT, "字段 %s 文本质量 %.2f 低于 %.2f", field, readability.quality(), minQuality),
                        analysis.text())
                .withDetails(Map.of("field", field,
                        "quality", readability.quality(),
                        "lexicalDiversity", readability.lexicalDiversity(),
                        "grammarScore", readability.grammarScore(),
                        "readabilityLevel", readability.level()));
    }
}
