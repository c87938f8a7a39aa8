package com.surveyaudit.rule.checker;

import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.TextAnalysis;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * 无意义文本：键盘乱敲、重复字符、无元音词等
 */
@Component
public class GarbageTextChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "GARBAGE_TEXT";
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("garbageThreshold", 0.5);
    }

    @Override
    protected Finding inspect(CheckContext ctx, SurveyRecord record, String field, TextAnalysis analysis) {
        double threshold = ctx.parameters().getDouble("garbageThreshold", 0.5);
        double score = analysis.garbageScore();
        if (score < threshold) {
            return null;
        }
        return Finding.of(record.index(), field, Math.min(1.0, score),
                        String.format(Locale.ROOT, "字段 %s 疑似无意义文本（得分 %.2f）", field, score),
                        analysis.text())
                .withDetails(Map.of("field", field, "garbageScore", score));
    }
}
