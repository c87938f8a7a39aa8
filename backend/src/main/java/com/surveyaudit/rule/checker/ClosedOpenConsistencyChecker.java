package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.TextAnalysis;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 封闭题与开放题一致性：参数 expectedKeywords 为 封闭题答案 → 关键词列表，
 * 开放题回答不含任一关键词时标记
 */
@Component
public class ClosedOpenConsistencyChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "CLOSED_OPEN_CONSISTENCY";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.DOMAIN_SPECIFIC;
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        String closedField = ctx.requiredField("closedField");
        String openField = ctx.requiredField("openField");
        Map<String, List<String>> expected = new HashMap<>();
        ctx.parameters().getMap("expectedKeywords").forEach((answer, keywords) -> {
            List<String> list = new ArrayList<>();
            if (keywords instanceof Collection<?> c) {
                c.forEach(k -> list.add(String.valueOf(k).toLowerCase(Locale.ROOT)));
            } else if (keywords != null) {
                list.add(keywords.toString().toLowerCase(Locale.ROOT));
            }
            expected.put(answer.trim().toLowerCase(Locale.ROOT), list);
        });

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            String closed = r.text(closedField);
            if (closed == null) {
                continue;
            }
            List<String> keywords = expected.get(closed.toLowerCase(Locale.ROOT));
            if (keywords == null || keywords.isEmpty()) {
                continue;
            }
            TextAnalysis open = ctx.text(r, openField);
            if (open.isEmpty()) {
                continue;
            }
            String lower = open.text().toLowerCase(Locale.ROOT);
            if (keywords.stream().noneMatch(lower::contains)) {
                findings.add(Finding.of(r.index(), openField, 0.8,
                                "封闭题选择 " + closed + "，但开放题回答未提及 " + keywords, open.text())
                        .withDetails(Map.of("closedField", closedField, "closedAnswer", closed,
                                "expectedKeywords", keywords)));
            }
        }
        return CheckOutcome.of(findings);
    }
}
