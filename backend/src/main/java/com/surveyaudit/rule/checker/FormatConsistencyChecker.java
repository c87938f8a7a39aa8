package com.surveyaudit.rule.checker;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 格式一致性：参数 patterns 为 字段 → 正则，已作答值必须完整匹配
 */
@Component
public class FormatConsistencyChecker implements QualityChecker {

    @Override
    public String name() {
        return "FORMAT_CONSISTENCY";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.CONTENT_QUALITY;
    }

    @Override
    public boolean partitionable() {
        return true;
    }

    @Override
    public Set<DerivedInput> requires() {
        return Set.of();
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        Map<String, Object> specs = ctx.parameters().getMap("patterns");
        ctx.requireFields(specs.keySet());
        Map<String, Pattern> patterns = new TreeMap<>();
        specs.forEach((field, regex) -> {
            try {
                patterns.put(field, Pattern.compile(String.valueOf(regex)));
            } catch (PatternSyntaxException e) {
                throw new MisconfiguredCheckException("字段 " + field + " 的正则无效: " + e.getDescription());
            }
        });

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            for (Map.Entry<String, Pattern> e : patterns.entrySet()) {
                String value = r.text(e.getKey());
                if (value != null && !e.getValue().matcher(value).matches()) {
                    findings.add(Finding.of(r.index(), e.getKey(), 1.0,
                                    "字段 " + e.getKey() + " 的值不符合格式 " + e.getValue().pattern(), value)
                            .withDetails(Map.of("field", e.getKey(), "pattern", e.getValue().pattern())));
                }
            }
        }
        return CheckOutcome.of(findings);
    }
}
