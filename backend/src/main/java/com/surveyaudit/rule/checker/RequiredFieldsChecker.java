package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 必答题缺失
 */
@Component
public class RequiredFieldsChecker implements QualityChecker {

    @Override
    public String name() {
        return "REQUIRED_FIELDS";
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
        List<String> required = ctx.fields("fields", List::of);
        if (required.isEmpty()) {
            return CheckOutcome.empty();
        }
        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            for (String f : required) {
                if (r.isMissing(f)) {
                    findings.add(Finding.of(r.index(), f, 1.0, "必答字段 " + f + " 缺失", null)
                            .withDetails(Map.of("field", f)));
                }
            }
        }
        return CheckOutcome.of(findings);
    }
}
