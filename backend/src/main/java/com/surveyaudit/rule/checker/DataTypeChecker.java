package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.FieldDefinition;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 已作答的值无法按声明类型解释
 */
@Component
public class DataTypeChecker implements QualityChecker {

    @Override
    public String name() {
        return "DATA_TYPE";
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
        List<String> fields = ctx.fields("fields", () -> List.copyOf(ctx.schema().fieldNames()));

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            for (String f : fields) {
                FieldDefinition def = ctx.schema().field(f).orElseThrow();
                if (!r.conformsTo(f, def.getType())) {
                    findings.add(Finding.of(r.index(), f, 1.0,
                                    "字段 " + f + " 的值无法解释为 " + def.getType(), String.valueOf(r.raw(f)))
                            .withDetails(Map.of("field", f, "declaredType", def.getType().name())));
                }
            }
        }
        return CheckOutcome.of(findings);
    }
}
