package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.TextModel;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 品牌回忆：品牌回答必须在预期品牌列表内（缺省为文本模型的品牌表），
 * 可附带 contextFields 的取值供人工复核
 */
@Component
public class BrandRecallChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "BRAND_RECALL";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.DOMAIN_SPECIFIC;
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        String brandField = ctx.requiredField("brandField");
        List<String> contextFields = ctx.fields("contextFields", List::of);
        Set<String> expected = new TreeSet<>();
        for (String b : ctx.parameters().getStringList("expectedBrands")) {
            expected.add(b.trim().toLowerCase(Locale.ROOT));
        }
        if (expected.isEmpty()) {
            expected.addAll(ctx.model(TextModel.class).brands());
        }

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            String brand = r.text(brandField);
            if (brand == null || expected.contains(brand.toLowerCase(Locale.ROOT))) {
                continue;
            }
            Map<String, Object> context = new LinkedHashMap<>();
            for (String f : contextFields) {
                context.put(f, r.raw(f));
            }
            findings.add(Finding.of(r.index(), brandField, 0.9,
                            "品牌回答 " + brand + " 不在预期品牌列表中", brand)
                    .withDetails(Map.of("brand", brand, "context", context)));
        }
        return CheckOutcome.of(findings);
    }
}
