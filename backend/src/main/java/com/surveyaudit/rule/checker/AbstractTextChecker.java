package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.FieldType;
import com.surveyaudit.model.ModelFamily;
import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.TextAnalysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 基于文本模型的检查器基类：逐条记录、逐个文本字段取 NLP 分析结果并判定
 */
public abstract class AbstractTextChecker implements ModelBackedChecker {

    @Override
    public ModelFamily modelFamily() {
        return ModelFamily.TEXT;
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
        return Set.of(DerivedInput.TEXT_ANALYSIS);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        List<String> fields = textFields(ctx);
        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            for (String f : fields) {
                TextAnalysis analysis = ctx.text(r, f);
                if (analysis.isEmpty()) {
                    continue;
                }
                Finding finding = inspect(ctx, r, f, analysis);
                if (finding != null) {
                    findings.add(finding);
                }
            }
        }
        return CheckOutcome.of(findings);
    }

    /**
     * 参与检查的文本字段：参数 textFields，缺省为全部文本作答字段
     */
    protected List<String> textFields(CheckContext ctx) {
        return ctx.fields("textFields", () -> ctx.answerFieldsOfType(FieldType.TEXT));
    }

    /**
     * 判定单个非空文本字段，无问题返回 null。需要跨字段或跨记录判定的子类直接覆盖 {@link #check}。
     */
    protected Finding inspect(CheckContext ctx, SurveyRecord record, String field, TextAnalysis analysis) {
        return null;
    }
}
