package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 主题认知：参数 answers 为 知识题字段 → 正确答案，答对题数少于 minCorrect 时标记。
 * 可选 topicField 指向受访者自报的主题熟悉度，只有自报“熟悉”（值不低于 claimedAtLeast）的记录才参与判定。
 */
@Component
public class TopicAwarenessChecker implements QualityChecker {

    @Override
    public String name() {
        return "TOPIC_AWARENESS";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.DOMAIN_SPECIFIC;
    }

    @Override
    public boolean partitionable() {
        return true;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("minCorrect", 1, "claimedAtLeast", 3);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        Map<String, Object> answers = new TreeMap<>(ctx.parameters().getMap("answers"));
        if (answers.isEmpty()) {
            return CheckOutcome.empty();
        }
        ctx.requireFields(answers.keySet());
        int minCorrect = Math.min(ctx.parameters().getInt("minCorrect", 1), answers.size());
        String topicField = ctx.optionalField("topicField");
        double claimedAtLeast = ctx.parameters().getDouble("claimedAtLeast", 3);

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            if (topicField != null) {
                Double claimed = r.numeric(topicField);
                if (claimed == null || claimed < claimedAtLeast) {
                    continue;
                }
            }
            int correct = 0;
            int answered = 0;
            List<String> wrong = new ArrayList<>();
            for (Map.Entry<String, Object> e : answers.entrySet()) {
                if (r.isMissing(e.getKey())) {
                    wrong.add(e.getKey());
                    continue;
                }
                answered++;
                if (Condition.matches(r.raw(e.getKey()), e.getValue())) {
                    correct++;
                } else {
                    wrong.add(e.getKey());
                }
            }
            if (correct < minCorrect) {
                double confidence = answered == 0 ? 0.6 : 1.0 - (double) correct / answers.size() * 0.5;
                findings.add(Finding.of(r.index(), "knowledge", confidence,
                                String.format(Locale.ROOT, "知识题答对 %d/%d，少于要求的 %d 题",
                                        correct, answers.size(), minCorrect),
                                String.join(", ", wrong))
                        .withDetails(Map.of("correct", correct, "total", answers.size(), "wrongFields", wrong)));
            }
        }
        return CheckOutcome.of(findings);
    }
}
