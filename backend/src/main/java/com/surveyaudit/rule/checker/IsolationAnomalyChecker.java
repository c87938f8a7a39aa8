package com.surveyaudit.rule.checker;

import com.surveyaudit.ml.AnomalyDetector;
import com.surveyaudit.ml.AnomalyModel;
import com.surveyaudit.ml.AnomalyScore;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.ModelFamily;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 孤立森林异常检测。森林在整个数据集上拟合，不可拆分；数据量不足时拒绝评分。
 */
@Component
public class IsolationAnomalyChecker implements ModelBackedChecker {

    private final AnomalyDetector detector = new AnomalyDetector();

    @Override
    public String name() {
        return "ISOLATION_ANOMALY";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.BEHAVIORAL;
    }

    @Override
    public ModelFamily modelFamily() {
        return ModelFamily.ANOMALY;
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        AnomalyModel model = ctx.model(AnomalyModel.class);
        List<String> fields = ctx.parameters().getStringList("fields");
        ctx.requireFields(fields);
        if (ctx.dataset().size() < model.minFoldSize()) {
            return CheckOutcome.insufficientData(String.format(Locale.ROOT,
                    "记录数 %d 少于模型最小训练量 %d", ctx.dataset().size(), model.minFoldSize()));
        }
        ctx.checkCancelled();
        List<AnomalyScore> scores = detector.score(ctx.dataset(), fields, model);

        List<Finding> findings = new ArrayList<>();
        for (AnomalyScore s : scores) {
            if (!s.flagged() || !ctx.inRange(s.recordIndex())) {
                continue;
            }
            findings.add(Finding.of(s.recordIndex(), "anomaly", Math.min(1.0, s.score()),
                            String.format(Locale.ROOT, "记录异常得分 %.3f 位于前 %.0f%% 分位之外",
                                    s.score(), 100 - model.cutoffPercentile()),
                            null)
                    .withDetails(Map.of("anomalyScore", s.score(),
                            "cutoffPercentile", model.cutoffPercentile(),
                            "minScore", model.minScore())));
        }
        return CheckOutcome.of(findings);
    }
}
