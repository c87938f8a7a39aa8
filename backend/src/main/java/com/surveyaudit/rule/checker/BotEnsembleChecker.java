package com.surveyaudit.rule.checker;

import com.surveyaudit.ml.BotEnsembleModel;
import com.surveyaudit.ml.BotFeatureExtractor;
import com.surveyaudit.ml.BotScore;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.ModelFamily;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 机器人作答检测：逻辑回归、决策桩森林与计时序列模型的加权软投票，经 Platt 校准后与阈值比较。
 * 每条发现都附带各成员模型的概率与加权贡献。
 */
@Component
public class BotEnsembleChecker implements ModelBackedChecker {

    @Override
    public String name() {
        return "BOT_ENSEMBLE";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.BEHAVIORAL;
    }

    @Override
    public ModelFamily modelFamily() {
        return ModelFamily.BOT;
    }

    /**
     * 特征上下文（耗时中位数、IP 计数）始终基于整个数据集，判定逐条进行
     */
    @Override
    public boolean partitionable() {
        return true;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("threshold", 0.7, "fastGapSeconds", 1.0, "ipReuseSaturation", 4);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        BotEnsembleModel model = ctx.model(BotEnsembleModel.class);
        BotFeatureExtractor extractor = BotFeatureExtractor.forDataset(ctx.dataset(), ctx.parameters());
        double threshold = ctx.parameters().getDouble("threshold", 0.7);

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            double[] features = extractor.features(r);
            BotScore score = model.score(features);
            if (score.probability() < threshold) {
                continue;
            }
            Map<String, Object> members = new TreeMap<>();
            score.members().forEach((member, s) -> members.put(member, Map.of(
                    "probability", s.probability(),
                    "weight", s.weight(),
                    "contribution", s.contribution())));
            Map<String, Object> featureValues = new LinkedHashMap<>();
            for (int i = 0; i < features.length; i++) {
                featureValues.put(BotFeatureExtractor.FEATURE_NAMES.get(i), features[i]);
            }
            findings.add(Finding.of(r.index(), "bot", score.probability(),
                            String.format(Locale.ROOT, "疑似机器人作答（概率 %.2f，阈值 %.2f）",
                                    score.probability(), threshold),
                            null)
                    .withDetails(Map.of("members", members,
                            "features", featureValues,
                            "rawScore", score.rawScore())));
        }
        return CheckOutcome.of(findings);
    }
}
