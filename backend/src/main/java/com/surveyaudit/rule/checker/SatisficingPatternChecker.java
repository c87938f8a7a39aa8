package com.surveyaudit.rule.checker;

import com.surveyaudit.ml.PatternFeatures;
import com.surveyaudit.ml.PatternModel;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.FieldType;
import com.surveyaudit.model.ModelFamily;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 敷衍作答模式：题组作答序列的游程、交替、对角线、周期性、低区分度与选项位置偏好，
 * 经逻辑回归模型给出概率。逐条判定，不依赖其他记录。
 */
@Component
public class SatisficingPatternChecker implements ModelBackedChecker {

    @Override
    public String name() {
        return "SATISFICING_PATTERN";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.PATTERN;
    }

    @Override
    public ModelFamily modelFamily() {
        return ModelFamily.PATTERN;
    }

    @Override
    public boolean partitionable() {
        return true;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("minItems", 5, "threshold", 0.6);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        PatternModel model = ctx.model(PatternModel.class);
        List<String> battery = ctx.fields("fields", () -> ctx.answerFieldsOfType(FieldType.NUMERIC));
        int minItems = ctx.parameters().getInt("minItems", 5);
        double threshold = ctx.parameters().getDouble("threshold", 0.6);

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            double[] sequence = sequence(r, battery);
            if (sequence.length < minItems) {
                continue;
            }
            double[] features = PatternFeatures.extract(sequence);
            double probability = model.probability(features);
            if (probability < threshold) {
                continue;
            }
            Map<String, Object> featureValues = new LinkedHashMap<>();
            for (int i = 0; i < features.length; i++) {
                featureValues.put(PatternFeatures.FEATURE_NAMES.get(i), features[i]);
            }
            findings.add(Finding.of(r.index(), "battery", probability,
                            String.format(Locale.ROOT, "题组作答呈敷衍模式（概率 %.2f）", probability),
                            Arrays.toString(sequence))
                    .withDetails(Map.of("features", featureValues)));
        }
        return CheckOutcome.of(findings);
    }

    /**
     * 按题组顺序取出已作答的数值，缺失题跳过
     */
    public static double[] sequence(SurveyRecord record, List<String> battery) {
        return battery.stream()
                .map(record::numeric)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
    }
}
