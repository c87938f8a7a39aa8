package com.surveyaudit.rule.checker;

import com.surveyaudit.ml.PatternFeatures;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.FieldType;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 锯齿（a,b,a,b…）或对角线（固定步长递增/递减）作答
 */
@Component
public class ZigzagPatternChecker implements QualityChecker {

    @Override
    public String name() {
        return "ZIGZAG_PATTERN";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.PATTERN;
    }

    @Override
    public boolean partitionable() {
        return true;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("minItems", 5, "minRatio", 0.9);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        List<String> battery = ctx.fields("fields", () -> ctx.answerFieldsOfType(FieldType.NUMERIC));
        int minItems = ctx.parameters().getInt("minItems", 5);
        double minRatio = ctx.parameters().getDouble("minRatio", 0.9);

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            double[] seq = battery.stream().map(r::numeric).filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue).toArray();
            if (seq.length < minItems) {
                continue;
            }
            double zigzag = PatternFeatures.zigzagRatio(seq);
            double diagonal = PatternFeatures.diagonalRatio(seq);
            if (zigzag >= minRatio || diagonal >= minRatio) {
                String kind = zigzag >= diagonal ? "zigzag" : "diagonal";
                findings.add(Finding.of(r.index(), kind, Math.max(zigzag, diagonal),
                                ("zigzag".equals(kind) ? "题组呈锯齿交替作答" : "题组呈对角线递进作答"),
                                Arrays.toString(seq))
                        .withDetails(Map.of("zigzagRatio", zigzag, "diagonalRatio", diagonal)));
            }
        }
        return CheckOutcome.of(findings);
    }
}
