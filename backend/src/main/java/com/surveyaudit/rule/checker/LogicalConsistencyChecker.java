package com.surveyaudit.rule.checker;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.Severity;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 交叉字段逻辑校验。参数 rules 为声明式规则列表：
 * <pre>
 * {id, description, severity?, if: {field, op, value}, then: {field, op, value}}
 * </pre>
 * 前提成立而结论不成立时产生发现。
 */
@Component
public class LogicalConsistencyChecker implements QualityChecker {

    @Override
    public String name() {
        return "LOGICAL_CONSISTENCY";
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
    public CheckOutcome check(CheckContext ctx) {
        List<Rule> rules = parseRules(ctx);

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            for (Rule rule : rules) {
                if (rule.premise().test(r) && !rule.conclusion().test(r)) {
                    String message = rule.description() != null ? rule.description()
                            : "当 " + rule.premise().describe() + " 时应满足 " + rule.conclusion().describe();
                    Finding finding = Finding.of(r.index(), rule.id(), 1.0, message,
                                    rule.conclusion().field() + "=" + r.raw(rule.conclusion().field()))
                            .withDetails(Map.of("rule", rule.id(),
                                    "if", rule.premise().describe(),
                                    "then", rule.conclusion().describe()));
                    findings.add(rule.severity() == null ? finding : finding.withSeverity(rule.severity()));
                }
            }
        }
        return CheckOutcome.of(findings);
    }

    private List<Rule> parseRules(CheckContext ctx) {
        List<Rule> rules = new ArrayList<>();
        List<Map<String, Object>> specs = ctx.parameters().getMapList("rules");
        for (int i = 0; i < specs.size(); i++) {
            Map<String, Object> spec = specs.get(i);
            Condition premise = Condition.parse(spec.get("if"));
            Condition conclusion = Condition.parse(spec.get("then"));
            ctx.requireFields(List.of(premise.field(), conclusion.field()));
            Object id = spec.getOrDefault("id", "rule-" + (i + 1));
            Object description = spec.get("description");
            Severity severity = null;
            if (spec.get("severity") != null) {
                try {
                    severity = Severity.valueOf(spec.get("severity").toString().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new MisconfiguredCheckException("规则 " + id + " 的严重等级无效: " + spec.get("severity"));
                }
            }
            rules.add(new Rule(id.toString(), description == null ? null : description.toString(),
                    severity, premise, conclusion));
        }
        return rules;
    }

    private record Rule(String id, String description, Severity severity, Condition premise, Condition conclusion) {
    }
}
