package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.FieldDefinition;
import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.util.DuplicateClusters;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 标识字段（邮箱、IP、样本库 ID 等）精确重复检测。
 * <p>
 * ANY：任一字段相同即归为一簇；ALL：全部字段相同才归为一簇。
 * 每簇最先导入的记录为保留记录，其余记录各产生一条发现。
 */
@Component
public class IdentifierDuplicateChecker implements QualityChecker {

    @Override
    public String name() {
        return "IDENTIFIER_DUPLICATE";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.DUPLICATE;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("matchMode", "ANY", "caseInsensitive", true, "normalizeEmail", true);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        List<String> fields = ctx.fields("fields", () -> ctx.schema().identifierFields().stream()
                .map(FieldDefinition::getName).toList());
        if (fields.isEmpty()) {
            return CheckOutcome.empty();
        }
        boolean all = "ALL".equalsIgnoreCase(ctx.parameters().getString("matchMode", "ANY"));
        boolean caseInsensitive = ctx.parameters().getBoolean("caseInsensitive", true);
        boolean normalizeEmail = ctx.parameters().getBoolean("normalizeEmail", true);

        DuplicateClusters clusters = new DuplicateClusters();
        Map<Integer, Set<String>> matchedFields = new HashMap<>();
        if (all) {
            Map<List<String>, Integer> firstSeen = new HashMap<>();
            for (SurveyRecord r : ctx.records()) {
                ctx.checkCancelled();
                List<String> key = new ArrayList<>(fields.size());
                for (String f : fields) {
                    String v = normalize(r.text(f), caseInsensitive, normalizeEmail);
                    if (v == null) {
                        key = null;
                        break;
                    }
                    key.add(v);
                }
                if (key == null) {
                    continue;
                }
                Integer first = firstSeen.putIfAbsent(key, r.index());
                if (first != null) {
                    clusters.union(first, r.index());
                    matchedFields.computeIfAbsent(r.index(), k -> new TreeSet<>()).addAll(fields);
                }
            }
        } else {
            for (String f : fields) {
                Map<String, Integer> firstSeen = new HashMap<>();
                for (SurveyRecord r : ctx.records()) {
                    ctx.checkCancelled();
                    String v = normalize(r.text(f), caseInsensitive, normalizeEmail);
                    if (v == null) {
                        continue;
                    }
                    Integer first = firstSeen.putIfAbsent(v, r.index());
                    if (first != null) {
                        clusters.union(first, r.index());
                        matchedFields.computeIfAbsent(r.index(), k -> new TreeSet<>()).add(f);
                    }
                }
            }
        }

        List<Finding> findings = new ArrayList<>();
        for (DuplicateClusters.Cluster cluster : clusters.clusters()) {
            SurveyRecord canonical = ctx.dataset().record(cluster.canonical());
            for (int idx : cluster.duplicates()) {
                Set<String> matched = matchedFields.getOrDefault(idx, Set.of());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("canonicalRecordIndex", cluster.canonical());
                details.put("canonicalRecordId", canonical.recordId());
                details.put("clusterSize", cluster.size());
                details.put("clusterMembers", cluster.members());
                details.put("matchedFields", List.copyOf(matched));
                findings.add(Finding.of(idx, "duplicate", 1.0,
                                "标识字段与记录 " + canonical.recordId() + " 重复（簇大小 " + cluster.size() + "）",
                                String.join(", ", matched))
                        .withDetails(details));
            }
        }
        return CheckOutcome.of(findings);
    }

    static String normalize(String value, boolean caseInsensitive, boolean normalizeEmail) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        if (caseInsensitive) {
            v = v.toLowerCase(Locale.ROOT);
        }
        if (normalizeEmail && v.indexOf('@') > 0) {
            int at = v.indexOf('@');
            String local = v.substring(0, at);
            int plus = local.indexOf('+');
            if (plus > 0) {
                local = local.substring(0, plus);
            }
            v = local + v.substring(at);
        }
        return v.isEmpty() ? null : v;
    }
}
