package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.FieldDefinition;
import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.util.DuplicateClusters;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 作答向量近似重复：只比较非标识、非敏感、非计时的作答字段。
 * 一致率 = 相同作答数 / 至少一方作答的字段数。
 */
@Component
public class ResponseVectorDuplicateChecker implements QualityChecker {

    @Override
    public String name() {
        return "RESPONSE_VECTOR_DUPLICATE";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.DUPLICATE;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("similarityThreshold", 0.95, "minAnswered", 5);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        List<String> fields = ctx.fields("fields", () -> ctx.schema().fields().stream()
                .filter(FieldDefinition::isAnswer)
                .map(FieldDefinition::getName)
                .toList());
        double threshold = ctx.parameters().getDouble("similarityThreshold", 0.95);
        int minAnswered = ctx.parameters().getInt("minAnswered", 5);

        List<SurveyRecord> records = ctx.records();
        List<String[]> vectors = new ArrayList<>(records.size());
        for (SurveyRecord r : records) {
            String[] v = new String[fields.size()];
            for (int i = 0; i < fields.size(); i++) {
                String t = r.text(fields.get(i));
                v[i] = t == null ? null : t.toLowerCase(Locale.ROOT);
            }
            vectors.add(v);
        }

        DuplicateClusters clusters = new DuplicateClusters();
        Map<Integer, Double> bestAgreement = new HashMap<>();
        for (int a = 0; a < records.size(); a++) {
            ctx.checkCancelled();
            for (int b = a + 1; b < records.size(); b++) {
                double agreement = agreement(vectors.get(a), vectors.get(b), minAnswered);
                if (agreement >= threshold) {
                    int ia = records.get(a).index();
                    int ib = records.get(b).index();
                    clusters.union(ia, ib);
                    bestAgreement.merge(ia, agreement, Math::max);
                    bestAgreement.merge(ib, agreement, Math::max);
                }
            }
        }

        List<Finding> findings = new ArrayList<>();
        for (DuplicateClusters.Cluster cluster : clusters.clusters()) {
            SurveyRecord canonical = ctx.dataset().record(cluster.canonical());
            for (int idx : cluster.duplicates()) {
                double agreement = bestAgreement.getOrDefault(idx, threshold);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("canonicalRecordIndex", cluster.canonical());
                details.put("canonicalRecordId", canonical.recordId());
                details.put("clusterSize", cluster.size());
                details.put("clusterMembers", cluster.members());
                details.put("agreement", agreement);
                findings.add(Finding.of(idx, "response-vector", Math.min(1.0, agreement),
                                String.format(Locale.ROOT, "作答内容与记录 %s 高度一致（一致率 %.2f）",
                                        canonical.recordId(), agreement),
                                null)
                        .withDetails(details));
            }
        }
        return CheckOutcome.of(findings);
    }

    static double agreement(String[] a, String[] b, int minAnswered) {
        int compared = 0;
        int both = 0;
        int same = 0;
        for (int i = 0; i < a.length; i++) {
            if (a[i] == null && b[i] == null) {
                continue;
            }
            compared++;
            if (a[i] != null && b[i] != null) {
                both++;
                if (a[i].equals(b[i])) {
                    same++;
                }
            }
        }
        if (both < minAnswered || compared == 0) {
            return 0.0;
        }
        return (double) same / compared;
    }
}
