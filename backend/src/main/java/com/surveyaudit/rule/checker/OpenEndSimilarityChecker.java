package com.surveyaudit.rule.checker;

import com.surveyaudit.model.SurveyRecord;
import com.surveyaudit.nlp.TextAnalysis;
import com.surveyaudit.nlp.TextModel;
import com.surveyaudit.nlp.TextSimilarity;
import com.surveyaudit.util.DuplicateClusters;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 开放题抄袭/雷同：TF-IDF 余弦相似度超过阈值的回答传递聚类，最早出现的记录为代表
 */
@Component
public class OpenEndSimilarityChecker extends AbstractTextChecker {

    @Override
    public String name() {
        return "OPEN_END_SIMILARITY";
    }

    @Override
    public boolean partitionable() {
        return false;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("similarityThreshold", 0.8, "minTokens", 3);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        List<String> fields = textFields(ctx);
        double threshold = ctx.parameters().getDouble("similarityThreshold", 0.8);
        int minTokens = ctx.parameters().getInt("minTokens", 3);
        TextSimilarity similarity = new TextSimilarity(ctx.model(TextModel.class));

        List<Finding> findings = new ArrayList<>();
        for (String f : fields) {
            SortedMap<Integer, String> documents = new TreeMap<>();
            for (SurveyRecord r : ctx.records()) {
                TextAnalysis analysis = ctx.text(r, f);
                if (analysis.tokenCount() >= minTokens) {
                    documents.put(r.index(), analysis.text());
                }
            }
            ctx.checkCancelled();

            DuplicateClusters clusters = new DuplicateClusters();
            Map<Integer, Double> best = new HashMap<>();
            for (TextSimilarity.SimilarPair pair : similarity.similarPairs(documents, threshold)) {
                clusters.union(pair.first(), pair.second());
                best.merge(pair.first(), pair.similarity(), Math::max);
                best.merge(pair.second(), pair.similarity(), Math::max);
            }

            for (DuplicateClusters.Cluster cluster : clusters.clusters()) {
                SurveyRecord canonical = ctx.dataset().record(cluster.canonical());
                for (int idx : cluster.duplicates()) {
                    double sim = best.getOrDefault(idx, threshold);
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("field", f);
                    details.put("canonicalRecordIndex", cluster.canonical());
                    details.put("canonicalRecordId", canonical.recordId());
                    details.put("clusterSize", cluster.size());
                    details.put("clusterMembers", cluster.members());
                    details.put("similarity", sim);
                    findings.add(Finding.of(idx, f, Math.min(1.0, sim),
                                    String.format(Locale.ROOT, "字段 %s 的回答与记录 %s 高度相似（%.2f）",
                                            f, canonical.recordId(), sim),
                                    documents.get(idx))
                            .withDetails(details));
                }
            }
        }
        return CheckOutcome.of(findings);
    }
}
