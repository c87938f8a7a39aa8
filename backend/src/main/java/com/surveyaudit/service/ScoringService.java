package com.surveyaudit.service;

import com.surveyaudit.config.EngineProperties;
import com.surveyaudit.model.*;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.IntFunction;

/**
 * 质量评分：问题集合的纯函数投影，不保存任何状态。
 * <p>
 * 记录得分 = max(0, 100 − Σ 严重等级权重 · 分类权重 · 置信度)，只统计 OPEN 与 APPROVED 的问题。
 */
@Service
public class ScoringService {

    private static final double FULL_SCORE = 100.0;

    private final EngineProperties properties;

    public ScoringService(EngineProperties properties) {
        this.properties = properties;
    }

    public Scorecard score(String datasetId, int recordCount, Collection<Issue> issues) {
        return compute(datasetId, recordCount, i -> null, issues);
    }

    public Scorecard score(Dataset dataset, Collection<Issue> issues) {
        return compute(dataset.id(), dataset.size(), i -> dataset.record(i).recordId(), issues);
    }

    public static boolean isActive(Issue issue) {
        return issue.getStatus() == IssueStatus.OPEN || issue.getStatus() == IssueStatus.APPROVED;
    }

    private Scorecard compute(String datasetId, int recordCount, IntFunction<String> recordIdOf,
                              Collection<Issue> issues) {
        List<Issue> active = issues.stream()
                .filter(i -> datasetId.equals(i.getDatasetId()))
                .filter(ScoringService::isActive)
                .filter(i -> i.getRecordIndex() >= 0 && i.getRecordIndex() < recordCount)
                .sorted(Comparator.comparing(Issue::getId))
                .toList();

        Map<Integer, List<Issue>> byRecord = new TreeMap<>();
        Map<Severity, Integer> severityCounts = new EnumMap<>(Severity.class);
        Map<CheckCategory, Integer> categoryCounts = new EnumMap<>(CheckCategory.class);
        for (Severity s : Severity.values()) {
            severityCounts.put(s, 0);
        }
        for (CheckCategory c : CheckCategory.values()) {
            categoryCounts.put(c, 0);
        }
        for (Issue issue : active) {
            byRecord.computeIfAbsent(issue.getRecordIndex(), k -> new ArrayList<>()).add(issue);
            severityCounts.merge(issue.getSeverity(), 1, Integer::sum);
            categoryCounts.merge(issue.getCategory(), 1, Integer::sum);
        }

        List<RecordScore> records = new ArrayList<>(recordCount);
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int index = 0; index < recordCount; index++) {
            List<Issue> own = byRecord.getOrDefault(index, List.of());
            Map<CheckCategory, Double> deductions = new EnumMap<>(CheckCategory.class);
            String recordId = recordIdOf.apply(index);
            for (Issue issue : own) {
                deductions.merge(issue.getCategory(), deduction(issue), Double::sum);
                if (recordId == null) {
                    recordId = issue.getRecordId();
                }
            }
            double total = deductions.values().stream().mapToDouble(Double::doubleValue).sum();
            double score = Math.max(0.0, FULL_SCORE - total);
            stats.addValue(score);
            records.add(RecordScore.builder()
                    .recordIndex(index)
                    .recordId(recordId)
                    .score(score)
                    .issueCount(own.size())
                    .deductions(Collections.unmodifiableMap(deductions))
                    .build());
        }

        boolean empty = recordCount == 0;
        return Scorecard.builder()
                .datasetId(datasetId)
                .totalRecords(recordCount)
                .activeIssues(active.size())
                .meanScore(empty ? FULL_SCORE : stats.getMean())
                .medianScore(empty ? FULL_SCORE : stats.getPercentile(50))
                .lowPercentileScore(empty ? FULL_SCORE : stats.getPercentile(properties.getScoring().getLowPercentile()))
                .flaggedRatio(empty ? 0.0 : (double) byRecord.size() / recordCount)
                .severityCounts(severityCounts)
                .categoryCounts(categoryCounts)
                .records(List.copyOf(records))
                .build();
    }

    private double deduction(Issue issue) {
        EngineProperties.Scoring cfg = properties.getScoring();
        double severityWeight = cfg.getSeverityWeights().getOrDefault(issue.getSeverity(), 1.0);
        double categoryWeight = cfg.getCategoryWeights().getOrDefault(issue.getCategory(), 1.0);
        return severityWeight * categoryWeight * issue.getConfidence();
    }
}
