package com.surveyaudit.service;

import com.surveyaudit.exception.UnknownIssueException;
import com.surveyaudit.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 问题存储与审核。
 * <p>
 * 问题 ID 是确定性的，重复运行得到的同一问题会覆盖检测字段，但保留已有的审核状态。
 * 每个（数据集, 检查项）只有最近一次完成运行的问题计入评分卡，更早版本的问题保留在历史中。
 */
@Service
public class IssueService {

    private static final Logger log = LoggerFactory.getLogger(IssueService.class);

    private static final Comparator<Issue> ORDER = Comparator
            .comparing(Issue::getDatasetId)
            .thenComparing(Issue::getCheckId)
            .thenComparingInt(Issue::getRecordIndex)
            .thenComparing(Issue::getId);

    private static final Set<CheckStatus> REPLACING = EnumSet.of(
            CheckStatus.COMPLETED, CheckStatus.INSUFFICIENT_DATA, CheckStatus.DISABLED);

    private final Map<String, Issue> issues = new ConcurrentHashMap<>();
    /** 数据集|检查项 → 最近一次完成运行产生的问题 ID */
    private final Map<String, Set<String>> currentIds = new ConcurrentHashMap<>();
    private final DatasetProvider datasets;
    private final ScoringService scoringService;
    private final Clock clock;

    public IssueService(DatasetProvider datasets, ScoringService scoringService, Clock clock) {
        this.datasets = datasets;
        this.scoringService = scoringService;
        this.clock = clock;
    }

    /**
     * 保存一次运行的问题
     *
     * @return 新增问题数
     */
    public int store(RunResult result) {
        int added = 0;
        for (Issue issue : result.getIssues()) {
            Issue previous = issues.merge(issue.getId(), issue, IssueService::keepReview);
            if (previous == issue) {
                added++;
            }
        }
        replaceCurrent(result);
        log.info("运行 {} 保存问题 {} 条，其中新增 {} 条", result.getRunId(), result.getIssues().size(), added);
        return added;
    }

    /**
     * 完成（或确定无问题）的检查项以本次结果替换当前问题集；失败、超时、取消的检查项保留上一次的结果
     */
    private void replaceCurrent(RunResult result) {
        Map<String, Set<String>> fresh = new HashMap<>();
        if (result.getCheckStatuses() != null) {
            for (CheckExecution execution : result.getCheckStatuses()) {
                if (REPLACING.contains(execution.getStatus())) {
                    fresh.put(currentKey(result.getDatasetId(), execution.getCheckId()), new HashSet<>());
                }
            }
        }
        for (Issue issue : result.getIssues()) {
            fresh.computeIfAbsent(currentKey(issue.getDatasetId(), issue.getCheckId()), k -> new HashSet<>())
                    .add(issue.getId());
        }
        fresh.forEach((key, ids) -> currentIds.put(key, Set.copyOf(ids)));
    }

    private static String currentKey(String datasetId, String checkId) {
        return datasetId + "|" + checkId;
    }

    private static Issue keepReview(Issue existing, Issue fresh) {
        return fresh.toBuilder()
                .status(existing.getStatus())
                .reviewedBy(existing.getReviewedBy())
                .reviewedAt(existing.getReviewedAt())
                .build();
    }

    public Optional<Issue> find(String issueId) {
        return Optional.ofNullable(issues.get(issueId));
    }

    public Issue get(String issueId) {
        return find(issueId).orElseThrow(() -> new UnknownIssueException(issueId));
    }

    public List<Issue> list(IssueFilter filter) {
        return issues.values().stream()
                .filter(filter::matches)
                .sorted(ORDER)
                .toList();
    }

    public List<Issue> forDataset(String datasetId) {
        return list(IssueFilter.forDataset(datasetId));
    }

    /**
     * 数据集当前有效的问题：每个检查项只取最近一次完成运行的结果
     */
    public List<Issue> current(String datasetId) {
        return forDataset(datasetId).stream()
                .filter(i -> currentIds.getOrDefault(currentKey(datasetId, i.getCheckId()), Set.of())
                        .contains(i.getId()))
                .toList();
    }

    /**
     * 外部审核流程修改问题状态
     */
    public Issue setIssueStatus(String issueId, IssueStatus status, String reviewer) {
        Objects.requireNonNull(status, "status");
        Issue updated = issues.computeIfPresent(issueId, (id, issue) -> issue.toBuilder()
                .status(status)
                .reviewedBy(reviewer)
                .reviewedAt(clock.instant())
                .build());
        if (updated == null) {
            throw new UnknownIssueException(issueId);
        }
        log.info("问题 {} 状态更新为 {}（审核人: {}）", issueId, status, reviewer);
        return updated;
    }

    /**
     * 按当前问题状态重新计算评分卡
     */
    public Scorecard scorecard(String datasetId) {
        return scoringService.score(datasets.get(datasetId), current(datasetId));
    }

    /**
     * 某个检查器在数据集上已审核（APPROVED / REJECTED）的问题，按记录去重。
     * 同一记录同时存在两种结论时以 APPROVED 为准。
     */
    public Map<Integer, Boolean> reviewedLabels(String datasetId, String checkerName) {
        Map<Integer, Boolean> labels = new TreeMap<>();
        for (Issue issue : forDataset(datasetId)) {
            if (!checkerName.equals(issue.getCheckerName())) {
                continue;
            }
            if (issue.getStatus() == IssueStatus.APPROVED) {
                labels.put(issue.getRecordIndex(), true);
            } else if (issue.getStatus() == IssueStatus.REJECTED) {
                labels.putIfAbsent(issue.getRecordIndex(), false);
            }
        }
        return labels;
    }
}
