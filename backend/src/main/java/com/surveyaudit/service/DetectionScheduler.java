package com.surveyaudit.service;

import com.surveyaudit.config.EngineConfig;
import com.surveyaudit.config.EngineProperties;
import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.exception.ModelArtifactException;
import com.surveyaudit.exception.SchedulerException;
import com.surveyaudit.ml.ModelArtifact;
import com.surveyaudit.ml.ModelRegistry;
import com.surveyaudit.model.*;
import com.surveyaudit.nlp.NlpEngine;
import com.surveyaudit.nlp.TextModel;
import com.surveyaudit.rule.checker.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 检测调度器。
 * <ol>
 *     <li>解析：检查项 → 检查器、规则版本、模型版本，无法解析的标记为 MISCONFIGURED，停用的标记为 DISABLED</li>
 *     <li>派生数据阶段：按检查器声明的依赖统一计算记录元数据和文本分析</li>
 *     <li>检查阶段：每个检查项一个任务，可分片的检查项在大数据集上按记录区间拆分</li>
 * </ol>
 * 单个检查项的异常、超时、取消都只影响该检查项；只有无法提交任务才会中止整次运行。
 */
@Service
public class DetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(DetectionScheduler.class);

    private static final Comparator<Issue> ISSUE_ORDER = Comparator
            .comparing(Issue::getCheckId)
            .thenComparingInt(Issue::getRecordIndex)
            .thenComparing(Issue::getId);

    private final RuleRegistry ruleRegistry;
    private final RuleVersionService ruleVersionService;
    private final ModelRegistry modelRegistry;
    private final NlpEngine nlpEngine;
    private final EngineProperties properties;
    private final AsyncTaskExecutor executor;
    private final ScheduledExecutorService watchdog;
    private final Clock clock;

    public DetectionScheduler(RuleRegistry ruleRegistry,
                              RuleVersionService ruleVersionService,
                              ModelRegistry modelRegistry,
                              NlpEngine nlpEngine,
                              EngineProperties properties,
                              @Qualifier(EngineConfig.DETECTION_EXECUTOR) AsyncTaskExecutor executor,
                              @Qualifier(EngineConfig.CHECK_WATCHDOG) ScheduledExecutorService watchdog,
                              Clock clock) {
        this.ruleRegistry = ruleRegistry;
        this.ruleVersionService = ruleVersionService;
        this.modelRegistry = modelRegistry;
        this.nlpEngine = nlpEngine;
        this.properties = properties;
        this.executor = executor;
        this.watchdog = watchdog;
        this.clock = clock;
    }

    /**
     * 执行一次检测
     *
     * @param runId         运行 ID
     * @param dataset       数据集
     * @param selections    选中的检查项
     * @param modelPins     模型族 → 固定的模型版本 ID
     * @param cancellation  运行级取消令牌
     * @param referenceTime 日期类检查的参考时间，为 null 时取数据集采集时间或运行开始时间
     * @throws SchedulerException 无法提交任务
     */
    public RunResult run(String runId, Dataset dataset, List<CheckSelection> selections,
                         Map<ModelFamily, String> modelPins, CancellationToken cancellation, Instant referenceTime) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        Instant reference = referenceTime != null ? referenceTime : dataset.collectedAt().orElse(startedAt);
        Map<ModelFamily, String> pins = modelPins == null ? Map.of() : modelPins;
        log.info("运行 {} 开始: 数据集 {}（{} 条记录），{} 个检查项", runId, dataset.id(), dataset.size(), selections.size());

        List<CheckExecution> executions = new ArrayList<>();
        List<CheckPlan> plans = new ArrayList<>();
        for (CheckSelection selection : selections) {
            Resolution resolution = resolve(selection, pins);
            if (resolution.plan() != null) {
                plans.add(resolution.plan());
            } else {
                executions.add(resolution.execution());
            }
        }

        computeDerivedInputs(dataset, plans, cancellation);

        try {
            for (CheckPlan plan : plans) {
                submit(plan, dataset, cancellation, reference);
            }
        } catch (SchedulerException e) {
            plans.forEach(CheckPlan::cancelAll);
            log.error("运行 {} 中止: {}", runId, e.getMessage());
            throw e;
        }

        Map<String, Issue> issues = new LinkedHashMap<>();
        for (CheckPlan plan : plans) {
            CheckExecution execution = collect(plan, dataset, cancellation, startedAt, issues);
            executions.add(execution);
        }

        List<Issue> sorted = new ArrayList<>(issues.values());
        sorted.sort(ISSUE_ORDER);
        executions.sort(Comparator.comparing(CheckExecution::getCheckId));

        Map<Severity, Integer> severityCounts = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            severityCounts.put(s, 0);
        }
        sorted.forEach(i -> severityCounts.merge(i.getSeverity(), 1, Integer::sum));

        long elapsed = (System.nanoTime() - startNanos) / 1_000_000;
        log.info("运行 {} 结束: {} 条问题，耗时 {} ms{}", runId, sorted.size(), elapsed,
                cancellation.isCancelled() ? "（已取消）" : "");
        return RunResult.builder()
                .runId(runId)
                .datasetId(dataset.id())
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .elapsedMillis(elapsed)
                .totalRecords(dataset.size())
                .issues(List.copyOf(sorted))
                .checkStatuses(List.copyOf(executions))
                .modelPins(copyPins(pins))
                .severityCounts(severityCounts)
                .cancelled(cancellation.isCancelled())
                .build();
    }

    private Resolution resolve(CheckSelection selection, Map<ModelFamily, String> pins) {
        String checkId = selection.checkId();
        Optional<QualityCheck> check = ruleRegistry.find(checkId);
        if (check.isEmpty()) {
            return Resolution.misconfigured(checkId, null, null, "未知检查项: " + checkId);
        }
        String checkerName = check.get().getCheckerName();
        Optional<QualityChecker> checker = ruleRegistry.checker(checkerName);
        if (checker.isEmpty()) {
            return Resolution.misconfigured(checkId, checkerName, null, "未注册的检查器: " + checkerName);
        }

        RuleVersion ruleVersion;
        if (selection.ruleVersionId() != null) {
            Optional<RuleVersion> pinned = ruleVersionService.find(checkId, selection.ruleVersionId());
            if (pinned.isEmpty()) {
                return Resolution.misconfigured(checkId, checkerName, null,
                        "规则版本 " + selection.ruleVersionId() + " 不属于检查项 " + checkId);
            }
            ruleVersion = pinned.get();
        } else {
            ruleVersion = ruleVersionService.active(checkId);
        }

        if (!ruleVersion.enabled()) {
            return new Resolution(null, CheckExecution.builder()
                    .checkId(checkId).checkerName(checkerName).ruleVersionId(ruleVersion.id())
                    .status(CheckStatus.DISABLED).reason("激活版本已停用").partitions(0)
                    .build());
        }

        ModelVersion modelVersion = null;
        ModelArtifact artifact = null;
        if (checker.get() instanceof ModelBackedChecker modelBacked) {
            ModelFamily family = modelBacked.modelFamily();
            String pin = pins.get(family);
            if (pin == null) {
                return Resolution.misconfigured(checkId, checkerName, ruleVersion.id(), "未固定 " + family + " 模型版本");
            }
            Optional<ModelVersion> version = modelRegistry.find(pin);
            if (version.isEmpty() || version.get().family() != family) {
                return Resolution.misconfigured(checkId, checkerName, ruleVersion.id(),
                        "模型版本 " + pin + " 不属于模型族 " + family);
            }
            modelVersion = version.get();
            try {
                artifact = modelRegistry.load(modelVersion);
            } catch (ModelArtifactException e) {
                return Resolution.misconfigured(checkId, checkerName, ruleVersion.id(), e.getMessage());
            }
        }

        CheckParameters parameters = CheckParameters.of(checker.get().defaultParameters())
                .merge(ruleVersion.parameters().asMap());
        long timeoutMillis = parameters.getLong("timeoutMillis",
                properties.getScheduler().getDefaultCheckTimeout().toMillis());
        return new Resolution(new CheckPlan(check.get(), checker.get(), ruleVersion, modelVersion, artifact,
                parameters, timeoutMillis), null);
    }

    /**
     * 派生数据阶段。失败只记录日志，检查项读取时会按需重新计算并各自承担失败。
     */
    private void computeDerivedInputs(Dataset dataset, List<CheckPlan> plans, CancellationToken cancellation) {
        boolean metadata = false;
        CheckPlan textPlan = null;
        for (CheckPlan plan : plans) {
            Set<DerivedInput> inputs = plan.checker.requires();
            metadata |= inputs.contains(DerivedInput.RECORD_METADATA);
            if (textPlan == null && inputs.contains(DerivedInput.TEXT_ANALYSIS)
                    && plan.artifact instanceof TextModel) {
                textPlan = plan;
            }
        }
        if ((!metadata && textPlan == null) || dataset.size() == 0) {
            return;
        }

        boolean computeMetadata = metadata;
        String textVersion = textPlan == null ? null : textPlan.modelVersion.id();
        TextModel textModel = textPlan == null ? null : (TextModel) textPlan.artifact;
        List<String> textFields = dataset.schema().fieldsOfType(FieldType.TEXT).stream()
                .map(FieldDefinition::getName)
                .toList();

        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int[] range : ranges(dataset.size(), true)) {
                futures.add(submitTask(() -> {
                    for (SurveyRecord r : dataset.records().subList(range[0], range[1])) {
                        cancellation.throwIfCancelled();
                        if (computeMetadata) {
                            r.metadata();
                        }
                        if (textModel != null) {
                            for (String f : textFields) {
                                nlpEngine.analyze(r, f, textVersion, textModel);
                            }
                        }
                    }
                    return null;
                }));
            }
        } catch (SchedulerException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel();
                return;
            } catch (ExecutionException e) {
                if (e.getCause() instanceof CancellationException) {
                    log.debug("派生数据计算已取消");
                } else {
                    log.warn("派生数据计算失败，检查项将按需重新计算: {}", e.getCause().toString());
                }
            }
        }
    }

    private void submit(CheckPlan plan, Dataset dataset, CancellationToken cancellation, Instant reference) {
        List<int[]> ranges = ranges(dataset.size(), plan.checker.partitionable());
        plan.partitions = ranges.size();
        plan.remaining.set(ranges.size());
        for (int[] range : ranges) {
            CheckContext ctx = CheckContext.builder()
                    .dataset(dataset)
                    .fromIndex(range[0])
                    .toIndex(range[1])
                    .parameters(plan.parameters)
                    .ruleVersion(plan.ruleVersion)
                    .modelVersion(plan.modelVersion)
                    .modelArtifact(plan.artifact)
                    .nlpEngine(nlpEngine)
                    .cancellation(cancellation)
                    .referenceTime(reference)
                    .build();
            Future<CheckOutcome> future = submitTask(() -> {
                plan.started();
                try {
                    ctx.checkCancelled();
                    return plan.checker.check(ctx);
                } finally {
                    plan.finished();
                }
            });
            plan.track(future);
        }
    }

    private <T> Future<T> submitTask(Callable<T> task) {
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new SchedulerException("检查任务提交失败，运行中止", e);
        }
    }

    private CheckExecution collect(CheckPlan plan, Dataset dataset, CancellationToken cancellation,
                                   Instant detectedAt, Map<String, Issue> issues) {
        List<CheckOutcome> parts = new ArrayList<>();
        CheckStatus status = null;
        String reason = null;
        for (Future<CheckOutcome> future : plan.futures) {
            try {
                parts.add(future.get());
            } catch (CancellationException e) {
                status = plan.timedOut ? CheckStatus.TIMEOUT : CheckStatus.CANCELLED;
                reason = plan.timedOut ? timeoutReason(plan) : "运行已取消";
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel();
                plan.cancelAll();
                status = CheckStatus.CANCELLED;
                reason = "调度线程被中断";
                break;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof MisconfiguredCheckException) {
                    status = CheckStatus.MISCONFIGURED;
                    reason = cause.getMessage();
                } else if (cause instanceof CancellationException) {
                    status = plan.timedOut ? CheckStatus.TIMEOUT : CheckStatus.CANCELLED;
                    reason = plan.timedOut ? timeoutReason(plan) : cause.getMessage();
                } else {
                    status = CheckStatus.FAILED;
                    reason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
                    log.warn("检查项 {} 执行失败", plan.check.getId(), cause);
                }
                plan.cancelAll();
                break;
            }
        }
        plan.stopTimer();
        if (status == null && plan.exceededBudget()) {
            status = CheckStatus.TIMEOUT;
            reason = timeoutReason(plan);
        }

        int issueCount = 0;
        if (status == null) {
            CheckOutcome outcome = CheckOutcome.merge(parts);
            if (outcome.isInsufficientData()) {
                status = CheckStatus.INSUFFICIENT_DATA;
                reason = outcome.insufficientDataReason();
            } else {
                status = CheckStatus.COMPLETED;
                Map<String, Issue> own = new LinkedHashMap<>();
                for (Finding finding : outcome.findings()) {
                    Issue issue = toIssue(dataset, plan, finding, detectedAt);
                    own.merge(issue.getId(), issue, (a, b) -> b.getConfidence() > a.getConfidence() ? b : a);
                }
                issues.putAll(own);
                issueCount = own.size();
            }
        }
        if (status == CheckStatus.TIMEOUT) {
            log.warn("检查项 {} 超时: {}", plan.check.getId(), reason);
        }
        return CheckExecution.builder()
                .checkId(plan.check.getId())
                .checkerName(plan.checker.name())
                .ruleVersionId(plan.ruleVersion.id())
                .modelVersionId(plan.modelVersion == null ? null : plan.modelVersion.id())
                .status(status)
                .reason(reason)
                .issueCount(issueCount)
                .elapsedMillis(plan.elapsedMillis())
                .partitions(plan.partitions)
                .build();
    }

    private Issue toIssue(Dataset dataset, CheckPlan plan, Finding finding, Instant detectedAt) {
        SurveyRecord record = dataset.record(finding.recordIndex());
        String modelVersionId = plan.modelVersion == null ? null : plan.modelVersion.id();
        return Issue.builder()
                .id(issueId(dataset.id(), plan.check.getId(), plan.ruleVersion.id(), modelVersionId,
                        finding.recordIndex(), finding.key()))
                .datasetId(dataset.id())
                .recordIndex(finding.recordIndex())
                .recordId(record.recordId())
                .checkId(plan.check.getId())
                .checkerName(plan.checker.name())
                .category(plan.check.getCategory() != null ? plan.check.getCategory() : plan.checker.category())
                .ruleVersionId(plan.ruleVersion.id())
                .modelVersionId(modelVersionId)
                .severity(finding.severity() != null ? finding.severity() : plan.ruleVersion.severity())
                .confidence(finding.confidence())
                .explanation(finding.message())
                .matchedText(finding.matchedText())
                .details(finding.details())
                .detectedAt(detectedAt)
                .build();
    }

    /**
     * 相同数据集、检查项、规则版本、模型版本、记录和发现键总是得到相同的问题 ID
     */
    static String issueId(String datasetId, String checkId, String ruleVersionId, String modelVersionId,
                          int recordIndex, String key) {
        String seed = String.join("|", datasetId, checkId, ruleVersionId,
                modelVersionId == null ? "-" : modelVersionId, String.valueOf(recordIndex),
                key == null ? "" : key);
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private List<int[]> ranges(int size, boolean partitionable) {
        EngineProperties.Scheduler cfg = properties.getScheduler();
        List<int[]> ranges = new ArrayList<>();
        if (!partitionable || size < cfg.getPartitionThreshold() || cfg.getPartitionSize() <= 0) {
            ranges.add(new int[]{0, size});
            return ranges;
        }
        for (int from = 0; from < size; from += cfg.getPartitionSize()) {
            ranges.add(new int[]{from, Math.min(size, from + cfg.getPartitionSize())});
        }
        return ranges;
    }

    private static String timeoutReason(CheckPlan plan) {
        return "超出耗时上限 " + plan.timeoutMillis + " ms";
    }

    private static Map<ModelFamily, String> copyPins(Map<ModelFamily, String> pins) {
        Map<ModelFamily, String> copy = new EnumMap<>(ModelFamily.class);
        copy.putAll(pins);
        return copy;
    }

    private record Resolution(CheckPlan plan, CheckExecution execution) {

        static Resolution misconfigured(String checkId, String checkerName, String ruleVersionId, String reason) {
            log.warn("检查项 {} 配置错误: {}", checkId, reason);
            return new Resolution(null, CheckExecution.builder()
                    .checkId(checkId).checkerName(checkerName).ruleVersionId(ruleVersionId)
                    .status(CheckStatus.MISCONFIGURED).reason(reason).partitions(0)
                    .build());
        }
    }

    /**
     * 单个检查项的执行计划与运行期状态。耗时预算从第一个任务开始执行时计起。
     */
    private final class CheckPlan {

        final QualityCheck check;
        final QualityChecker checker;
        final RuleVersion ruleVersion;
        final ModelVersion modelVersion;
        final ModelArtifact artifact;
        final CheckParameters parameters;
        final long timeoutMillis;
        final List<Future<CheckOutcome>> futures = new CopyOnWriteArrayList<>();
        final AtomicLong startNanos = new AtomicLong();
        final AtomicLong endNanos = new AtomicLong();
        final AtomicInteger remaining = new AtomicInteger();
        volatile boolean timedOut;
        volatile ScheduledFuture<?> timer;
        int partitions;

        CheckPlan(QualityCheck check, QualityChecker checker, RuleVersion ruleVersion, ModelVersion modelVersion,
                  ModelArtifact artifact, CheckParameters parameters, long timeoutMillis) {
            this.check = check;
            this.checker = checker;
            this.ruleVersion = ruleVersion;
            this.modelVersion = modelVersion;
            this.artifact = artifact;
            this.parameters = parameters;
            this.timeoutMillis = timeoutMillis;
        }

        void started() {
            if (startNanos.compareAndSet(0, System.nanoTime())) {
                timer = watchdog.schedule(this::expire, timeoutMillis, TimeUnit.MILLISECONDS);
            }
        }

        void finished() {
            endNanos.accumulateAndGet(System.nanoTime(), Math::max);
            if (remaining.decrementAndGet() == 0) {
                stopTimer();
            }
        }

        void track(Future<CheckOutcome> future) {
            futures.add(future);
            if (timedOut) {
                future.cancel(true);
            }
        }

        void expire() {
            if (remaining.get() <= 0) {
                return;
            }
            timedOut = true;
            cancelAll();
        }

        void cancelAll() {
            futures.forEach(f -> f.cancel(true));
        }

        void stopTimer() {
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }

        /**
         * 按实测耗时判断是否超出预算，计时器触发时检查项可能已经执行完毕
         */
        boolean exceededBudget() {
            return elapsedMillis() > timeoutMillis;
        }

        long elapsedMillis() {
            long start = startNanos.get();
            if (start == 0) {
                return 0;
            }
            long end = endNanos.get();
            return Math.max(0, (end == 0 ? System.nanoTime() : end) - start) / 1_000_000;
        }
    }
}
