package com.surveyaudit.service;

import com.surveyaudit.exception.UnknownRunException;
import com.surveyaudit.ml.ModelRegistry;
import com.surveyaudit.model.*;
import com.surveyaudit.rule.checker.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 检测服务：组装运行请求、调用调度器、保存问题并发布生命周期事件
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final DatasetProvider datasets;
    private final RuleRegistry ruleRegistry;
    private final ModelRegistry modelRegistry;
    private final DetectionScheduler scheduler;
    private final IssueService issueService;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    private final Map<String, CancellationToken> running = new ConcurrentHashMap<>();
    private final Map<String, RunResult> runs = new ConcurrentHashMap<>();

    public DetectionService(DatasetProvider datasets,
                            RuleRegistry ruleRegistry,
                            ModelRegistry modelRegistry,
                            DetectionScheduler scheduler,
                            IssueService issueService,
                            ApplicationEventPublisher events,
                            Clock clock) {
        this.datasets = datasets;
        this.ruleRegistry = ruleRegistry;
        this.modelRegistry = modelRegistry;
        this.scheduler = scheduler;
        this.issueService = issueService;
        this.events = events;
        this.clock = clock;
    }

    /**
     * 执行检测。相同数据集、规则版本和模型版本的重复运行得到相同的问题集合。
     *
     * @throws com.surveyaudit.exception.UnknownDatasetException 数据集不存在
     * @throws com.surveyaudit.exception.SchedulerException      无法分配工作线程
     */
    public RunResult runDetection(RunRequest request) {
        Dataset dataset = datasets.get(request.getDatasetId());
        String runId = request.getRunId() != null && !request.getRunId().isBlank()
                ? request.getRunId()
                : UUID.randomUUID().toString();

        CancellationToken token = CancellationToken.create();
        if (running.putIfAbsent(runId, token) != null) {
            throw new IllegalStateException("运行 " + runId + " 正在执行");
        }
        try {
            List<CheckSelection> selections = selections(request);
            Map<ModelFamily, String> pins = pins(request.getModelPins());
            publish(LifecycleEvent.Type.DETECTION_STARTED, runId, dataset.id(), null, Map.of(
                    "checks", selections.size(),
                    "records", dataset.size(),
                    "modelPins", pinNames(pins)));

            RunResult result = scheduler.run(runId, dataset, selections, pins, token, request.getReferenceTime());

            for (CheckExecution execution : result.getCheckStatuses()) {
                if (execution.getStatus() == CheckStatus.FAILED || execution.getStatus() == CheckStatus.TIMEOUT) {
                    publish(LifecycleEvent.Type.CHECK_FAILED, runId, dataset.id(), execution.getCheckId(), Map.of(
                            "status", execution.getStatus().name(),
                            "reason", Objects.toString(execution.getReason(), "")));
                }
            }
            issueService.store(result);
            runs.put(runId, result);

            publish(LifecycleEvent.Type.DETECTION_COMPLETED, runId, dataset.id(), null, Map.of(
                    "issues", result.getIssues().size(),
                    "elapsedMillis", result.getElapsedMillis(),
                    "cancelled", result.isCancelled()));
            return result;
        } finally {
            running.remove(runId);
        }
    }

    /**
     * 取消正在执行的运行
     *
     * @return 运行存在且尚未结束时返回 true
     */
    public boolean cancel(String runId) {
        CancellationToken token = running.get(runId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("运行 {} 已请求取消", runId);
        return true;
    }

    public RunResult getRun(String runId) {
        RunResult result = runs.get(runId);
        if (result == null) {
            throw new UnknownRunException(runId);
        }
        return result;
    }

    public List<RunResult> listRuns() {
        return runs.values().stream()
                .sorted(Comparator.comparing(RunResult::getStartedAt).thenComparing(RunResult::getRunId))
                .toList();
    }

    private List<CheckSelection> selections(RunRequest request) {
        Map<String, String> versions = request.getRuleVersions() == null ? Map.of() : request.getRuleVersions();
        List<String> checkIds = request.getCheckIds();
        if (checkIds == null || checkIds.isEmpty()) {
            checkIds = ruleRegistry.all().stream().map(QualityCheck::getId).toList();
        }
        // 去重并保持请求顺序
        List<CheckSelection> selections = new ArrayList<>();
        for (String checkId : new LinkedHashSet<>(checkIds)) {
            selections.add(new CheckSelection(checkId, versions.get(checkId)));
        }
        return selections;
    }

    private Map<ModelFamily, String> pins(Map<ModelFamily, String> requested) {
        Map<ModelFamily, String> pins = new EnumMap<>(ModelFamily.class);
        pins.putAll(modelRegistry.pinCurrent());
        if (requested != null) {
            pins.putAll(requested);
        }
        return pins;
    }

    private static Map<String, String> pinNames(Map<ModelFamily, String> pins) {
        Map<String, String> names = new TreeMap<>();
        pins.forEach((family, version) -> names.put(family.name(), version));
        return names;
    }

    private void publish(LifecycleEvent.Type type, String runId, String datasetId, String subject,
                         Map<String, Object> attributes) {
        events.publishEvent(new LifecycleEvent(type, runId, datasetId, subject, attributes, clock.instant()));
    }
}
