package com.surveyaudit.service;

import com.surveyaudit.config.EngineConfig;
import com.surveyaudit.config.EngineProperties;
import com.surveyaudit.ml.*;
import com.surveyaudit.model.*;
import com.surveyaudit.rule.checker.ModelBackedChecker;
import com.surveyaudit.rule.checker.QualityChecker;
import com.surveyaudit.rule.checker.SatisficingPatternChecker;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * 模型增量训练。
 * <p>
 * 以数据集上已审核的问题为标签（APPROVED 为正例，REJECTED 为负例），从父版本出发训练新制品，
 * 发布为新的模型版本。已发布的版本不会被修改，正在进行的检测继续使用它们固定的版本。
 */
@Service
public class ModelAdaptationService {

    private static final Logger log = LoggerFactory.getLogger(ModelAdaptationService.class);

    private static final int MIN_CUTOFF_PERCENTILE = 80;
    private static final int MAX_CUTOFF_PERCENTILE = 99;

    private final ModelRegistry modelRegistry;
    private final RuleRegistry ruleRegistry;
    private final RuleVersionService ruleVersionService;
    private final IssueService issueService;
    private final DatasetProvider datasets;
    private final EngineProperties properties;
    private final ThreadPoolTaskExecutor executor;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final AnomalyDetector anomalyDetector = new AnomalyDetector();

    public ModelAdaptationService(ModelRegistry modelRegistry,
                                  RuleRegistry ruleRegistry,
                                  RuleVersionService ruleVersionService,
                                  IssueService issueService,
                                  DatasetProvider datasets,
                                  EngineProperties properties,
                                  @Qualifier(EngineConfig.ADAPTATION_EXECUTOR) ThreadPoolTaskExecutor executor,
                                  ApplicationEventPublisher events,
                                  Clock clock) {
        this.modelRegistry = modelRegistry;
        this.ruleRegistry = ruleRegistry;
        this.ruleVersionService = ruleVersionService;
        this.issueService = issueService;
        this.datasets = datasets;
        this.properties = properties;
        this.executor = executor;
        this.events = events;
        this.clock = clock;
    }

    /**
     * 提交一次增量训练
     *
     * @param family          模型族，TEXT 不支持训练
     * @param datasetId       标签来源数据集
     * @param parentVersionId 父版本，为 null 时取该族当前版本
     * @return 新发布的模型版本
     */
    public CompletableFuture<ModelVersion> adapt(ModelFamily family, String datasetId, String parentVersionId) {
        if (family == ModelFamily.TEXT) {
            throw new IllegalArgumentException("TEXT 模型族由词典驱动，不支持增量训练");
        }
        Dataset dataset = datasets.get(datasetId);
        ModelVersion parent = parentVersionId != null
                ? modelRegistry.find(parentVersionId)
                        .filter(v -> v.family() == family)
                        .orElseThrow(() -> new IllegalArgumentException("父版本不属于模型族 " + family + ": " + parentVersionId))
                : modelRegistry.current(family)
                        .orElseThrow(() -> new IllegalStateException("模型族 " + family + " 尚无可用版本"));

        String checkerName = checkerFor(family);
        Map<Integer, Boolean> labels = issueService.reviewedLabels(datasetId, checkerName);
        int minLabels = properties.getAdaptation().getMinLabels();
        if (labels.size() < minLabels) {
            throw new IllegalStateException(String.format(Locale.ROOT,
                    "数据集 %s 上 %s 的已审核标签 %d 条，少于训练下限 %d 条",
                    datasetId, checkerName, labels.size(), minLabels));
        }
        CheckParameters params = parameters(checkerName);

        return CompletableFuture.supplyAsync(() -> train(family, dataset, parent, labels, params), executor)
                .whenComplete((version, error) -> {
                    if (error != null) {
                        log.error("模型族 {} 增量训练失败（父版本 {}）", family, parent.id(), error);
                    }
                });
    }

    private ModelVersion train(ModelFamily family, Dataset dataset, ModelVersion parent,
                               Map<Integer, Boolean> labels, CheckParameters params) {
        log.info("开始训练模型族 {}：父版本 {}，数据集 {}，标签 {} 条", family, parent.id(), dataset.id(), labels.size());
        double learningRate = properties.getAdaptation().getLearningRate();
        int epochs = properties.getAdaptation().getEpochs();

        ModelArtifact artifact;
        Map<String, Double> metrics = new TreeMap<>();
        metrics.put("samples", (double) labels.size());
        metrics.put("positives", (double) labels.values().stream().filter(Boolean::booleanValue).count());

        switch (family) {
            case BOT -> {
                BotEnsembleModel model = modelRegistry.load(parent, BotEnsembleModel.class);
                BotFeatureExtractor extractor = BotFeatureExtractor.forDataset(dataset, params);
                List<LabeledSample> samples = new ArrayList<>();
                labels.forEach((index, positive) ->
                        samples.add(new LabeledSample(index, extractor.features(dataset.record(index)), positive)));
                BotEnsembleModel updated = model.withUpdate(samples, learningRate, epochs);
                double threshold = params.getDouble("threshold", 0.7);
                metrics.put("accuracy", accuracy(samples, s -> updated.score(s.features()).probability() >= threshold));
                updated.weights().forEach((member, weight) -> metrics.put("weight." + member, weight));
                artifact = updated;
            }
            case PATTERN -> {
                PatternModel model = modelRegistry.load(parent, PatternModel.class);
                List<String> battery = fields(dataset, params);
                List<LabeledSample> samples = new ArrayList<>();
                labels.forEach((index, positive) -> {
                    double[] sequence = SatisficingPatternChecker.sequence(dataset.record(index), battery);
                    samples.add(new LabeledSample(index, PatternFeatures.extract(sequence), positive));
                });
                PatternModel updated = model.withUpdate(samples, learningRate, epochs);
                double threshold = params.getDouble("threshold", 0.6);
                metrics.put("accuracy", accuracy(samples, s -> updated.probability(s.features()) >= threshold));
                artifact = updated;
            }
            case ANOMALY -> {
                AnomalyModel model = modelRegistry.load(parent, AnomalyModel.class);
                AnomalyModel calibrated = calibrate(model, dataset, params.getStringList("fields"), labels, metrics);
                artifact = calibrated;
            }
            default -> throw new IllegalArgumentException("不支持训练的模型族: " + family);
        }

        ModelVersion version = modelRegistry.publish(family, artifact, metrics, parent.id());
        Map<String, Object> attributes = new TreeMap<>();
        attributes.put("family", family.name());
        attributes.put("parentVersionId", parent.id());
        attributes.put("metrics", metrics);
        events.publishEvent(new LifecycleEvent(LifecycleEvent.Type.MODEL_ADAPTED, null, dataset.id(),
                version.id(), attributes, clock.instant()));
        return version;
    }

    /**
     * 在标签上选择 F1 最高的分位数阈值，得分只计算一次
     */
    private AnomalyModel calibrate(AnomalyModel model, Dataset dataset, List<String> fields,
                                   Map<Integer, Boolean> labels, Map<String, Double> metrics) {
        if (dataset.size() < model.minFoldSize()) {
            throw new IllegalStateException("记录数 " + dataset.size() + " 少于模型最小训练量 " + model.minFoldSize());
        }
        List<AnomalyScore> scores = anomalyDetector.score(dataset, fields, model);
        double[] values = scores.stream().mapToDouble(AnomalyScore::score).toArray();
        Percentile percentile = new Percentile();
        percentile.setData(values);

        double bestCutoff = model.cutoffPercentile();
        double bestF1 = f1(values, percentile.evaluate(bestCutoff), model.minScore(), labels);
        for (int p = MIN_CUTOFF_PERCENTILE; p <= MAX_CUTOFF_PERCENTILE; p++) {
            double f1 = f1(values, percentile.evaluate(p), model.minScore(), labels);
            if (f1 > bestF1) {
                bestF1 = f1;
                bestCutoff = p;
            }
        }
        metrics.put("f1", bestF1);
        metrics.put("cutoffPercentile", bestCutoff);
        return model.withCalibration(bestCutoff, model.minScore());
    }

    private static double f1(double[] scores, double cutoff, double minScore, Map<Integer, Boolean> labels) {
        int tp = 0;
        int fp = 0;
        int fn = 0;
        for (Map.Entry<Integer, Boolean> e : labels.entrySet()) {
            double s = scores[e.getKey()];
            boolean flagged = s >= cutoff && s >= minScore;
            if (flagged && e.getValue()) {
                tp++;
            } else if (flagged) {
                fp++;
            } else if (e.getValue()) {
                fn++;
            }
        }
        return tp == 0 ? 0.0 : 2.0 * tp / (2.0 * tp + fp + fn);
    }

    private static double accuracy(List<LabeledSample> samples, Predicate<LabeledSample> predict) {
        long correct = samples.stream().filter(s -> predict.test(s) == s.positive()).count();
        return samples.isEmpty() ? 0.0 : (double) correct / samples.size();
    }

    private static List<String> fields(Dataset dataset, CheckParameters params) {
        List<String> fields = params.getStringList("fields");
        if (!fields.isEmpty()) {
            return fields;
        }
        return dataset.schema().fieldsOfType(FieldType.NUMERIC).stream()
                .filter(FieldDefinition::isAnswer)
                .map(FieldDefinition::getName)
                .toList();
    }

    private String checkerFor(ModelFamily family) {
        for (String name : ruleRegistry.checkerNames()) {
            Optional<QualityChecker> checker = ruleRegistry.checker(name);
            if (checker.isPresent() && checker.get() instanceof ModelBackedChecker modelBacked
                    && modelBacked.modelFamily() == family) {
                return name;
            }
        }
        throw new IllegalStateException("没有依赖模型族 " + family + " 的检查器");
    }

    /**
     * 取该检查器第一个检查项的激活参数，与检查器默认值合并
     */
    private CheckParameters parameters(String checkerName) {
        QualityChecker checker = ruleRegistry.checker(checkerName)
                .orElseThrow(() -> new IllegalStateException("未注册的检查器: " + checkerName));
        CheckParameters params = CheckParameters.of(checker.defaultParameters());
        List<QualityCheck> checks = ruleRegistry.checksForChecker(checkerName);
        if (checks.isEmpty()) {
            return params;
        }
        return params.merge(ruleVersionService.active(checks.get(0).getId()).parameters().asMap());
    }
}
