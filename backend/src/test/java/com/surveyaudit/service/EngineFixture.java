package com.surveyaudit.service;

import com.surveyaudit.config.EngineProperties;
import com.surveyaudit.ml.InMemoryModelArtifactStore;
import com.surveyaudit.ml.ModelRegistry;
import com.surveyaudit.nlp.NlpEngine;
import com.surveyaudit.rule.checker.*;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 不依赖 Spring 容器组装完整的检测引擎
 */
class EngineFixture implements AutoCloseable {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-02T08:00:00Z"), ZoneOffset.UTC);

    final EngineProperties properties;
    final List<Object> events = new CopyOnWriteArrayList<>();
    final RuleRegistry ruleRegistry;
    final RuleVersionService ruleVersionService;
    final ModelRegistry modelRegistry;
    final NlpEngine nlpEngine;
    final ThreadPoolTaskExecutor detectionExecutor;
    final ThreadPoolTaskExecutor adaptationExecutor;
    final ScheduledExecutorService watchdog;
    final DetectionScheduler scheduler;
    final DatasetRepository datasets;
    final ScoringService scoringService;
    final IssueService issueService;
    final DetectionService detectionService;
    final ModelAdaptationService adaptationService;

    EngineFixture(QualityChecker... extraCheckers) {
        this(new EngineProperties(), extraCheckers);
    }

    EngineFixture(EngineProperties properties, QualityChecker... extraCheckers) {
        this.properties = properties;
        List<QualityChecker> checkers = new ArrayList<>(builtInCheckers());
        checkers.addAll(List.of(extraCheckers));
        ruleRegistry = new RuleRegistry(checkers);
        ruleVersionService = new RuleVersionService(ruleRegistry, new RuleParameterValidator(), events::add, CLOCK);
        modelRegistry = new ModelRegistry(new InMemoryModelArtifactStore(), properties, CLOCK);
        modelRegistry.bootstrapDefaults();
        nlpEngine = new NlpEngine(properties);

        detectionExecutor = new ThreadPoolTaskExecutor();
        detectionExecutor.setCorePoolSize(properties.getScheduler().getWorkerThreads());
        detectionExecutor.setMaxPoolSize(properties.getScheduler().getWorkerThreads());
        detectionExecutor.setQueueCapacity(properties.getScheduler().getQueueCapacity());
        detectionExecutor.setThreadNamePrefix("test-detect-");
        detectionExecutor.initialize();

        adaptationExecutor = new ThreadPoolTaskExecutor();
        adaptationExecutor.setCorePoolSize(1);
        adaptationExecutor.setMaxPoolSize(1);
        adaptationExecutor.setThreadNamePrefix("test-adapt-");
        adaptationExecutor.initialize();

        watchdog = Executors.newSingleThreadScheduledExecutor();
        scheduler = new DetectionScheduler(ruleRegistry, ruleVersionService, modelRegistry, nlpEngine, properties,
                detectionExecutor, watchdog, CLOCK);
        datasets = new DatasetRepository();
        scoringService = new ScoringService(properties);
        issueService = new IssueService(datasets, scoringService, CLOCK);
        detectionService = new DetectionService(datasets, ruleRegistry, modelRegistry, scheduler, issueService,
                events::add, CLOCK);
        adaptationService = new ModelAdaptationService(modelRegistry, ruleRegistry, ruleVersionService,
                issueService, datasets, properties, adaptationExecutor, events::add, CLOCK);
    }

    static List<QualityChecker> builtInCheckers() {
        return List.of(
                new IdentifierDuplicateChecker(), new ResponseVectorDuplicateChecker(),
                new StraightlinerChecker(), new ZigzagPatternChecker(), new SatisficingPatternChecker(),
                new SpeederChecker(), new SlowResponseChecker(), new BotEnsembleChecker(),
                new IsolationAnomalyChecker(), new NumericRangeChecker(), new CategoryDomainChecker(),
                new LogicalConsistencyChecker(), new DateAnomalyChecker(), new TargetAudienceChecker(),
                new TopicAwarenessChecker(), new BrandRecallChecker(), new ClosedOpenConsistencyChecker(),
                new RequiredFieldsChecker(), new SectionCompletenessChecker(), new MissingRateChecker(),
                new ZScoreOutlierChecker(), new DataTypeChecker(), new FormatConsistencyChecker(),
                new TextBrevityChecker(), new GarbageTextChecker(), new ProfanityChecker(),
                new LanguageMismatchChecker(), new LowTextQualityChecker(), new OpenEndSimilarityChecker(),
                new ExtremeSentimentChecker(), new SentimentConsistencyChecker());
    }

    <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Override
    public void close() {
        detectionExecutor.shutdown();
        adaptationExecutor.shutdown();
        watchdog.shutdownNow();
    }
}
