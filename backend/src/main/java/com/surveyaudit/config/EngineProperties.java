package com.surveyaudit.config;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 检测引擎配置（survey-audit.*）
 */
@Data
@ConfigurationProperties(prefix = "survey-audit")
public class EngineProperties {

    private Scheduler scheduler = new Scheduler();

    private Adaptation adaptation = new Adaptation();

    private Nlp nlp = new Nlp();

    private Scoring scoring = new Scoring();

    @Data
    public static class Scheduler {

        /** 检查任务工作线程数 */
        private int workerThreads = 4;

        /** 等待队列容量，满时拒绝提交 */
        private int queueCapacity = 1000;

        /** 记录数达到该值时，可分片检查项按记录区间拆分 */
        private int partitionThreshold = 5000;

        /** 每个分片的记录数 */
        private int partitionSize = 1000;

        /** 单个检查项默认耗时上限，可被规则参数 timeoutMillis 覆盖 */
        private Duration defaultCheckTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Adaptation {

        private int threads = 1;

        private double learningRate = 0.05;

        private int epochs = 20;

        /** 少于该数量的已审核标签时拒绝训练 */
        private int minLabels = 4;
    }

    @Data
    public static class Nlp {

        /** 共享文本分析缓存条数上限 */
        private long cacheSize = 10_000;

        /** 语言识别置信度下限，低于此值返回 unknown */
        private double languageConfidenceFloor = 0.5;

        private String lexiconLocation = "classpath:lexicon";
    }

    @Data
    public static class Scoring {

        private Map<Severity, Double> severityWeights = defaultSeverityWeights();

        /** 未配置的分类权重按 1.0 计 */
        private Map<CheckCategory, Double> categoryWeights = new EnumMap<>(CheckCategory.class);

        /** 数据集低分位统计使用的分位数 */
        private double lowPercentile = 10.0;

        private static Map<Severity, Double> defaultSeverityWeights() {
            Map<Severity, Double> weights = new EnumMap<>(Severity.class);
            weights.put(Severity.LOW, 1.0);
            weights.put(Severity.MEDIUM, 3.0);
            weights.put(Severity.HIGH, 6.0);
            weights.put(Severity.CRITICAL, 10.0);
            return weights;
        }
    }
}
