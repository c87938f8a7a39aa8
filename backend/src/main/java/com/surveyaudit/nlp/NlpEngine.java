package com.surveyaudit.nlp;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.surveyaudit.config.EngineProperties;
import com.surveyaudit.model.SurveyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * NLP 引擎：语言识别、情感、实体、可读性、无意义文本和不当用语。
 * <p>
 * 结果只取决于文本与固定的文本模型版本，按 (模型版本, 文本) 共享缓存，
 * 同时按 (记录, 字段, 模型版本) 缓存在记录的派生数据上。
 */
@Component
public class NlpEngine {

    private static final Logger log = LoggerFactory.getLogger(NlpEngine.class);

    private final LanguageIdentifier languageIdentifier = new LanguageIdentifier();
    private final SentimentAnalyzer sentimentAnalyzer = new SentimentAnalyzer();
    private final EntityExtractor entityExtractor = new EntityExtractor();
    private final ReadabilityScorer readabilityScorer = new ReadabilityScorer();
    private final GarbageTextDetector garbageTextDetector = new GarbageTextDetector();
    private final ProfanityDetector profanityDetector = new ProfanityDetector();
    private final Cache<CacheKey, TextAnalysis> cache;

    public NlpEngine(EngineProperties properties) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getNlp().getCacheSize())
                .recordStats()
                .build();
        log.info("NLP 分析缓存上限 {} 条", properties.getNlp().getCacheSize());
    }

    public TextAnalysis analyze(String text, String modelVersionId, TextModel model) {
        if (text == null || text.isBlank()) {
            return TextAnalysis.empty();
        }
        return cache.get(new CacheKey(modelVersionId, text), key -> compute(text, model));
    }

    /**
     * 分析记录中的文本字段，每个 (字段, 模型版本) 只计算一次
     */
    public TextAnalysis analyze(SurveyRecord record, String field, String modelVersionId, TextModel model) {
        return record.derived(derivedKey(field, modelVersionId), TextAnalysis.class,
                r -> analyze(r.text(field), modelVersionId, model));
    }

    public static String derivedKey(String field, String modelVersionId) {
        return "nlp:" + modelVersionId + ":" + field;
    }

    public long cachedEntries() {
        return cache.estimatedSize();
    }

    private TextAnalysis compute(String text, TextModel model) {
        return new TextAnalysis(
                text,
                Tokenizer.words(text),
                languageIdentifier.identify(text, model),
                sentimentAnalyzer.analyze(text, model),
                entityExtractor.extract(text, model),
                readabilityScorer.score(text),
                garbageTextDetector.score(text, model),
                profanityDetector.find(text, model));
    }

    private record CacheKey(String modelVersionId, String text) {
    }
}
