package com.surveyaudit.rule.checker;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.ml.ModelArtifact;
import com.surveyaudit.model.*;
import com.surveyaudit.nlp.NlpEngine;
import com.surveyaudit.nlp.TextAnalysis;
import com.surveyaudit.nlp.TextModel;
import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 单个检查任务的执行上下文：数据集、记录区间、参数快照、固定的模型版本与取消令牌。
 */
public final class CheckContext {

    private final Dataset dataset;
    private final int fromIndex;
    private final int toIndex;
    private final CheckParameters parameters;
    private final RuleVersion ruleVersion;
    private final ModelVersion modelVersion;
    private final ModelArtifact modelArtifact;
    private final NlpEngine nlpEngine;
    private final CancellationToken cancellation;
    private final Instant referenceTime;

    @Builder
    private CheckContext(Dataset dataset, Integer fromIndex, Integer toIndex, CheckParameters parameters,
                         RuleVersion ruleVersion, ModelVersion modelVersion, ModelArtifact modelArtifact,
                         NlpEngine nlpEngine, CancellationToken cancellation, Instant referenceTime) {
        this.dataset = dataset;
        this.fromIndex = fromIndex == null ? 0 : fromIndex;
        this.toIndex = toIndex == null ? dataset.size() : toIndex;
        this.parameters = parameters == null ? CheckParameters.empty() : parameters;
        this.ruleVersion = ruleVersion;
        this.modelVersion = modelVersion;
        this.modelArtifact = modelArtifact;
        this.nlpEngine = nlpEngine;
        this.cancellation = cancellation == null ? CancellationToken.create() : cancellation;
        this.referenceTime = referenceTime != null ? referenceTime
                : dataset.collectedAt().orElse(Instant.now());
    }

    public Dataset dataset() {
        return dataset;
    }

    public DatasetSchema schema() {
        return dataset.schema();
    }

    /** 本任务负责的记录区间 [fromIndex, toIndex) */
    public List<SurveyRecord> records() {
        return dataset.records().subList(fromIndex, toIndex);
    }

    public int fromIndex() {
        return fromIndex;
    }

    public int toIndex() {
        return toIndex;
    }

    public boolean inRange(int recordIndex) {
        return recordIndex >= fromIndex && recordIndex < toIndex;
    }

    public CheckParameters parameters() {
        return parameters;
    }

    public RuleVersion ruleVersion() {
        return ruleVersion;
    }

    public ModelVersion modelVersion() {
        return modelVersion;
    }

    /** 判断“未来日期”等使用的参考时间：数据采集截止时间，缺省为运行开始时间 */
    public Instant referenceTime() {
        return referenceTime;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public void checkCancelled() {
        cancellation.throwIfCancelled();
    }

    /**
     * 取固定版本的模型制品
     */
    public <T extends ModelArtifact> T model(Class<T> type) {
        if (modelArtifact == null) {
            throw new MisconfiguredCheckException("检查项未固定模型版本");
        }
        if (!type.isInstance(modelArtifact)) {
            throw new MisconfiguredCheckException("模型制品类型不符，期望 " + type.getSimpleName());
        }
        return type.cast(modelArtifact);
    }

    /**
     * 按固定的文本模型分析记录中的文本字段，结果缓存在记录上
     */
    public TextAnalysis text(SurveyRecord record, String field) {
        if (nlpEngine == null) {
            throw new MisconfiguredCheckException("NLP 引擎不可用");
        }
        return nlpEngine.analyze(record, field, modelVersion.id(), model(TextModel.class));
    }

    /**
     * 读取字段列表参数并校验字段存在；参数缺省时使用 defaults
     */
    public List<String> fields(String key, Supplier<List<String>> defaults) {
        List<String> fields = parameters.getStringList(key);
        if (fields.isEmpty()) {
            fields = defaults.get();
        }
        requireFields(fields);
        return fields;
    }

    /**
     * 读取必填的单字段参数
     */
    public String requiredField(String key) {
        String field = parameters.getString(key, null);
        if (field == null || field.isBlank()) {
            throw new MisconfiguredCheckException("缺少字段参数: " + key);
        }
        requireFields(List.of(field));
        return field;
    }

    /**
     * 读取可选的单字段参数，存在时校验
     */
    public String optionalField(String key) {
        String field = parameters.getString(key, null);
        if (field == null || field.isBlank()) {
            return null;
        }
        requireFields(List.of(field));
        return field;
    }

    public void requireFields(Iterable<String> fields) {
        List<String> missing = new ArrayList<>();
        for (String f : fields) {
            if (!dataset.schema().contains(f)) {
                missing.add(f);
            }
        }
        if (!missing.isEmpty()) {
            throw new MisconfiguredCheckException("数据集中不存在字段: " + String.join(", ", missing));
        }
    }

    public List<String> fieldsOfType(FieldType type) {
        return dataset.schema().fieldsOfType(type).stream().map(FieldDefinition::getName).toList();
    }

    public List<String> answerFieldsOfType(FieldType type) {
        return dataset.schema().fieldsOfType(type).stream()
                .filter(FieldDefinition::isAnswer)
                .map(FieldDefinition::getName)
                .toList();
    }
}
