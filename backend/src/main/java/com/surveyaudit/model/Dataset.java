package com.surveyaudit.model;

import java.time.Instant;
import java.util.*;

/**
 * 规范化后的问卷数据集：有序记录 + 字段模式。构建后不可变。
 */
public final class Dataset {

    private final String id;
    private final DatasetSchema schema;
    private final List<SurveyRecord> records;
    private final Instant collectedAt;

    public Dataset(String id, DatasetSchema schema, List<Map<String, Object>> rows, Instant collectedAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("数据集 ID 不能为空");
        }
        this.id = id;
        this.schema = Objects.requireNonNull(schema, "schema");
        this.collectedAt = collectedAt;

        String respondentField = schema.firstWithRole(FieldRole.RESPONDENT_ID)
                .map(FieldDefinition::getName)
                .orElse(null);

        List<SurveyRecord> built = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            for (String field : row.keySet()) {
                if (!schema.contains(field)) {
                    throw new IllegalArgumentException("第 " + i + " 条记录包含未声明字段: " + field);
                }
            }
            Object rid = respondentField == null ? null : row.get(respondentField);
            String recordId = rid == null ? "r" + i : rid.toString();
            built.add(new SurveyRecord(i, recordId, row, schema));
        }
        this.records = Collections.unmodifiableList(built);
    }

    public Dataset(String id, DatasetSchema schema, List<Map<String, Object>> rows) {
        this(id, schema, rows, null);
    }

    public String id() {
        return id;
    }

    public DatasetSchema schema() {
        return schema;
    }

    public List<SurveyRecord> records() {
        return records;
    }

    public SurveyRecord record(int index) {
        return records.get(index);
    }

    public int size() {
        return records.size();
    }

    /** 数据采集截止时间，用于判断“未来日期”；为空时由调用方提供参考时间 */
    public Optional<Instant> collectedAt() {
        return Optional.ofNullable(collectedAt);
    }
}
