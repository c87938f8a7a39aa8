package com.surveyaudit.model;

import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * 单条问卷记录。
 * <p>
 * 记录值在构建后不可变；派生元数据（计时、章节完成度、文本分析等）按需计算并缓存，
 * 每个键最多计算一次，之后只读共享。
 */
public final class SurveyRecord {

    private static final String METADATA_KEY = "__metadata";

    private final int index;
    private final String recordId;
    private final Map<String, Object> values;
    private final DatasetSchema schema;
    private final ConcurrentMap<String, Object> derived = new ConcurrentHashMap<>();

    SurveyRecord(int index, String recordId, Map<String, Object> values, DatasetSchema schema) {
        this.index = index;
        this.recordId = recordId;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.schema = schema;
    }

    /** 原始导入顺序中的位置（从 0 开始） */
    public int index() {
        return index;
    }

    public String recordId() {
        return recordId;
    }

    public Map<String, Object> values() {
        return values;
    }

    public DatasetSchema schema() {
        return schema;
    }

    public Object raw(String field) {
        return values.get(field);
    }

    public boolean isMissing(String field) {
        Object v = values.get(field);
        return v == null || (v instanceof String s && s.isBlank());
    }

    public Double numeric(String field) {
        return toDouble(values.get(field));
    }

    public String text(String field) {
        Object v = values.get(field);
        if (v == null) {
            return null;
        }
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    public Instant datetime(String field) {
        return toInstant(values.get(field));
    }

    public RecordMetadata metadata() {
        return (RecordMetadata) derived.computeIfAbsent(METADATA_KEY, k -> RecordMetadata.compute(this));
    }

    /**
     * 读取或计算一项派生数据，同一个 key 只计算一次
     */
    public <T> T derived(String key, Class<T> type, Function<SurveyRecord, T> computer) {
        return type.cast(derived.computeIfAbsent(key, k -> computer.apply(this)));
    }

    public boolean hasDerived(String key) {
        return derived.containsKey(key);
    }

    /**
     * 值能否按声明类型解释；缺失值视为可解释
     */
    public boolean conformsTo(String field, FieldType type) {
        Object v = values.get(field);
        if (isMissing(field)) {
            return true;
        }
        return switch (type) {
            case NUMERIC -> toDouble(v) != null;
            case DATETIME -> toInstant(v) != null;
            case CATEGORICAL, IDENTIFIER -> v instanceof String || v instanceof Number || v instanceof Boolean;
            case TEXT -> v instanceof String;
        };
    }

    static Double toDouble(Object v) {
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (v instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (v instanceof String s && !s.isBlank()) {
            try {
                double d = Double.parseDouble(s.trim());
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static Instant toInstant(Object v) {
        if (v instanceof Instant i) {
            return i;
        }
        if (v instanceof OffsetDateTime o) {
            return o.toInstant();
        }
        if (v instanceof ZonedDateTime z) {
            return z.toInstant();
        }
        if (v instanceof LocalDateTime l) {
            return l.toInstant(ZoneOffset.UTC);
        }
        if (v instanceof LocalDate d) {
            return d.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (v instanceof Number n) {
            return Instant.ofEpochSecond(n.longValue());
        }
        if (v instanceof String s && !s.isBlank()) {
            String t = s.trim();
            try {
                return OffsetDateTime.parse(t).toInstant();
            } catch (DateTimeParseException ignored) {
                // 继续尝试不带时区的格式
            }
            try {
                return LocalDateTime.parse(t).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // 继续尝试纯日期
            }
            try {
                return LocalDate.parse(t).atStartOfDay().toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "SurveyRecord{" + index + ":" + recordId + "}";
    }
}
