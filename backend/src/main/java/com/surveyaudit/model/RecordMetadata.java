package com.surveyaudit.model;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 记录的派生元数据：完成耗时、题间间隔、章节完成度、文本长度
 *
 * @param completionSeconds 总完成耗时（秒），无计时信息时为 null
 * @param questionGaps      按时间排序的题间间隔（秒）
 * @param sectionFillRates  章节 → 已作答比例
 * @param sectionSeconds    章节 → 章节内首末作答时间差（秒）
 * @param tokenCounts       文本字段 → 词数
 * @param missingRatio      缺失字段占比
 */
public record RecordMetadata(
        Double completionSeconds,
        List<Double> questionGaps,
        Map<String, Double> sectionFillRates,
        Map<String, Double> sectionSeconds,
        Map<String, Integer> tokenCounts,
        double missingRatio) {

    static RecordMetadata compute(SurveyRecord record) {
        DatasetSchema schema = record.schema();

        Map<String, Double> fill = new LinkedHashMap<>();
        Map<String, Double> sectionSecs = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> section : schema.sections().entrySet()) {
            List<String> fields = section.getValue();
            long answered = fields.stream().filter(f -> !record.isMissing(f)).count();
            fill.put(section.getKey(), fields.isEmpty() ? 1.0 : (double) answered / fields.size());

            List<Instant> stamps = fields.stream()
                    .filter(f -> schema.field(f).map(d -> d.getRole() == FieldRole.QUESTION_TIMESTAMP).orElse(false))
                    .map(record::datetime)
                    .filter(Objects::nonNull)
                    .sorted()
                    .toList();
            if (stamps.size() >= 2) {
                sectionSecs.put(section.getKey(), seconds(stamps.get(0), stamps.get(stamps.size() - 1)));
            }
        }

        List<Instant> questionStamps = schema.fieldsWithRole(FieldRole.QUESTION_TIMESTAMP).stream()
                .map(f -> record.datetime(f.getName()))
                .filter(Objects::nonNull)
                .sorted()
                .toList();
        List<Double> gaps = new ArrayList<>();
        for (int i = 1; i < questionStamps.size(); i++) {
            gaps.add(seconds(questionStamps.get(i - 1), questionStamps.get(i)));
        }

        Map<String, Integer> tokens = new LinkedHashMap<>();
        for (FieldDefinition f : schema.fieldsOfType(FieldType.TEXT)) {
            String text = record.text(f.getName());
            tokens.put(f.getName(), text == null ? 0 : text.split("\\s+").length);
        }

        int total = schema.fieldNames().size();
        long missing = schema.fieldNames().stream().filter(record::isMissing).count();

        return new RecordMetadata(
                completionSeconds(record, schema, questionStamps),
                List.copyOf(gaps),
                Collections.unmodifiableMap(fill),
                Collections.unmodifiableMap(sectionSecs),
                Collections.unmodifiableMap(tokens),
                total == 0 ? 0.0 : (double) missing / total);
    }

    private static Double completionSeconds(SurveyRecord record, DatasetSchema schema, List<Instant> questionStamps) {
        Optional<FieldDefinition> duration = schema.firstWithRole(FieldRole.DURATION_SECONDS);
        if (duration.isPresent()) {
            Double d = record.numeric(duration.get().getName());
            if (d != null) {
                return d;
            }
        }
        Optional<FieldDefinition> start = schema.firstWithRole(FieldRole.START_TIME);
        Optional<FieldDefinition> end = schema.firstWithRole(FieldRole.END_TIME);
        if (start.isPresent() && end.isPresent()) {
            Instant s = record.datetime(start.get().getName());
            Instant e = record.datetime(end.get().getName());
            if (s != null && e != null) {
                return seconds(s, e);
            }
        }
        if (questionStamps.size() >= 2) {
            return seconds(questionStamps.get(0), questionStamps.get(questionStamps.size() - 1));
        }
        return null;
    }

    private static double seconds(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }
}
