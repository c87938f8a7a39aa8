package com.surveyaudit;

import com.surveyaudit.model.*;

import java.time.Instant;
import java.util.*;

/**
 * 测试数据集构造工具
 */
public final class TestDatasets {

    public static final Instant COLLECTED_AT = Instant.parse("2024-05-01T00:00:00Z");

    private TestDatasets() {
    }

    public static FieldDefinition numeric(String name) {
        return FieldDefinition.builder().name(name).type(FieldType.NUMERIC).build();
    }

    public static FieldDefinition text(String name) {
        return FieldDefinition.builder().name(name).type(FieldType.TEXT).build();
    }

    public static FieldDefinition categorical(String name) {
        return FieldDefinition.builder().name(name).type(FieldType.CATEGORICAL).build();
    }

    public static FieldDefinition identifier(String name) {
        return FieldDefinition.builder().name(name).type(FieldType.IDENTIFIER).identifier(true).build();
    }

    public static FieldDefinition withRole(String name, FieldType type, FieldRole role) {
        return FieldDefinition.builder().name(name).type(type).role(role).build();
    }

    public static Dataset dataset(String id, List<FieldDefinition> fields, List<Map<String, Object>> rows) {
        return new Dataset(id, new DatasetSchema(fields), rows, COLLECTED_AT);
    }

    public static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    /**
     * 100 条记录，邮箱各不相同，只有 3、47、81 三条共用同一个邮箱
     */
    public static Dataset emailDuplicates() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            String email = (i == 3 || i == 47 || i == 81) ? "shared@example.com" : "user" + i + "@example.com";
            rows.add(row("respondent", "R" + i, "email", email, "q1", i % 5 + 1, "q2", (i * 3) % 5 + 1));
        }
        return dataset("email-dups", List.of(
                withRole("respondent", FieldType.IDENTIFIER, FieldRole.RESPONDENT_ID),
                identifier("email"),
                numeric("q1"),
                numeric("q2")), rows);
    }

    /**
     * 十题矩阵题组，作答由调用方给出
     */
    public static Dataset battery(String id, List<double[]> answers) {
        List<FieldDefinition> fields = new ArrayList<>();
        for (int q = 1; q <= 10; q++) {
            fields.add(numeric("b" + q));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (double[] a : answers) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int q = 0; q < a.length; q++) {
                row.put("b" + (q + 1), a[q]);
            }
            rows.add(row);
        }
        return dataset(id, fields, rows);
    }

    /**
     * 规模较大的混合数据集：数值题组、开放题、计时字段
     */
    public static Dataset mixed(String id, int size) {
        List<FieldDefinition> fields = List.of(
                withRole("respondent", FieldType.IDENTIFIER, FieldRole.RESPONDENT_ID),
                identifier("email"),
                withRole("duration", FieldType.NUMERIC, FieldRole.DURATION_SECONDS),
                numeric("q1"), numeric("q2"), numeric("q3"), numeric("q4"), numeric("q5"),
                text("comment"));
        String[] comments = {
                "The product is great and the delivery was fast",
                "asdfasdf qwerty",
                "I did not like the customer service at all",
                "ok",
                "Pricing is reasonable but the app crashes sometimes"};
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            rows.add(row(
                    "respondent", "P" + i,
                    "email", "p" + (i % 7 == 0 ? 0 : i) + "@example.com",
                    "duration", 120 + (i * 37) % 600,
                    "q1", i % 5 + 1,
                    "q2", (i / 3) % 5 + 1,
                    "q3", i % 9 == 0 ? 3 : (i * 7) % 5 + 1,
                    "q4", i % 9 == 0 ? 3 : (i * 11) % 5 + 1,
                    "q5", i % 9 == 0 ? 3 : (i * 13) % 5 + 1,
                    "comment", comments[i % comments.length]));
        }
        return dataset(id, fields, rows);
    }
}
