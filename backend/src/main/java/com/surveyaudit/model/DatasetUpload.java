package com.surveyaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 数据集导入请求：字段模式 + 原始记录
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetUpload {

    private String id;

    /** 数据采集截止时间，可为空 */
    private Instant collectedAt;

    private List<FieldSpec> fields;

    private List<Map<String, Object>> records;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldSpec {

        private String name;

        private FieldType type;

        private boolean identifier;

        private boolean pii;

        private String section;

        private FieldRole role;
    }

    public Dataset toDataset() {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("请提供字段模式 (fields)");
        }
        List<FieldDefinition> definitions = new ArrayList<>(fields.size());
        for (FieldSpec spec : fields) {
            definitions.add(FieldDefinition.builder()
                    .name(spec.getName())
                    .type(spec.getType())
                    .identifier(spec.isIdentifier())
                    .pii(spec.isPii())
                    .section(spec.getSection())
                    .role(spec.getRole() != null ? spec.getRole() : FieldRole.NONE)
                    .build());
        }
        return new Dataset(id, new DatasetSchema(definitions), records != null ? records : List.of(), collectedAt);
    }
}
