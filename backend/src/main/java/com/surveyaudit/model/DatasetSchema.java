package com.surveyaudit.model;

import java.util.*;

/**
 * 数据集字段模式：字段名 → 字段定义，保持声明顺序
 */
public final class DatasetSchema {

    private final Map<String, FieldDefinition> fields;

    public DatasetSchema(List<FieldDefinition> definitions) {
        Map<String, FieldDefinition> map = new LinkedHashMap<>();
        for (FieldDefinition def : definitions) {
            if (def.getName() == null || def.getName().isBlank()) {
                throw new IllegalArgumentException("字段名不能为空");
            }
            if (def.getType() == null) {
                throw new IllegalArgumentException("字段 " + def.getName() + " 缺少声明类型");
            }
            if (map.put(def.getName(), def) != null) {
                throw new IllegalArgumentException("字段重复声明: " + def.getName());
            }
        }
        this.fields = Collections.unmodifiableMap(map);
    }

    public static DatasetSchema of(FieldDefinition... definitions) {
        return new DatasetSchema(Arrays.asList(definitions));
    }

    public Collection<FieldDefinition> fields() {
        return fields.values();
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Optional<FieldDefinition> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public List<FieldDefinition> fieldsOfType(FieldType type) {
        return fields.values().stream().filter(f -> f.getType() == type).toList();
    }

    public List<FieldDefinition> identifierFields() {
        return fields.values().stream().filter(FieldDefinition::isIdentifier).toList();
    }

    public List<FieldDefinition> fieldsWithRole(FieldRole role) {
        return fields.values().stream().filter(f -> f.getRole() == role).toList();
    }

    public Optional<FieldDefinition> firstWithRole(FieldRole role) {
        return fields.values().stream().filter(f -> f.getRole() == role).findFirst();
    }

    /**
     * 章节名 → 章节内字段（按声明顺序）
     */
    public Map<String, List<String>> sections() {
        Map<String, List<String>> sections = new LinkedHashMap<>();
        for (FieldDefinition f : fields.values()) {
            if (f.getSection() != null && !f.getSection().isBlank()) {
                sections.computeIfAbsent(f.getSection(), k -> new ArrayList<>()).add(f.getName());
            }
        }
        return sections;
    }
}
