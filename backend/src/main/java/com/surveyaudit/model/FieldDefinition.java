package com.surveyaudit.model;

import lombok.Builder;
import lombok.Value;

/**
 * 数据集字段定义
 */
@Value
@Builder
public class FieldDefinition {

    /** 字段名 */
    String name;

    /** 声明类型 */
    FieldType type;

    /** 是否为标识字段（邮箱、IP、样本库 ID、受访者 ID），用于重复和机器人检测 */
    boolean identifier;

    /** 是否为个人敏感信息，回答向量比对时排除 */
    boolean pii;

    /** 所属问卷章节，可为空 */
    String section;

    /** 语义角色 */
    @Builder.Default
    FieldRole role = FieldRole.NONE;

    public boolean isIdentifier() {
        return identifier || type == FieldType.IDENTIFIER;
    }

    /**
     * 是否属于受访者的实际作答内容（非标识、非敏感、非计时字段）
     */
    public boolean isAnswer() {
        return !isIdentifier() && !pii && type != FieldType.DATETIME
                && (role == null || role == FieldRole.NONE);
    }
}
