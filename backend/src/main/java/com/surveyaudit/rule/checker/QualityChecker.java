package com.surveyaudit.rule.checker;

import com.surveyaudit.model.CheckCategory;

import java.util.Map;
import java.util.Set;

/**
 * 质量检查器接口。检查器是静态注册的策略，行为只由参数快照决定。
 */
public interface QualityChecker {

    /**
     * 检查器名称，对应 QualityCheck.checkerName
     */
    String name();

    CheckCategory category();

    /**
     * 是否可以按记录区间拆分执行。只有逐条判定、不依赖区间外记录结论的检查器才可拆分。
     */
    default boolean partitionable() {
        return false;
    }

    /**
     * 依赖的共享派生数据，调度器在检查阶段之前统一计算
     */
    default Set<DerivedInput> requires() {
        return Set.of(DerivedInput.RECORD_METADATA);
    }

    /**
     * 参数默认值，与规则版本中的参数合并后使用
     */
    default Map<String, Object> defaultParameters() {
        return Map.of();
    }

    /**
     * 对上下文中的记录区间执行检查。检查器只读数据，不得修改记录。
     */
    CheckOutcome check(CheckContext context);
}
