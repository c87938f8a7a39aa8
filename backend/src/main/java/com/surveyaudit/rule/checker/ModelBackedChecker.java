package com.surveyaudit.rule.checker;

import com.surveyaudit.model.ModelFamily;

/**
 * 依赖固定模型版本的检查器
 */
public interface ModelBackedChecker extends QualityChecker {

    ModelFamily modelFamily();
}
