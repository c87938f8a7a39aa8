package com.surveyaudit.ml;

import com.surveyaudit.model.ModelFamily;

/**
 * 模型制品。发布后不可变，任意数量的检查项可并发读取。
 */
public interface ModelArtifact {

    ModelFamily family();
}
