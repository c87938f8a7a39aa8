package com.surveyaudit.ml;

import com.surveyaudit.model.ModelFamily;

/**
 * 模型存储协作方接口：引擎只通过位置引用读写制品
 */
public interface ModelArtifactStore {

    /**
     * 保存制品，返回存储位置
     */
    String save(ModelFamily family, ModelArtifact artifact);

    /**
     * 按位置加载制品
     *
     * @throws com.surveyaudit.exception.ModelArtifactException 位置不存在
     */
    ModelArtifact load(String location);
}
