package com.surveyaudit.service;

import com.surveyaudit.model.Dataset;

import java.util.Optional;

/**
 * 数据集来源。文件解析与存储由上游负责，引擎只读取规范化后的数据集。
 */
public interface DatasetProvider {

    Optional<Dataset> find(String datasetId);

    /**
     * @throws com.surveyaudit.exception.UnknownDatasetException 数据集不存在
     */
    Dataset get(String datasetId);
}
