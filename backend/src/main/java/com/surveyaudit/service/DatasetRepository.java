package com.surveyaudit.service;

import com.surveyaudit.exception.UnknownDatasetException;
import com.surveyaudit.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存数据集仓库。相同 ID 重复导入时替换旧数据集。
 */
@Service
public class DatasetRepository implements DatasetProvider {

    private static final Logger log = LoggerFactory.getLogger(DatasetRepository.class);

    private final Map<String, Dataset> datasets = new ConcurrentHashMap<>();

    public Dataset save(Dataset dataset) {
        Dataset previous = datasets.put(dataset.id(), dataset);
        log.info("{}数据集 {}: {} 条记录, {} 个字段", previous == null ? "导入" : "替换",
                dataset.id(), dataset.size(), dataset.schema().fieldNames().size());
        return dataset;
    }

    @Override
    public Optional<Dataset> find(String datasetId) {
        return datasetId == null ? Optional.empty() : Optional.ofNullable(datasets.get(datasetId));
    }

    @Override
    public Dataset get(String datasetId) {
        return find(datasetId).orElseThrow(() -> new UnknownDatasetException(datasetId));
    }

    public List<Dataset> all() {
        return datasets.values().stream()
                .sorted(Comparator.comparing(Dataset::id))
                .toList();
    }
}
