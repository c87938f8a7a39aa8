package com.surveyaudit.ml;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.*;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于孤立森林的记录异常检测。特征：标准化后的数值作答字段、缺失率、完成耗时。
 */
public class AnomalyDetector {

    /**
     * 对数据集全部记录评分。记录数少于模型最小训练量时，每条记录都返回数据不足。
     *
     * @param fields 参与的数值字段，为空时取全部数值作答字段
     */
    public List<AnomalyScore> score(Dataset dataset, List<String> fields, AnomalyModel model) {
        List<AnomalyScore> result = new ArrayList<>(dataset.size());
        if (dataset.size() < model.minFoldSize()) {
            for (SurveyRecord r : dataset.records()) {
                result.add(AnomalyScore.insufficient(r.index()));
            }
            return result;
        }

        double[][] matrix = featureMatrix(dataset, fields);
        IsolationForest forest = IsolationForest.fit(matrix, model.numTrees(), model.subsampleSize(), model.seed());
        double[] scores = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            scores[i] = forest.score(matrix[i]);
        }
        double cutoff = new Percentile().evaluate(scores, model.cutoffPercentile());
        for (int i = 0; i < scores.length; i++) {
            boolean flagged = scores[i] >= cutoff && scores[i] >= model.minScore();
            result.add(new AnomalyScore(i, scores[i], flagged, false));
        }
        return result;
    }

    double[][] featureMatrix(Dataset dataset, List<String> fields) {
        List<String> columns = fields;
        if (columns == null || columns.isEmpty()) {
            columns = dataset.schema().fieldsOfType(FieldType.NUMERIC).stream()
                    .filter(FieldDefinition::isAnswer)
                    .map(FieldDefinition::getName)
                    .toList();
        }
        for (String c : columns) {
            if (!dataset.schema().contains(c)) {
                throw new MisconfiguredCheckException("数值字段不存在: " + c);
            }
        }

        int n = dataset.size();
        int dims = columns.size() + 2;
        double[][] raw = new double[n][dims];
        boolean[][] present = new boolean[n][dims];
        for (SurveyRecord r : dataset.records()) {
            int i = r.index();
            for (int d = 0; d < columns.size(); d++) {
                Double v = r.numeric(columns.get(d));
                if (v != null) {
                    raw[i][d] = v;
                    present[i][d] = true;
                }
            }
            RecordMetadata meta = r.metadata();
            raw[i][columns.size()] = meta.missingRatio();
            present[i][columns.size()] = true;
            if (meta.completionSeconds() != null) {
                raw[i][columns.size() + 1] = meta.completionSeconds();
                present[i][columns.size() + 1] = true;
            }
        }

        // 按列标准化，缺失值记为列均值（即 0）
        double[][] matrix = new double[n][dims];
        for (int d = 0; d < dims; d++) {
            DescriptiveStatistics stats = new DescriptiveStatistics();
            for (int i = 0; i < n; i++) {
                if (present[i][d]) {
                    stats.addValue(raw[i][d]);
                }
            }
            double mean = stats.getN() == 0 ? 0.0 : stats.getMean();
            double std = stats.getN() < 2 ? 0.0 : stats.getStandardDeviation();
            for (int i = 0; i < n; i++) {
                matrix[i][d] = present[i][d] && std > 0 ? (raw[i][d] - mean) / std : 0.0;
            }
        }
        return matrix;
    }
}
