package com.surveyaudit.nlp;

import java.util.*;

/**
 * TF-IDF 余弦相似度，用于开放题抄袭/重复检测
 */
public class TextSimilarity {

    public record SimilarPair(int first, int second, double similarity) {
    }

    private final TextModel model;

    public TextSimilarity(TextModel model) {
        this.model = model;
    }

    /**
     * 计算相似度严格大于阈值的文本对，first &lt; second，按 (first, second) 排序
     *
     * @param documents 记录下标 → 文本
     */
    public List<SimilarPair> similarPairs(SortedMap<Integer, String> documents, double threshold) {
        List<Integer> ids = new ArrayList<>(documents.keySet());
        List<Map<String, Double>> vectors = vectorize(ids.stream().map(documents::get).toList());

        List<SimilarPair> pairs = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            Map<String, Double> a = vectors.get(i);
            if (a.isEmpty()) {
                continue;
            }
            for (int j = i + 1; j < ids.size(); j++) {
                Map<String, Double> b = vectors.get(j);
                if (b.isEmpty()) {
                    continue;
                }
                double sim = cosine(a, b);
                if (sim > threshold) {
                    pairs.add(new SimilarPair(ids.get(i), ids.get(j), sim));
                }
            }
        }
        return pairs;
    }

    public double similarity(String first, String second) {
        List<Map<String, Double>> vectors = vectorize(List.of(first, second));
        if (vectors.get(0).isEmpty() || vectors.get(1).isEmpty()) {
            return 0.0;
        }
        return cosine(vectors.get(0), vectors.get(1));
    }

    private List<Map<String, Double>> vectorize(List<String> texts) {
        List<Map<String, Integer>> counts = new ArrayList<>(texts.size());
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (String text : texts) {
            Map<String, Integer> tf = new HashMap<>();
            for (String w : Tokenizer.words(text)) {
                if (!model.isStopword(w)) {
                    tf.merge(w, 1, Integer::sum);
                }
            }
            tf.keySet().forEach(term -> documentFrequency.merge(term, 1, Integer::sum));
            counts.add(tf);
        }

        int n = texts.size();
        List<Map<String, Double>> vectors = new ArrayList<>(n);
        for (Map<String, Integer> tf : counts) {
            Map<String, Double> vector = new HashMap<>();
            double norm = 0.0;
            for (Map.Entry<String, Integer> e : tf.entrySet()) {
                double idf = Math.log((1.0 + n) / (1.0 + documentFrequency.get(e.getKey()))) + 1.0;
                double w = e.getValue() * idf;
                vector.put(e.getKey(), w);
                norm += w * w;
            }
            double length = Math.sqrt(norm);
            vector.replaceAll((k, v) -> v / length);
            vectors.add(vector);
        }
        return vectors;
    }

    private double cosine(Map<String, Double> a, Map<String, Double> b) {
        Map<String, Double> small = a.size() <= b.size() ? a : b;
        Map<String, Double> large = small == a ? b : a;
        double dot = 0.0;
        for (Map.Entry<String, Double> e : small.entrySet()) {
            Double other = large.get(e.getKey());
            if (other != null) {
                dot += e.getValue() * other;
            }
        }
        return Math.min(1.0, dot);
    }
}
