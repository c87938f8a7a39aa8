package com.surveyaudit.nlp;

/**
 * 情感分析结果
 *
 * @param label     positive / negative / neutral
 * @param compound  归一化综合得分，范围 [-1,1]
 * @param magnitude 情感词强度绝对值之和
 */
public record SentimentScore(String label, double compound, double magnitude) {

    public static final String POSITIVE = "positive";
    public static final String NEGATIVE = "negative";
    public static final String NEUTRAL = "neutral";
}
