package com.surveyaudit.nlp;

import java.util.List;

/**
 * 单段文本的完整分析结果
 */
public record TextAnalysis(
        String text,
        List<String> tokens,
        LanguageGuess language,
        SentimentScore sentiment,
        List<Entity> entities,
        Readability readability,
        double garbageScore,
        List<String> profanity) {

    public static TextAnalysis empty() {
        return new TextAnalysis("", List.of(), new LanguageGuess(LanguageGuess.UNKNOWN, 0.0),
                new SentimentScore(SentimentScore.NEUTRAL, 0.0, 0.0), List.of(),
                new Readability(0, 0, 0.0, "very_easy", 0.0, 0.0, 0.0), 0.0, List.of());
    }

    public int tokenCount() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty() && text.isBlank();
    }
}
