package com.surveyaudit.nlp;

import java.util.List;

/**
 * 词典情感分析：否定词翻转、程度副词增强、感叹号加强
 */
public class SentimentAnalyzer {

    private static final double NEGATION_SCALAR = -0.74;
    private static final int NEGATION_WINDOW = 3;
    private static final double EXCLAMATION_BOOST = 0.292;
    private static final double NORMALIZATION_ALPHA = 15.0;
    private static final double NEUTRAL_BAND = 0.05;

    public SentimentScore analyze(String text, TextModel model) {
        List<String> words = Tokenizer.words(text);
        double sum = 0.0;
        double magnitude = 0.0;
        for (int i = 0; i < words.size(); i++) {
            Double valence = model.sentimentLexicon().get(words.get(i));
            if (valence == null) {
                continue;
            }
            double v = valence;
            if (i > 0) {
                Double boost = model.boosters().get(words.get(i - 1));
                if (boost != null) {
                    v += Math.signum(v) * boost;
                }
            }
            for (int j = Math.max(0, i - NEGATION_WINDOW); j < i; j++) {
                if (model.negations().contains(words.get(j))) {
                    v *= NEGATION_SCALAR;
                    break;
                }
            }
            sum += v;
            magnitude += Math.abs(v);
        }

        if (sum != 0.0) {
            long exclamations = text == null ? 0 : text.chars().filter(c -> c == '!').count();
            sum += Math.signum(sum) * Math.min(exclamations, 4) * EXCLAMATION_BOOST;
        }

        double compound = sum / Math.sqrt(sum * sum + NORMALIZATION_ALPHA);
        String label = compound >= NEUTRAL_BAND ? SentimentScore.POSITIVE
                : compound <= -NEUTRAL_BAND ? SentimentScore.NEGATIVE
                : SentimentScore.NEUTRAL;
        return new SentimentScore(label, compound, magnitude);
    }
}
