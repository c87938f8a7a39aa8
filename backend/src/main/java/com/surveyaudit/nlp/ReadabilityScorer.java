package com.surveyaudit.nlp;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;

public class ReadabilityScorer {

    /** 达到满长度分所需词数 */
    private static final double FULL_LENGTH_WORDS = 20.0;

    public Readability score(String text) {
        if (text == null || text.isBlank()) {
            return new Readability(0, 0, 0.0, "very_easy", 0.0, 0.0, 0.0);
        }
        String[] raw = text.trim().split("\\s+");
        List<String> words = Tokenizer.rawWords(text);
        int sentenceCount = Math.max(1, Tokenizer.sentences(text).size());

        double charsPerWord = words.isEmpty() ? 0.0
                : words.stream().mapToInt(String::length).average().orElse(0.0);
        double wordsPerSentence = (double) raw.length / sentenceCount;
        double score = 0.39 * wordsPerSentence + 11.8 * charsPerWord - 15.59;

        double diversity = words.isEmpty() ? 0.0
                : (double) new HashSet<>(Tokenizer.words(text)).size() / words.size();
        double grammar = grammarScore(text, words);
        double length = Math.min(1.0, raw.length / FULL_LENGTH_WORDS);
        double quality = clamp(0.3 * length + 0.3 * diversity + 0.4 * grammar);

        return new Readability(raw.length, sentenceCount, score, level(score), diversity, grammar, quality);
    }

    private double grammarScore(String text, List<String> words) {
        if (words.isEmpty()) {
            return 0.0;
        }
        double score = 1.0;
        String trimmed = text.trim();
        int first = trimmed.codePointAt(0);
        if (Character.isLetter(first) && Character.isLowerCase(first)) {
            score -= 0.2;
        }
        if (words.size() >= 5 && !Tokenizer.endsWithTerminalPunctuation(trimmed)) {
            score -= 0.1;
        }
        if (words.size() >= 3 && trimmed.equals(trimmed.toUpperCase(Locale.ROOT))
                && !trimmed.equals(trimmed.toLowerCase(Locale.ROOT))) {
            score -= 0.3;
        }
        int repeats = 0;
        for (int i = 1; i < words.size(); i++) {
            if (words.get(i).equalsIgnoreCase(words.get(i - 1))) {
                repeats++;
            }
        }
        score -= Math.min(0.4, repeats * 0.2);
        long mixed = words.stream()
                .filter(w -> w.chars().anyMatch(Character::isDigit) && w.chars().anyMatch(Character::isLetter))
                .count();
        if (mixed > 0) {
            score -= Math.min(0.2, 0.1 * mixed);
        }
        return clamp(score);
    }

    private String level(double score) {
        if (score < 30) {
            return "very_easy";
        } else if (score < 50) {
            return "easy";
        } else if (score < 70) {
            return "moderate";
        } else if (score < 90) {
            return "difficult";
        }
        return "very_difficult";
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
