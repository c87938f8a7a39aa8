package com.surveyaudit.nlp;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 基于书写系统和停用词命中的语言识别。置信度不足时返回 unknown，不做猜测。
 */
public class LanguageIdentifier {

    private static final Map<Character.UnicodeScript, String> SCRIPT_LANGUAGES = Map.of(
            Character.UnicodeScript.HAN, "zh",
            Character.UnicodeScript.HIRAGANA, "ja",
            Character.UnicodeScript.KATAKANA, "ja",
            Character.UnicodeScript.HANGUL, "ko",
            Character.UnicodeScript.CYRILLIC, "ru",
            Character.UnicodeScript.ARABIC, "ar",
            Character.UnicodeScript.GREEK, "el",
            Character.UnicodeScript.HEBREW, "he",
            Character.UnicodeScript.THAI, "th");

    /** 达到满置信度所需的停用词命中数 */
    private static final double FULL_EVIDENCE_HITS = 3.0;

    public LanguageGuess identify(String text, TextModel model) {
        if (text == null || text.isBlank()) {
            return new LanguageGuess(LanguageGuess.UNKNOWN, 0.0);
        }

        Map<Character.UnicodeScript, Integer> scripts = new EnumMap<>(Character.UnicodeScript.class);
        int letters = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (Character.isLetter(cp)) {
                letters++;
                scripts.merge(Character.UnicodeScript.of(cp), 1, Integer::sum);
            }
        }
        if (letters == 0) {
            return new LanguageGuess(LanguageGuess.UNKNOWN, 0.0);
        }

        // 日文混排汉字，假名存在即判为日文
        int kana = scripts.getOrDefault(Character.UnicodeScript.HIRAGANA, 0)
                + scripts.getOrDefault(Character.UnicodeScript.KATAKANA, 0);
        if (kana > 0) {
            int han = scripts.getOrDefault(Character.UnicodeScript.HAN, 0);
            return floor(new LanguageGuess("ja", Math.min(1.0, (double) (kana + han) / letters)), model);
        }

        Character.UnicodeScript dominant = Character.UnicodeScript.LATIN;
        int dominantCount = 0;
        for (Map.Entry<Character.UnicodeScript, Integer> e : scripts.entrySet()) {
            if (e.getValue() > dominantCount) {
                dominant = e.getKey();
                dominantCount = e.getValue();
            }
        }
        if (dominant != Character.UnicodeScript.LATIN) {
            String lang = SCRIPT_LANGUAGES.get(dominant);
            if (lang == null) {
                return new LanguageGuess(LanguageGuess.UNKNOWN, 0.0);
            }
            return floor(new LanguageGuess(lang, (double) dominantCount / letters), model);
        }

        return floor(byStopwords(Tokenizer.words(text), model), model);
    }

    private LanguageGuess byStopwords(List<String> words, TextModel model) {
        String best = LanguageGuess.UNKNOWN;
        int bestHits = 0;
        int totalHits = 0;
        for (Map.Entry<String, Set<String>> e : model.stopwords().entrySet()) {
            int hits = 0;
            for (String w : words) {
                if (e.getValue().contains(w)) {
                    hits++;
                }
            }
            totalHits += hits;
            if (hits > bestHits) {
                best = e.getKey();
                bestHits = hits;
            }
        }
        if (bestHits == 0) {
            return new LanguageGuess(LanguageGuess.UNKNOWN, 0.0);
        }
        double share = (double) bestHits / totalHits;
        double evidence = Math.min(1.0, bestHits / FULL_EVIDENCE_HITS);
        return new LanguageGuess(best, share * evidence);
    }

    private LanguageGuess floor(LanguageGuess guess, TextModel model) {
        if (guess.confidence() < model.languageConfidenceFloor()) {
            return new LanguageGuess(LanguageGuess.UNKNOWN, guess.confidence());
        }
        return guess;
    }
}
