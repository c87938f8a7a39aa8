package com.surveyaudit.nlp;

import java.util.*;
import java.util.regex.Pattern;

/**
 * 无意义文本打分：键盘连击、字符重复、无元音词、辅音堆叠、低字符多样性。得分范围 [0,1]。
 */
public class GarbageTextDetector {

    private static final Pattern REPEATED_CHAR = Pattern.compile("(.)\\1{3,}");
    private static final Pattern LATIN_WORD = Pattern.compile("[a-z]+");
    private static final Pattern VOWEL = Pattern.compile("[aeiouy]");
    private static final Pattern CONSONANT_CLUSTER = Pattern.compile("[bcdfghjklmnpqrstvwxz]{5,}");

    public double score(String text, TextModel model) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String lower = text.toLowerCase(Locale.ROOT).trim();
        if (lower.codePoints().noneMatch(Character::isLetter)) {
            return lower.length() >= 3 ? 0.8 : 0.0;
        }

        double score = 0.0;
        for (String pattern : model.keyboardPatterns()) {
            if (lower.contains(pattern)) {
                score += 0.45;
                break;
            }
        }
        if (REPEATED_CHAR.matcher(lower).find()) {
            score += 0.3;
        }

        List<String> latin = new ArrayList<>();
        for (String w : Tokenizer.words(lower)) {
            if (LATIN_WORD.matcher(w).matches() && !model.commonWords().contains(w)
                    && !model.sentimentLexicon().containsKey(w) && !model.isStopword(w)) {
                latin.add(w);
            }
        }
        List<String> all = Tokenizer.words(lower);
        if (!latin.isEmpty() && !all.isEmpty()) {
            long vowelLess = latin.stream()
                    .filter(w -> w.length() >= 3 && !VOWEL.matcher(w).find())
                    .count();
            long clusters = latin.stream()
                    .filter(w -> CONSONANT_CLUSTER.matcher(w).find())
                    .count();
            score += 0.5 * vowelLess / all.size();
            score += 0.3 * clusters / all.size();
        }

        String compact = lower.replaceAll("\\s+", "");
        if (compact.length() >= 8) {
            Set<Integer> distinct = new HashSet<>();
            compact.codePoints().forEach(distinct::add);
            if ((double) distinct.size() / compact.length() < 0.25) {
                score += 0.3;
            }
        }
        return Math.min(1.0, score);
    }
}
