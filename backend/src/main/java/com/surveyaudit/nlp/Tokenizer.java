package com.surveyaudit.nlp;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文本切分工具
 */
public final class Tokenizer {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:['’][\\p{L}]+)?");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?。！？]+");

    private Tokenizer() {
    }

    /**
     * 小写化后的词序列
     */
    public static List<String> words(String text) {
        List<String> words = rawWords(text);
        List<String> lower = new ArrayList<>(words.size());
        for (String w : words) {
            lower.add(w.toLowerCase(Locale.ROOT));
        }
        return lower;
    }

    /**
     * 保留原始大小写的词序列，撇号统一为 ASCII
     */
    public static List<String> rawWords(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return words;
        }
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            words.add(m.group().replace('’', '\''));
        }
        return words;
    }

    public static List<String> sentences(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }
        for (String part : SENTENCE_END.split(text)) {
            if (!part.isBlank()) {
                sentences.add(part.trim());
            }
        }
        return sentences;
    }

    public static boolean endsWithTerminalPunctuation(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        char last = text.trim().charAt(text.trim().length() - 1);
        return ".!?。！？".indexOf(last) >= 0;
    }
}
