package com.surveyaudit.nlp;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 实体抽取：正则类型 + 品牌词表 + 专有名词
 */
public class EntityExtractor {

    private static final Map<String, Pattern> PATTERNS;

    static {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put("product", Pattern.compile("\\b(product|item|goods|merchandise)\\b", Pattern.CASE_INSENSITIVE));
        patterns.put("service", Pattern.compile("\\b(service|support|assistance|help)\\b", Pattern.CASE_INSENSITIVE));
        patterns.put("price", Pattern.compile("\\$\\d+(?:\\.\\d{2})?|\\d+(?:\\.\\d{2})?\\s*(?:dollars|USD)", Pattern.CASE_INSENSITIVE));
        patterns.put("date", Pattern.compile("\\b\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4}\\b"));
        patterns.put("time", Pattern.compile("\\b\\d{1,2}:\\d{2}\\s*(?:AM|PM|am|pm)?\\b"));
        PATTERNS = Collections.unmodifiableMap(patterns);
    }

    private static final Pattern CAPITALIZED = Pattern.compile("\\b\\p{Lu}[\\p{L}'’-]*(?:\\s+\\p{Lu}[\\p{L}'’-]*)*");

    public List<Entity> extract(String text, TextModel model) {
        List<Entity> entities = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return entities;
        }
        for (Map.Entry<String, Pattern> e : PATTERNS.entrySet()) {
            Matcher m = e.getValue().matcher(text);
            while (m.find()) {
                entities.add(new Entity(e.getKey(), m.group(), m.start()));
            }
        }

        String lower = text.toLowerCase(Locale.ROOT);
        for (String brand : model.brands()) {
            Matcher m = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(brand) + "(?![\\p{L}\\p{N}])").matcher(lower);
            while (m.find()) {
                entities.add(new Entity("brand", text.substring(m.start(), m.end()), m.start()));
            }
        }

        Matcher m = CAPITALIZED.matcher(text);
        while (m.find()) {
            if (isSentenceStart(text, m.start()) && !m.group().contains(" ")) {
                continue;
            }
            String candidate = m.group().toLowerCase(Locale.ROOT);
            if (model.isStopword(candidate) || model.commonWords().contains(candidate) || model.brands().contains(candidate)) {
                continue;
            }
            entities.add(new Entity("proper_noun", m.group(), m.start()));
        }

        entities.sort(Comparator.comparingInt(Entity::start).thenComparing(Entity::type));
        return entities;
    }

    private boolean isSentenceStart(String text, int offset) {
        for (int i = offset - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            return ".!?。！？".indexOf(c) >= 0;
        }
        return true;
    }
}
