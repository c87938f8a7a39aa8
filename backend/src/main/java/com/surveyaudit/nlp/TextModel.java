package com.surveyaudit.nlp;

import com.surveyaudit.ml.ModelArtifact;
import com.surveyaudit.model.ModelFamily;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * 文本模型（TEXT 模型族的制品）：情感词典、停用词、脏话表、品牌表等。
 * <p>
 * 加载后不可变，NLP 结果只取决于文本与所固定的文本模型。
 */
public final class TextModel implements ModelArtifact {

    public static final String DEFAULT_LOCATION = "classpath:lexicon";

    static final List<String> LANGUAGES = List.of("de", "en", "es", "fr", "it", "pt");

    private final Map<String, Double> sentimentLexicon;
    private final Set<String> negations;
    private final Map<String, Double> boosters;
    private final Map<String, Set<String>> stopwords;
    private final Set<String> profanity;
    private final Set<String> commonWords;
    private final List<String> keyboardPatterns;
    private final List<String> brands;
    private final double languageConfidenceFloor;

    public TextModel(Map<String, Double> sentimentLexicon,
                     Set<String> negations,
                     Map<String, Double> boosters,
                     Map<String, Set<String>> stopwords,
                     Set<String> profanity,
                     Set<String> commonWords,
                     List<String> keyboardPatterns,
                     List<String> brands,
                     double languageConfidenceFloor) {
        this.sentimentLexicon = Map.copyOf(sentimentLexicon);
        this.negations = Set.copyOf(negations);
        this.boosters = Map.copyOf(boosters);
        Map<String, Set<String>> sw = new TreeMap<>();
        stopwords.forEach((lang, words) -> sw.put(lang, Set.copyOf(words)));
        this.stopwords = Collections.unmodifiableMap(sw);
        this.profanity = Set.copyOf(profanity);
        this.commonWords = Set.copyOf(commonWords);
        this.keyboardPatterns = List.copyOf(keyboardPatterns);
        this.brands = List.copyOf(brands);
        this.languageConfidenceFloor = languageConfidenceFloor;
    }

    /**
     * 从类路径目录加载词典
     */
    public static TextModel load(String directory, double languageConfidenceFloor) {
        String base = directory.startsWith("classpath:") ? directory.substring("classpath:".length()) : directory;
        Map<String, Set<String>> stopwords = new TreeMap<>();
        for (String lang : LANGUAGES) {
            stopwords.put(lang, new HashSet<>(readLines(base + "/stopwords/" + lang + ".txt")));
        }
        return new TextModel(
                readWeights(base + "/sentiment.tsv"),
                new HashSet<>(readLines(base + "/negations.txt")),
                readWeights(base + "/boosters.tsv"),
                stopwords,
                new HashSet<>(readLines(base + "/profanity.txt")),
                new HashSet<>(readLines(base + "/common-words.txt")),
                readLines(base + "/keyboard-patterns.txt"),
                readLines(base + "/brands.txt"),
                languageConfidenceFloor);
    }

    public static TextModel loadDefault(double languageConfidenceFloor) {
        return load(DEFAULT_LOCATION, languageConfidenceFloor);
    }

    private static List<String> readLines(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    lines.add(trimmed.toLowerCase(Locale.ROOT));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("词典加载失败: " + path, e);
        }
        return lines;
    }

    private static Map<String, Double> readWeights(String path) {
        Map<String, Double> weights = new HashMap<>();
        for (String line : readLines(path)) {
            String[] parts = line.split("\\s+");
            if (parts.length != 2) {
                throw new IllegalStateException("词典格式错误: " + path + " -> " + line);
            }
            weights.put(parts[0], Double.parseDouble(parts[1]));
        }
        return weights;
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.TEXT;
    }

    public Map<String, Double> sentimentLexicon() {
        return sentimentLexicon;
    }

    public Set<String> negations() {
        return negations;
    }

    public Map<String, Double> boosters() {
        return boosters;
    }

    /** 语言代码 → 停用词，按语言代码排序 */
    public Map<String, Set<String>> stopwords() {
        return stopwords;
    }

    public boolean isStopword(String word) {
        for (Set<String> words : stopwords.values()) {
            if (words.contains(word)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> profanity() {
        return profanity;
    }

    public Set<String> commonWords() {
        return commonWords;
    }

    public List<String> keyboardPatterns() {
        return keyboardPatterns;
    }

    public List<String> brands() {
        return brands;
    }

    public double languageConfidenceFloor() {
        return languageConfidenceFloor;
    }
}
