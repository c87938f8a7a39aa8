package com.surveyaudit.nlp;

/**
 * 语言识别结果，置信度低于下限时语言为 {@link #UNKNOWN}
 */
public record LanguageGuess(String language, double confidence) {

    public static final String UNKNOWN = "unknown";

    public boolean isKnown() {
        return !UNKNOWN.equals(language);
    }
}
