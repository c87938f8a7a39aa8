package com.surveyaudit.nlp;

/**
 * 可读性与文本质量
 *
 * @param wordCount         词数
 * @param sentenceCount     句数
 * @param score             0.39·词/句 + 11.8·字符/词 − 15.59
 * @param level             very_easy / easy / moderate / difficult / very_difficult
 * @param lexicalDiversity  不同词占比
 * @param grammarScore      语法启发式得分 [0,1]
 * @param quality           综合质量 [0,1]
 */
public record Readability(
        int wordCount,
        int sentenceCount,
        double score,
        String level,
        double lexicalDiversity,
        double grammarScore,
        double quality) {
}
