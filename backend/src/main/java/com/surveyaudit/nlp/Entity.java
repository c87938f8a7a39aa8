package com.surveyaudit.nlp;

/**
 * 抽取到的实体
 *
 * @param type  实体类型：product / service / price / date / time / brand / proper_noun
 * @param text  原文片段
 * @param start 起始偏移
 */
public record Entity(String type, String text, int start) {
}
