package com.surveyaudit.nlp;

import java.util.ArrayList;
import java.util.List;

public class ProfanityDetector {

    /**
     * 返回命中的不当用语（按出现顺序，去重）
     */
    public List<String> find(String text, TextModel model) {
        List<String> hits = new ArrayList<>();
        for (String w : Tokenizer.words(text)) {
            String normalized = w.replace("'", "");
            if (model.profanity().contains(normalized) && !hits.contains(normalized)) {
                hits.add(normalized);
            }
        }
        return hits;
    }
}
