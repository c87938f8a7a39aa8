package com.surveyaudit.exception;

/**
 * 模型制品无法加载或类型不符
 */
public class ModelArtifactException extends RuntimeException {

    public ModelArtifactException(String message) {
        super(message);
    }
}
