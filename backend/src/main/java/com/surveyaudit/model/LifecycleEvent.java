package com.surveyaudit.model;

import java.time.Instant;
import java.util.Map;

/**
 * 生命周期事件，供集成/Webhook 协作方消费
 *
 * @param type      事件类型
 * @param runId     运行 ID，模型事件为 null
 * @param datasetId 数据集 ID
 * @param subject   事件主体：检查项 ID 或模型版本 ID
 * @param attributes 附加属性
 * @param timestamp 事件时间
 */
public record LifecycleEvent(
        Type type,
        String runId,
        String datasetId,
        String subject,
        Map<String, Object> attributes,
        Instant timestamp) {

    public enum Type {
        DETECTION_STARTED("detection.started"),
        DETECTION_COMPLETED("detection.completed"),
        CHECK_FAILED("check.failed"),
        MODEL_ADAPTED("model.adapted");

        private final String topic;

        Type(String topic) {
            this.topic = topic;
        }

        public String topic() {
            return topic;
        }
    }
}
