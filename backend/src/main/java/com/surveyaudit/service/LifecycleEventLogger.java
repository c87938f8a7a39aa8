package com.surveyaudit.service;

import com.surveyaudit.model.LifecycleEvent;
import com.surveyaudit.model.RuleAuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 生命周期事件与规则审计事件的日志出口，集成方可以注册自己的监听器替代
 */
@Component
public class LifecycleEventLogger {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEventLogger.class);

    @EventListener
    public void onLifecycleEvent(LifecycleEvent event) {
        if (event.type() == LifecycleEvent.Type.CHECK_FAILED) {
            log.warn("[{}] 运行 {} 检查项 {}: {}", event.type().topic(), event.runId(), event.subject(), event.attributes());
        } else {
            log.info("[{}] 运行 {} 数据集 {} {} {}", event.type().topic(), event.runId(), event.datasetId(),
                    event.subject() == null ? "" : event.subject(), event.attributes());
        }
    }

    @EventListener
    public void onRuleAudit(RuleAuditEvent event) {
        log.info("[rule.{}] #{} {} {} -> {}（{}）", event.action().name().toLowerCase(), event.sequence(),
                event.checkId(), event.fromVersion(), event.toVersion(), event.author());
    }
}
