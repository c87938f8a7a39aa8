package com.surveyaudit.service;

import com.surveyaudit.exception.NoPriorVersionException;
import com.surveyaudit.exception.VersionConflictException;
import com.surveyaudit.model.*;
import com.surveyaudit.rule.checker.QualityChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 规则版本管理。
 * <p>
 * 每个检查项有一条只追加的版本链，首次访问时由目录默认值生成创世版本（{@code @v1}，作者 system）。
 * 提议、激活、回滚都写入只追加的审计日志并发布应用事件。追加与激活在检查项级别加锁，读取不加锁。
 */
@Service
public class RuleVersionService {

    private static final Logger log = LoggerFactory.getLogger(RuleVersionService.class);

    static final String SYSTEM_AUTHOR = "system";

    private final RuleRegistry ruleRegistry;
    private final RuleParameterValidator validator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Map<String, Lineage> lineages = new ConcurrentHashMap<>();
    private final List<RuleAuditEvent> auditLog = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public RuleVersionService(RuleRegistry ruleRegistry, RuleParameterValidator validator,
                              ApplicationEventPublisher eventPublisher, Clock clock) {
        this.ruleRegistry = ruleRegistry;
        this.validator = validator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 提议新版本。参数在当前激活版本的基础上覆盖；严重等级与启用状态为空时沿用激活版本。
     * 新版本不会自动激活。审计事件在检查项锁内写入，保证同一检查项的事件顺序与版本链一致。
     */
    public RuleVersion propose(String checkId, Map<String, ?> parameters, Severity severity, Boolean enabled,
                               String author, String comment) {
        QualityCheck check = ruleRegistry.get(checkId);
        QualityChecker checker = ruleRegistry.checker(check.getCheckerName())
                .orElseThrow(() -> new IllegalArgumentException("检查项绑定的检查器未注册: " + check.getCheckerName()));
        validator.validate(checker, parameters);

        Lineage lineage = lineage(checkId);
        RuleVersion created;
        RuleVersion active;
        synchronized (lineage) {
            active = lineage.active();
            int number = lineage.versions.size() + 1;
            created = new RuleVersion(
                    RuleVersion.idOf(checkId, number),
                    checkId,
                    number,
                    severity != null ? severity : active.severity(),
                    enabled != null ? enabled : active.enabled(),
                    active.parameters().merge(parameters),
                    author,
                    comment,
                    clock.instant());
            lineage.versions.add(created);
            audit(RuleAuditEvent.Action.PROPOSE, checkId, active, created, author);
        }
        log.info("检查项 {} 提议新版本 {}（作者 {}）", checkId, created.id(), author);
        return created;
    }

    /**
     * 激活版本链中的指定版本
     */
    public RuleVersion activate(String checkId, String versionId, String author) {
        ruleRegistry.get(checkId);
        Lineage lineage = lineage(checkId);
        RuleVersion previous;
        RuleVersion target;
        synchronized (lineage) {
            target = lineage.find(versionId).orElseThrow(() ->
                    new VersionConflictException("版本 " + versionId + " 不属于检查项 " + checkId));
            previous = lineage.active();
            lineage.activeId = target.id();
            audit(RuleAuditEvent.Action.ACTIVATE, checkId, previous, target, author);
        }
        log.info("检查项 {} 激活版本 {} -> {}（作者 {}）", checkId, previous.id(), target.id(), author);
        return target;
    }

    /**
     * 回滚到当前激活版本的前一个版本
     */
    public RuleVersion rollback(String checkId, String author) {
        ruleRegistry.get(checkId);
        Lineage lineage = lineage(checkId);
        RuleVersion previous;
        RuleVersion target;
        synchronized (lineage) {
            previous = lineage.active();
            if (previous.versionNumber() <= 1) {
                throw new NoPriorVersionException(checkId);
            }
            target = lineage.versions.get(previous.versionNumber() - 2);
            lineage.activeId = target.id();
            audit(RuleAuditEvent.Action.ROLLBACK, checkId, previous, target, author);
        }
        log.info("检查项 {} 回滚 {} -> {}（作者 {}）", checkId, previous.id(), target.id(), author);
        return target;
    }

    public RuleVersion active(String checkId) {
        ruleRegistry.get(checkId);
        return lineage(checkId).active();
    }

    /**
     * 按版本 ID 查找；版本不属于该检查项时为空
     */
    public Optional<RuleVersion> find(String checkId, String versionId) {
        if (ruleRegistry.find(checkId).isEmpty()) {
            return Optional.empty();
        }
        return lineage(checkId).find(versionId);
    }

    public List<RuleVersion> history(String checkId) {
        ruleRegistry.get(checkId);
        return List.copyOf(lineage(checkId).versions);
    }

    public RuleVersionDiff compare(String checkId, String fromVersionId, String toVersionId) {
        ruleRegistry.get(checkId);
        Lineage lineage = lineage(checkId);
        RuleVersion from = lineage.find(fromVersionId).orElseThrow(() ->
                new VersionConflictException("版本 " + fromVersionId + " 不属于检查项 " + checkId));
        RuleVersion to = lineage.find(toVersionId).orElseThrow(() ->
                new VersionConflictException("版本 " + toVersionId + " 不属于检查项 " + checkId));
        return diff(from, to);
    }

    public List<RuleAuditEvent> auditLog() {
        return List.copyOf(auditLog);
    }

    static RuleVersionDiff diff(RuleVersion from, RuleVersion to) {
        Map<String, Object> before = from.parameters().asMap();
        Map<String, Object> after = to.parameters().asMap();
        Map<String, Object> added = new TreeMap<>();
        Map<String, Object> removed = new TreeMap<>();
        Map<String, Map<String, Object>> modified = new TreeMap<>();
        for (Map.Entry<String, Object> e : after.entrySet()) {
            if (!before.containsKey(e.getKey())) {
                added.put(e.getKey(), e.getValue());
            } else if (!Objects.equals(before.get(e.getKey()), e.getValue())) {
                modified.put(e.getKey(), change(before.get(e.getKey()), e.getValue()));
            }
        }
        for (Map.Entry<String, Object> e : before.entrySet()) {
            if (!after.containsKey(e.getKey())) {
                removed.put(e.getKey(), e.getValue());
            }
        }
        return new RuleVersionDiff(from.id(), to.id(), added, removed, modified);
    }

    private Lineage lineage(String checkId) {
        return lineages.computeIfAbsent(checkId, id -> {
            QualityCheck check = ruleRegistry.get(id);
            RuleVersion genesis = new RuleVersion(
                    RuleVersion.idOf(id, 1),
                    id,
                    1,
                    check.getSeverity(),
                    true,
                    CheckParameters.of(ruleRegistry.genesisParameters(check)),
                    SYSTEM_AUTHOR,
                    "默认配置",
                    clock.instant());
            return new Lineage(genesis);
        });
    }

    private void audit(RuleAuditEvent.Action action, String checkId, RuleVersion from, RuleVersion to, String author) {
        Map<String, Map<String, Object>> diff = new TreeMap<>();
        RuleVersionDiff d = diff(from, to);
        d.added().forEach((k, v) -> diff.put(k, change(null, v)));
        d.removed().forEach((k, v) -> diff.put(k, change(v, null)));
        diff.putAll(d.modified());
        if (from.severity() != to.severity()) {
            diff.put("severity", change(from.severity(), to.severity()));
        }
        if (from.enabled() != to.enabled()) {
            diff.put("enabled", change(from.enabled(), to.enabled()));
        }
        RuleAuditEvent event = new RuleAuditEvent(
                sequence.incrementAndGet(),
                action,
                checkId,
                from.id(),
                to.id(),
                author,
                clock.instant(),
                Collections.unmodifiableMap(diff));
        auditLog.add(event);
        eventPublisher.publishEvent(event);
    }

    private static Map<String, Object> change(Object oldValue, Object newValue) {
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("old", oldValue);
        change.put("new", newValue);
        return Collections.unmodifiableMap(change);
    }

    private static final class Lineage {

        private final List<RuleVersion> versions = new CopyOnWriteArrayList<>();
        private volatile String activeId;

        Lineage(RuleVersion genesis) {
            versions.add(genesis);
            activeId = genesis.id();
        }

        RuleVersion active() {
            return find(activeId).orElseThrow();
        }

        Optional<RuleVersion> find(String versionId) {
            for (RuleVersion v : versions) {
                if (v.id().equals(versionId)) {
                    return Optional.of(v);
                }
            }
            return Optional.empty();
        }
    }
}
