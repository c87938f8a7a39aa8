package com.surveyaudit.controller;

import com.surveyaudit.exception.UnknownCheckException;
import com.surveyaudit.exception.UnknownDatasetException;
import com.surveyaudit.exception.VersionConflictException;
import com.surveyaudit.ml.ModelRegistry;
import com.surveyaudit.model.*;
import com.surveyaudit.service.ModelAdaptationService;
import com.surveyaudit.service.RuleRegistry;
import com.surveyaudit.service.RuleVersionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * 检查项配置、规则版本与模型版本 API
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class RuleConfigController {

    private static final Logger log = LoggerFactory.getLogger(RuleConfigController.class);

    private final RuleRegistry ruleRegistry;
    private final RuleVersionService ruleVersionService;
    private final ModelRegistry modelRegistry;
    private final ModelAdaptationService adaptationService;

    public RuleConfigController(RuleRegistry ruleRegistry,
                                RuleVersionService ruleVersionService,
                                ModelRegistry modelRegistry,
                                ModelAdaptationService adaptationService) {
        this.ruleRegistry = ruleRegistry;
        this.ruleVersionService = ruleVersionService;
        this.modelRegistry = modelRegistry;
        this.adaptationService = adaptationService;
    }

    /**
     * 全部检查项及其当前激活版本
     */
    @GetMapping("/checks")
    public ResponseEntity<List<Map<String, Object>>> listChecks() {
        List<Map<String, Object>> body = new ArrayList<>();
        for (QualityCheck check : ruleRegistry.all()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("check", check);
            item.put("activeVersion", ruleVersionService.active(check.getId()));
            body.add(item);
        }
        return ResponseEntity.ok(body);
    }

    /**
     * 注册自定义检查项
     */
    @PostMapping("/checks")
    public ResponseEntity<?> registerCheck(@RequestBody QualityCheck check) {
        try {
            return ResponseEntity.ok(ruleRegistry.register(check));
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    /**
     * 提交新规则版本（不自动激活）
     */
    @PostMapping("/checks/{checkId}/versions")
    public ResponseEntity<?> propose(@PathVariable String checkId, @RequestBody Map<String, Object> request) {
        try {
            Object params = request.getOrDefault("parameters", Map.of());
            if (!(params instanceof Map<?, ?> map)) {
                return error(HttpStatus.BAD_REQUEST, "parameters 必须是对象");
            }
            Map<String, Object> parameters = new LinkedHashMap<>();
            map.forEach((k, v) -> parameters.put(String.valueOf(k), v));
            Object severity = request.get("severity");
            Object enabled = request.get("enabled");
            RuleVersion version = ruleVersionService.propose(checkId, parameters,
                    severity == null ? null : Severity.valueOf(severity.toString().trim().toUpperCase()),
                    enabled == null ? null : Boolean.valueOf(enabled.toString()),
                    author(request.get("author")),
                    request.get("comment") == null ? null : request.get("comment").toString());
            return ResponseEntity.ok(version);
        } catch (UnknownCheckException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @PostMapping("/checks/{checkId}/versions/{versionId}/activate")
    public ResponseEntity<?> activate(@PathVariable String checkId, @PathVariable String versionId,
                                      @RequestParam(required = false) String author) {
        try {
            return ResponseEntity.ok(ruleVersionService.activate(checkId, versionId, author(author)));
        } catch (UnknownCheckException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (VersionConflictException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @PostMapping("/checks/{checkId}/rollback")
    public ResponseEntity<?> rollback(@PathVariable String checkId, @RequestParam(required = false) String author) {
        try {
            return ResponseEntity.ok(ruleVersionService.rollback(checkId, author(author)));
        } catch (UnknownCheckException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (VersionConflictException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping("/checks/{checkId}/versions")
    public ResponseEntity<?> history(@PathVariable String checkId) {
        try {
            return ResponseEntity.ok(ruleVersionService.history(checkId));
        } catch (UnknownCheckException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @GetMapping("/checks/{checkId}/compare")
    public ResponseEntity<?> compare(@PathVariable String checkId, @RequestParam String from, @RequestParam String to) {
        try {
            return ResponseEntity.ok(ruleVersionService.compare(checkId, from, to));
        } catch (UnknownCheckException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (VersionConflictException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping("/audit")
    public ResponseEntity<List<RuleAuditEvent>> auditLog() {
        return ResponseEntity.ok(ruleVersionService.auditLog());
    }

    /**
     * 各模型族的版本历史
     */
    @GetMapping("/models")
    public ResponseEntity<Map<ModelFamily, List<ModelVersion>>> models() {
        Map<ModelFamily, List<ModelVersion>> body = new EnumMap<>(ModelFamily.class);
        for (ModelFamily family : ModelFamily.values()) {
            body.put(family, modelRegistry.history(family));
        }
        return ResponseEntity.ok(body);
    }

    /**
     * 提交增量训练，训练在后台执行，完成后可在模型列表中看到新版本
     */
    @PostMapping("/models/{family}/adapt")
    public ResponseEntity<?> adapt(@PathVariable String family, @RequestParam String datasetId,
                                   @RequestParam(required = false) String parentVersionId) {
        try {
            ModelFamily modelFamily = ModelFamily.valueOf(family.trim().toUpperCase());
            adaptationService.adapt(modelFamily, datasetId, parentVersionId);
            return ResponseEntity.accepted().body(Map.of("message", "已提交 " + modelFamily + " 模型增量训练"));
        } catch (UnknownDatasetException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("提交增量训练失败, family={}", family, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "提交训练失败: " + e.getMessage());
        }
    }

    private static String author(Object author) {
        return author == null || author.toString().isBlank() ? "anonymous" : author.toString();
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
