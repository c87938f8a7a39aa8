package com.surveyaudit.controller;

import com.surveyaudit.exception.SchedulerException;
import com.surveyaudit.exception.UnknownDatasetException;
import com.surveyaudit.exception.UnknownIssueException;
import com.surveyaudit.exception.UnknownRunException;
import com.surveyaudit.model.*;
import com.surveyaudit.service.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据集导入、检测运行、问题审核与报告导出 API
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class DetectionController {

    private static final Logger log = LoggerFactory.getLogger(DetectionController.class);

    private final DatasetRepository datasetRepository;
    private final DetectionService detectionService;
    private final IssueService issueService;
    private final ReportExportService reportExportService;

    public DetectionController(DatasetRepository datasetRepository,
                               DetectionService detectionService,
                               IssueService issueService,
                               ReportExportService reportExportService) {
        this.datasetRepository = datasetRepository;
        this.detectionService = detectionService;
        this.issueService = issueService;
        this.reportExportService = reportExportService;
    }

    /**
     * 导入数据集（字段模式 + 记录）
     */
    @PostMapping("/datasets")
    public ResponseEntity<?> uploadDataset(@RequestBody DatasetUpload upload) {
        try {
            Dataset dataset = datasetRepository.save(upload.toDataset());
            return ResponseEntity.ok(summary(dataset));
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("导入数据集失败", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "导入失败: " + e.getMessage());
        }
    }

    @GetMapping("/datasets")
    public ResponseEntity<List<Map<String, Object>>> listDatasets() {
        return ResponseEntity.ok(datasetRepository.all().stream().map(DetectionController::summary).toList());
    }

    /**
     * 按当前问题状态计算的评分卡
     */
    @GetMapping("/datasets/{datasetId}/scorecard")
    public ResponseEntity<?> scorecard(@PathVariable String datasetId) {
        try {
            return ResponseEntity.ok(issueService.scorecard(datasetId));
        } catch (UnknownDatasetException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    /**
     * 执行检测
     */
    @PostMapping("/runs")
    public ResponseEntity<?> run(@RequestBody RunRequest request) {
        if (request.getDatasetId() == null || request.getDatasetId().isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "请提供数据集 ID (datasetId)");
        }
        try {
            log.info("收到检测请求: 数据集 {}, 检查项 {}", request.getDatasetId(), request.getCheckIds());
            return ResponseEntity.ok(detectionService.runDetection(request));
        } catch (UnknownDatasetException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        } catch (SchedulerException e) {
            log.error("检测运行中止", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "检测中止: " + e.getMessage());
        } catch (Exception e) {
            log.error("检测失败", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "检测过程中出错: " + e.getMessage());
        }
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<?> getRun(@PathVariable String runId) {
        try {
            return ResponseEntity.ok(detectionService.getRun(runId));
        } catch (UnknownRunException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String runId) {
        if (!detectionService.cancel(runId)) {
            return error(HttpStatus.NOT_FOUND, "运行不存在或已结束: " + runId);
        }
        return ResponseEntity.ok(Map.of("message", "已请求取消运行 " + runId));
    }

    /**
     * 导出运行报告，format 取 json / markdown / xlsx
     */
    @GetMapping("/runs/{runId}/export")
    public ResponseEntity<?> export(@PathVariable String runId,
                                    @RequestParam(defaultValue = "markdown") String format) {
        try {
            RunResult run = detectionService.getRun(runId);
            ReportExportService.ExportPayload payload;
            if ("markdown".equalsIgnoreCase(format)) {
                payload = reportExportService.exportMarkdown(run, issueService.scorecard(run.getDatasetId()));
            } else if ("json".equalsIgnoreCase(format)) {
                payload = reportExportService.exportJson(run, issueService.scorecard(run.getDatasetId()));
            } else if ("xlsx".equalsIgnoreCase(format)) {
                payload = reportExportService.exportXlsx(run);
            } else {
                return error(HttpStatus.BAD_REQUEST, "不支持的导出格式: " + format);
            }

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(payload.contentType()));
            headers.setContentLength(payload.content().length);
            headers.setContentDisposition(ContentDisposition.attachment()
                    .filename(payload.filename(), StandardCharsets.UTF_8)
                    .build());
            return new ResponseEntity<>(payload.content(), headers, HttpStatus.OK);
        } catch (UnknownRunException | UnknownDatasetException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            log.error("导出报告失败, runId={}, format={}", runId, format, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "导出失败: " + e.getMessage());
        }
    }

    @GetMapping("/issues")
    public ResponseEntity<List<Issue>> listIssues(@RequestParam(required = false) String datasetId,
                                                  @RequestParam(required = false) IssueStatus status,
                                                  @RequestParam(required = false) Severity severity,
                                                  @RequestParam(required = false) CheckCategory category,
                                                  @RequestParam(required = false) String checkId) {
        return ResponseEntity.ok(issueService.list(new IssueFilter(datasetId, status, severity, category, checkId)));
    }

    /**
     * 审核问题，返回更新后的问题与重新计算的评分卡
     */
    @PutMapping("/issues/{issueId}/status")
    public ResponseEntity<?> setIssueStatus(@PathVariable String issueId, @RequestBody Map<String, String> request) {
        String status = request.get("status");
        if (status == null || status.isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "请提供审核状态 (status)");
        }
        try {
            Issue issue = issueService.setIssueStatus(issueId, IssueStatus.valueOf(status.trim().toUpperCase()),
                    request.get("reviewer"));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("issue", issue);
            body.put("scorecard", issueService.scorecard(issue.getDatasetId()));
            return ResponseEntity.ok(body);
        } catch (UnknownIssueException | UnknownDatasetException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, "无效的审核状态: " + status);
        }
    }

    private static Map<String, Object> summary(Dataset dataset) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", dataset.id());
        summary.put("records", dataset.size());
        summary.put("fields", List.copyOf(dataset.schema().fieldNames()));
        dataset.collectedAt().ifPresent(t -> summary.put("collectedAt", t));
        return summary;
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
