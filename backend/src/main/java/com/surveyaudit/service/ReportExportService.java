package com.surveyaudit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.surveyaudit.model.*;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * 检测报告导出服务
 */
@Service
public class ReportExportService {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private static final String[] ISSUE_COLUMNS = {
            "问题 ID", "记录序号", "记录 ID", "检查项", "分类", "严重等级", "置信度",
            "状态", "规则版本", "模型版本", "说明", "匹配内容"};

    private static final String[] CHECK_COLUMNS = {
            "检查项", "检查器", "状态", "原因", "问题数", "耗时(ms)", "分片数", "规则版本", "模型版本"};

    private final ObjectMapper objectMapper;

    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExportPayload exportMarkdown(RunResult run, Scorecard scorecard) {
        String markdown = buildMarkdown(run, scorecard);
        byte[] content = markdown.getBytes(StandardCharsets.UTF_8);
        return new ExportPayload(
                fileName(run, "md"),
                "text/markdown;charset=UTF-8",
                content);
    }

    public ExportPayload exportJson(RunResult run, Scorecard scorecard) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("run", run);
            body.put("scorecard", scorecard);
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(body);
            return new ExportPayload(
                    fileName(run, "json"),
                    "application/json;charset=UTF-8",
                    content);
        } catch (Exception e) {
            throw new IllegalStateException("JSON 导出失败: " + e.getMessage(), e);
        }
    }

    /**
     * 导出 Excel：问题明细 + 检查项执行状态两个工作表
     */
    public ExportPayload exportXlsx(RunResult run) {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            CellStyle headerStyle = headerStyle(workbook);

            Sheet issueSheet = workbook.createSheet("问题");
            header(issueSheet, ISSUE_COLUMNS, headerStyle);
            int rowNum = 1;
            for (Issue issue : orEmpty(run.getIssues())) {
                Row row = issueSheet.createRow(rowNum++);
                int c = 0;
                row.createCell(c++).setCellValue(issue.getId());
                row.createCell(c++).setCellValue(issue.getRecordIndex());
                row.createCell(c++).setCellValue(orEmpty(issue.getRecordId()));
                row.createCell(c++).setCellValue(issue.getCheckId());
                row.createCell(c++).setCellValue(name(issue.getCategory()));
                row.createCell(c++).setCellValue(name(issue.getSeverity()));
                row.createCell(c++).setCellValue(issue.getConfidence());
                row.createCell(c++).setCellValue(name(issue.getStatus()));
                row.createCell(c++).setCellValue(orEmpty(issue.getRuleVersionId()));
                row.createCell(c++).setCellValue(orEmpty(issue.getModelVersionId()));
                row.createCell(c++).setCellValue(orEmpty(issue.getExplanation()));
                row.createCell(c).setCellValue(orEmpty(issue.getMatchedText()));
            }

            Sheet checkSheet = workbook.createSheet("检查项状态");
            header(checkSheet, CHECK_COLUMNS, headerStyle);
            rowNum = 1;
            for (CheckExecution e : orEmpty(run.getCheckStatuses())) {
                Row row = checkSheet.createRow(rowNum++);
                int c = 0;
                row.createCell(c++).setCellValue(e.getCheckId());
                row.createCell(c++).setCellValue(orEmpty(e.getCheckerName()));
                row.createCell(c++).setCellValue(name(e.getStatus()));
                row.createCell(c++).setCellValue(orEmpty(e.getReason()));
                row.createCell(c++).setCellValue(e.getIssueCount());
                row.createCell(c++).setCellValue(e.getElapsedMillis());
                row.createCell(c++).setCellValue(e.getPartitions());
                row.createCell(c++).setCellValue(orEmpty(e.getRuleVersionId()));
                row.createCell(c).setCellValue(orEmpty(e.getModelVersionId()));
            }
            checkSheet.setColumnWidth(0, 24 * 256);
            checkSheet.setColumnWidth(3, 48 * 256);

            workbook.write(out);
            return new ExportPayload(
                    fileName(run, "xlsx"),
                    "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
                    out.toByteArray());
        } catch (IOException e) {
            throw new IllegalStateException("Excel 导出失败: " + e.getMessage(), e);
        }
    }

    private String buildMarkdown(RunResult run, Scorecard scorecard) {
        StringBuilder md = new StringBuilder();
        md.append("# 问卷数据质量检测报告\n\n");
        md.append("**运行 ID:** `").append(escapeInlineCode(run.getRunId())).append("`\n");
        md.append("**数据集:** `").append(escapeInlineCode(run.getDatasetId())).append("`\n");
        md.append("**检测时间:** ").append(run.getStartedAt() != null ? run.getStartedAt() : "").append("\n");
        md.append("**耗时:** ").append(run.getElapsedMillis()).append(" ms\n\n");

        if (run.isCancelled()) {
            md.append("> ⚠️ **运行已取消，结果不完整**\n\n");
        }

        List<Issue> issues = orEmpty(run.getIssues());
        md.append("## 📊 统计摘要\n");
        md.append("- **记录总数:** ").append(run.getTotalRecords()).append("\n");
        md.append("- **问题总数:** ").append(issues.size());
        Map<Severity, Integer> counts = run.getSeverityCounts() != null ? run.getSeverityCounts() : Map.of();
        StringJoiner bySeverity = new StringJoiner(", ", " (", ")");
        for (Severity s : Severity.values()) {
            bySeverity.add(s.name() + ": " + counts.getOrDefault(s, 0));
        }
        md.append(bySeverity).append("\n");
        if (run.getModelPins() != null && !run.getModelPins().isEmpty()) {
            md.append("- **模型版本:** ");
            StringJoiner pins = new StringJoiner(", ");
            run.getModelPins().forEach((family, version) -> pins.add("`" + escapeInlineCode(version) + "`"));
            md.append(pins).append("\n");
        }
        if (scorecard != null) {
            md.append(String.format(Locale.ROOT, "- **平均得分:** %.1f（中位数 %.1f，低分位 %.1f）%n",
                    scorecard.getMeanScore(), scorecard.getMedianScore(), scorecard.getLowPercentileScore()));
            md.append(String.format(Locale.ROOT, "- **问题记录占比:** %.1f%%%n", scorecard.getFlaggedRatio() * 100));
        }
        md.append("\n");

        md.append("## 🔎 检查项执行状态\n\n");
        md.append("| 检查项 | 状态 | 问题数 | 耗时(ms) | 说明 |\n");
        md.append("|---|---|---|---|---|\n");
        for (CheckExecution e : orEmpty(run.getCheckStatuses())) {
            md.append("| ").append(e.getCheckId())
                    .append(" | ").append(name(e.getStatus()))
                    .append(" | ").append(e.getIssueCount())
                    .append(" | ").append(e.getElapsedMillis())
                    .append(" | ").append(orEmpty(e.getReason()).replace("|", "\\|"))
                    .append(" |\n");
        }
        md.append("\n");

        if (issues.isEmpty()) {
            md.append("✅ **未发现质量问题**\n");
            return md.toString();
        }

        md.append("## 🚫 问题详情\n\n");
        Map<String, List<Issue>> grouped = new LinkedHashMap<>();
        for (Issue issue : issues) {
            grouped.computeIfAbsent(issue.getCheckId(), k -> new ArrayList<>()).add(issue);
        }
        for (Map.Entry<String, List<Issue>> entry : grouped.entrySet()) {
            md.append("### `").append(escapeInlineCode(entry.getKey())).append("` (")
                    .append(entry.getValue().size()).append(" 项)\n\n");
            for (Issue issue : entry.getValue()) {
                md.append("**[").append(name(issue.getSeverity())).append("]** 记录 ")
                        .append(issue.getRecordIndex());
                if (notBlank(issue.getRecordId())) {
                    md.append(" (`").append(escapeInlineCode(issue.getRecordId())).append("`)");
                }
                md.append("\n");
                md.append(String.format(Locale.ROOT, "- **置信度:** %.2f%n", issue.getConfidence()));
                md.append("- **说明:** ").append(orEmpty(issue.getExplanation())).append("\n");
                if (notBlank(issue.getMatchedText())) {
                    md.append("- **匹配内容:** `")
                            .append(escapeInlineCode(issue.getMatchedText().replace("\n", " ")))
                            .append("`\n");
                }
                md.append("- **状态:** ").append(name(issue.getStatus())).append("\n\n");
            }
        }
        return md.toString();
    }

    private static CellStyle headerStyle(Workbook workbook) {
        Font font = workbook.createFont();
        font.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        return style;
    }

    private static void header(Sheet sheet, String[] columns, CellStyle style) {
        Row row = sheet.createRow(0);
        for (int i = 0; i < columns.length; i++) {
            Cell cell = row.createCell(i);
            cell.setCellValue(columns[i]);
            cell.setCellStyle(style);
        }
    }

    private String fileName(RunResult run, String extension) {
        return "survey-audit-" + orEmpty(run.getDatasetId()) + "-" + formatFileTs(run.getStartedAt()) + "." + extension;
    }

    private static String escapeInlineCode(String text) {
        return orEmpty(text).replace("`", "\\`");
    }

    private static String orEmpty(String text) {
        return text == null ? "" : text;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static String name(Enum<?> value) {
        return value == null ? "UNKNOWN" : value.name();
    }

    private static boolean notBlank(String text) {
        return text != null && !text.isBlank();
    }

    private static String formatFileTs(Instant time) {
        return FILE_TS.format(time != null ? time : Instant.EPOCH);
    }

    public record ExportPayload(String filename, String contentType, byte[] content) {
    }
}
