package com.surveyaudit.rule.checker;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.FieldRole;
import com.surveyaudit.model.FieldType;
import com.surveyaudit.model.SurveyRecord;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * 日期异常：晚于参考时间（未来日期）、早于 notBefore、超出 maxSpanDays 窗口，以及结束早于开始
 */
@Component
public class DateAnomalyChecker implements QualityChecker {

    @Override
    public String name() {
        return "DATE_ANOMALY";
    }

    @Override
    public CheckCategory category() {
        return CheckCategory.DOMAIN_SPECIFIC;
    }

    @Override
    public boolean partitionable() {
        return true;
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return Map.of("futureToleranceMinutes", 5);
    }

    @Override
    public CheckOutcome check(CheckContext ctx) {
        List<String> fields = ctx.fields("fields", () -> ctx.fieldsOfType(FieldType.DATETIME));
        Instant reference = ctx.referenceTime();
        Instant latest = reference.plus(Duration.ofMinutes(ctx.parameters().getLong("futureToleranceMinutes", 5)));
        Instant notBefore = parseDate(ctx.parameters().getString("notBefore", null));
        if (ctx.parameters().contains("maxSpanDays")) {
            Instant windowStart = reference.minus(Duration.ofDays(ctx.parameters().getLong("maxSpanDays", 0)));
            notBefore = notBefore == null || windowStart.isAfter(notBefore) ? windowStart : notBefore;
        }
        String startField = ctx.schema().firstWithRole(FieldRole.START_TIME).map(f -> f.getName()).orElse(null);
        String endField = ctx.schema().firstWithRole(FieldRole.END_TIME).map(f -> f.getName()).orElse(null);

        List<Finding> findings = new ArrayList<>();
        for (SurveyRecord r : ctx.records()) {
            ctx.checkCancelled();
            for (String f : fields) {
                Instant t = r.datetime(f);
                if (t == null) {
                    continue;
                }
                if (t.isAfter(latest)) {
                    findings.add(Finding.of(r.index(), f, 1.0,
                            "字段 " + f + " 的时间 " + t + " 晚于数据采集时间 " + reference, t.toString()));
                } else if (notBefore != null && t.isBefore(notBefore)) {
                    findings.add(Finding.of(r.index(), f, 0.9,
                            "字段 " + f + " 的时间 " + t + " 早于允许的最早时间 " + notBefore, t.toString()));
                }
            }
            if (startField != null && endField != null) {
                Instant start = r.datetime(startField);
                Instant end = r.datetime(endField);
                if (start != null && end != null && end.isBefore(start)) {
                    findings.add(Finding.of(r.index(), "start-end", 1.0,
                            "结束时间 " + end + " 早于开始时间 " + start, start + " > " + end));
                }
            }
        }
        return CheckOutcome.of(findings);
    }

    private Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim()).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value.trim());
            } catch (DateTimeParseException inner) {
                throw new MisconfiguredCheckException("notBefore 不是合法日期: " + value);
            }
        }
    }
}
