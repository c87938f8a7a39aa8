package com.surveyaudit.service;

import com.surveyaudit.model.CheckCategory;
import com.surveyaudit.model.Issue;
import com.surveyaudit.model.IssueStatus;
import com.surveyaudit.model.Severity;

/**
 * 问题查询条件，为 null 的条件不参与过滤
 */
public record IssueFilter(String datasetId, IssueStatus status, Severity severity, CheckCategory category,
                          String checkId) {

    public static IssueFilter forDataset(String datasetId) {
        return new IssueFilter(datasetId, null, null, null, null);
    }

    public boolean matches(Issue issue) {
        return (datasetId == null || datasetId.equals(issue.getDatasetId()))
                && (status == null || status == issue.getStatus())
                && (severity == null || severity == issue.getSeverity())
                && (category == null || category == issue.getCategory())
                && (checkId == null || checkId.equals(issue.getCheckId()));
    }
}
