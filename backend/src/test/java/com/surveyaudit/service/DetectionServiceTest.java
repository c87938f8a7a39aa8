package com.surveyaudit.service;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.exception.UnknownDatasetException;
import com.surveyaudit.exception.UnknownRunException;
import com.surveyaudit.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DetectionServiceTest {

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void shouldScoreOnlyLatestRunAfterRuleVersionChange() {
        engine.datasets.save(TestDatasets.emailDuplicates());
        RunRequest request = RunRequest.builder()
                .datasetId("email-dups")
                .checkIds(List.of("QC_DUP_01"))
                .build();

        engine.detectionService.runDetection(request);
        double before = recordScore("email-dups", 47);

        RuleVersion v2 = engine.ruleVersionService.propose("QC_DUP_01", Map.of("caseInsensitive", false),
                null, null, "alice", "区分大小写");
        engine.ruleVersionService.activate("QC_DUP_01", v2.id(), "alice");
        RunResult rerun = engine.detectionService.runDetection(request);

        assertEquals(2, rerun.getIssues().size());
        assertEquals(4, engine.issueService.forDataset("email-dups").size());
        assertEquals(2, engine.issueService.current("email-dups").size());
        assertTrue(engine.issueService.current("email-dups").stream()
                .allMatch(i -> i.getRuleVersionId().equals(v2.id())));
        assertEquals(before, recordScore("email-dups", 47));
        assertTrue(before < 100.0);
    }

    private double recordScore(String datasetId, int recordIndex) {
        return engine.issueService.scorecard(datasetId).getRecords().stream()
                .filter(r -> r.getRecordIndex() == recordIndex)
                .findFirst()
                .orElseThrow()
                .getScore();
    }

    @Test
    void shouldFlagSharedIdentifierWithFirstSeenRecordAsCanonical() {
        engine.datasets.save(TestDatasets.emailDuplicates());

        RunResult result = engine.detectionService.runDetection(RunRequest.builder()
                .datasetId("email-dups")
                .checkIds(List.of("QC_DUP_01"))
                .build());

        List<Issue> issues = result.getIssues();
        assertEquals(2, issues.size());
        assertEquals(List.of(47, 81), issues.stream().map(Issue::getRecordIndex).toList());
        for (Issue issue : issues) {
            assertEquals(Severity.HIGH, issue.getSeverity());
            assertEquals(3, issue.getDetails().get("canonicalRecordIndex"));
            assertEquals(3, issue.getDetails().get("clusterSize"));
            assertEquals(List.of(3, 47, 81), issue.getDetails().get("clusterMembers"));
        }
    }

    @Test
    void shouldReturnInsufficientDataForAnomalyOnTinyDataset() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            rows.add(TestDatasets.row("a", i, "b", i * 2, "c", 10 - i));
        }
        engine.datasets.save(TestDatasets.dataset("tiny", List.of(
                TestDatasets.numeric("a"), TestDatasets.numeric("b"), TestDatasets.numeric("c")), rows));

        RunResult result = engine.detectionService.runDetection(RunRequest.builder()
                .datasetId("tiny")
                .checkIds(List.of("QC_BEH_04"))
                .build());

        CheckExecution execution = result.getCheckStatuses().get(0);
        assertEquals(CheckStatus.INSUFFICIENT_DATA, execution.getStatus());
        assertEquals("anomaly@v1", execution.getModelVersionId());
        assertTrue(result.getIssues().isEmpty());
    }

    @Test
    void shouldProduceIdenticalIssuesForRepeatedRuns() {
        engine.datasets.save(TestDatasets.mixed("repeat", 120));
        RunRequest request = RunRequest.builder().datasetId("repeat").referenceTime(TestDatasets.COLLECTED_AT).build();

        RunResult first = engine.detectionService.runDetection(request);
        RunResult second = engine.detectionService.runDetection(request);

        assertEquals(first.getIssues(), second.getIssues());
        assertEquals(engine.ruleRegistry.all().size(), first.getCheckStatuses().size());
    }

    @Test
    void shouldKeepReviewStatusWhenIssuesAreStoredAgain() {
        engine.datasets.save(TestDatasets.emailDuplicates());
        RunRequest request = RunRequest.builder().datasetId("email-dups").checkIds(List.of("QC_DUP_01")).build();
        RunResult first = engine.detectionService.runDetection(request);
        String issueId = first.getIssues().get(0).getId();
        engine.issueService.setIssueStatus(issueId, IssueStatus.REJECTED, "bob");

        engine.detectionService.runDetection(request);

        Issue stored = engine.issueService.get(issueId);
        assertEquals(IssueStatus.REJECTED, stored.getStatus());
        assertEquals("bob", stored.getReviewedBy());
        assertEquals(2, engine.issueService.forDataset("email-dups").size());
    }

    @Test
    void shouldPublishLifecycleEvents() {
        engine.datasets.save(TestDatasets.emailDuplicates());

        RunResult result = engine.detectionService.runDetection(RunRequest.builder()
                .runId("run-events")
                .datasetId("email-dups")
                .checkIds(List.of("QC_DUP_01"))
                .build());

        List<LifecycleEvent> events = engine.eventsOf(LifecycleEvent.class);
        assertEquals(LifecycleEvent.Type.DETECTION_STARTED, events.get(0).type());
        assertEquals(LifecycleEvent.Type.DETECTION_COMPLETED, events.get(events.size() - 1).type());
        assertEquals("run-events", events.get(0).runId());
        assertSame(result, engine.detectionService.getRun("run-events"));
    }

    @Test
    void shouldPinCurrentModelVersionsWhenRequestOmitsThem() {
        engine.datasets.save(TestDatasets.emailDuplicates());

        RunResult result = engine.detectionService.runDetection(RunRequest.builder()
                .datasetId("email-dups")
                .checkIds(List.of("QC_DUP_01"))
                .build());

        assertEquals("bot@v1", result.getModelPins().get(ModelFamily.BOT));
        assertEquals("text@v1", result.getModelPins().get(ModelFamily.TEXT));
    }

    @Test
    void shouldRejectUnknownDatasetAndRun() {
        assertThrows(UnknownDatasetException.class, () -> engine.detectionService.runDetection(
                RunRequest.builder().datasetId("missing").build()));
        assertThrows(UnknownRunException.class, () -> engine.detectionService.getRun("missing"));
        assertFalse(engine.detectionService.cancel("missing"));
    }
}
