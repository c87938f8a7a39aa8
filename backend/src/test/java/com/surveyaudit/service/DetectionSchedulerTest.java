package com.surveyaudit.service;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.config.EngineProperties;
import com.surveyaudit.model.*;
import com.surveyaudit.rule.checker.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DetectionSchedulerTest {

    private EngineFixture engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void shouldIsolateFailingCheckAndKeepOtherResults() {
        engine = new EngineFixture(new FailingChecker());
        registerCustom("QC_TEST_FAIL", "TEST_FAILING", Map.of());
        Dataset dataset = TestDatasets.emailDuplicates();

        RunResult result = engine.scheduler.run("run-fail", dataset,
                List.of(CheckSelection.active("QC_DUP_01"), CheckSelection.active("QC_TEST_FAIL")),
                engine.modelRegistry.pinCurrent(), CancellationToken.create(), null);

        assertEquals(CheckStatus.FAILED, status(result, "QC_TEST_FAIL"));
        assertTrue(execution(result, "QC_TEST_FAIL").getReason().contains("IllegalStateException"));
        assertEquals(CheckStatus.COMPLETED, status(result, "QC_DUP_01"));
        assertEquals(2, result.getIssues().size());
    }

    @Test
    void shouldMarkUnknownCheckAndForeignVersionAsMisconfigured() {
        engine = new EngineFixture();
        Dataset dataset = TestDatasets.emailDuplicates();

        RunResult result = engine.scheduler.run("run-misconfigured", dataset,
                List.of(CheckSelection.active("QC_DOES_NOT_EXIST"),
                        new CheckSelection("QC_DUP_01", "QC_DUP_02@v1"),
                        CheckSelection.active("QC_PAT_01")),
                engine.modelRegistry.pinCurrent(), CancellationToken.create(), null);

        assertEquals(CheckStatus.MISCONFIGURED, status(result, "QC_DOES_NOT_EXIST"));
        assertEquals(CheckStatus.MISCONFIGURED, status(result, "QC_DUP_01"));
        assertEquals(CheckStatus.COMPLETED, status(result, "QC_PAT_01"));
    }

    @Test
    void shouldMarkModelCheckMisconfiguredWhenPinIsMissingOrForeign() {
        engine = new EngineFixture();
        Dataset dataset = TestDatasets.mixed("pins", 40);
        Map<ModelFamily, String> pins = new EnumMap<>(ModelFamily.class);
        pins.put(ModelFamily.ANOMALY, "bot@v1");

        RunResult result = engine.scheduler.run("run-pins", dataset,
                List.of(CheckSelection.active("QC_BEH_03"), CheckSelection.active("QC_BEH_04")),
                pins, CancellationToken.create(), null);

        assertEquals(CheckStatus.MISCONFIGURED, status(result, "QC_BEH_03"));
        assertEquals(CheckStatus.MISCONFIGURED, status(result, "QC_BEH_04"));
        assertTrue(result.getIssues().isEmpty());
    }

    @Test
    void shouldReportTimeoutAndDiscardPartialFindings() {
        engine = new EngineFixture(new SleepingChecker());
        registerCustom("QC_TEST_SLOW", "TEST_SLEEPING", Map.of("timeoutMillis", 100));
        Dataset dataset = TestDatasets.emailDuplicates();

        RunResult result = engine.scheduler.run("run-timeout", dataset,
                List.of(CheckSelection.active("QC_TEST_SLOW"), CheckSelection.active("QC_DUP_01")),
                engine.modelRegistry.pinCurrent(), CancellationToken.create(), null);

        assertEquals(CheckStatus.TIMEOUT, status(result, "QC_TEST_SLOW"));
        assertEquals(0, execution(result, "QC_TEST_SLOW").getIssueCount());
        assertTrue(result.getIssues().stream().noneMatch(i -> i.getCheckId().equals("QC_TEST_SLOW")));
        assertEquals(CheckStatus.COMPLETED, status(result, "QC_DUP_01"));
    }

    @Test
    void shouldKeepFastCheckWithinBudgetWhileSlowerCheckIsCollected() {
        engine = new EngineFixture(new NappingChecker());
        registerCustom("QC_TEST_A_SLOW", "TEST_NAPPING", Map.of("sleepMillis", 800, "timeoutMillis", 5000));
        registerCustom("QC_TEST_B_FAST", "TEST_NAPPING", Map.of("sleepMillis", 0, "timeoutMillis", 200));

        RunResult result = engine.scheduler.run("run-budget", TestDatasets.emailDuplicates(),
                List.of(CheckSelection.active("QC_TEST_A_SLOW"), CheckSelection.active("QC_TEST_B_FAST")),
                engine.modelRegistry.pinCurrent(), CancellationToken.create(), null);

        assertEquals(CheckStatus.COMPLETED, status(result, "QC_TEST_A_SLOW"));
        assertEquals(CheckStatus.COMPLETED, status(result, "QC_TEST_B_FAST"));
        assertEquals(1, execution(result, "QC_TEST_B_FAST").getIssueCount());
        assertTrue(result.getIssues().stream().anyMatch(i -> i.getCheckId().equals("QC_TEST_B_FAST")));
    }

    @Test
    void shouldCancelRunningCheckWithoutPartialIssues() throws Exception {
        BlockingChecker blocking = new BlockingChecker();
        engine = new EngineFixture(blocking);
        registerCustom("QC_TEST_BLOCK", "TEST_BLOCKING", Map.of());
        CancellationToken token = CancellationToken.create();

        Thread canceller = new Thread(() -> {
            try {
                if (blocking.started.await(10, TimeUnit.SECONDS)) {
                    token.cancel();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();

        RunResult result = engine.scheduler.run("run-cancel-midway", TestDatasets.emailDuplicates(),
                List.of(CheckSelection.active("QC_TEST_BLOCK")),
                engine.modelRegistry.pinCurrent(), token, null);
        canceller.join(10_000);

        assertTrue(result.isCancelled());
        assertEquals(CheckStatus.CANCELLED, status(result, "QC_TEST_BLOCK"));
        assertEquals(0, execution(result, "QC_TEST_BLOCK").getIssueCount());
        assertTrue(result.getIssues().isEmpty());
        assertTrue(blocking.emitted.get() > 0);
    }

    @Test
    void shouldReportCancelledChecksWhenRunIsCancelledUpFront() {
        engine = new EngineFixture();
        CancellationToken token = CancellationToken.create();
        token.cancel();

        RunResult result = engine.scheduler.run("run-cancelled", TestDatasets.emailDuplicates(),
                List.of(CheckSelection.active("QC_DUP_01")),
                engine.modelRegistry.pinCurrent(), token, null);

        assertTrue(result.isCancelled());
        assertEquals(CheckStatus.CANCELLED, status(result, "QC_DUP_01"));
        assertTrue(result.getIssues().isEmpty());
    }

    @Test
    void shouldSkipDisabledVersion() {
        engine = new EngineFixture();
        RuleVersion disabled = engine.ruleVersionService.propose("QC_DUP_01", Map.of(), null, false, "alice", "停用");
        engine.ruleVersionService.activate("QC_DUP_01", disabled.id(), "alice");

        RunResult result = engine.scheduler.run("run-disabled", TestDatasets.emailDuplicates(),
                List.of(CheckSelection.active("QC_DUP_01")),
                engine.modelRegistry.pinCurrent(), CancellationToken.create(), null);

        assertEquals(CheckStatus.DISABLED, status(result, "QC_DUP_01"));
        assertTrue(result.getIssues().isEmpty());
    }

    @Test
    void shouldProduceSameIssuesWithAndWithoutPartitioning() {
        Dataset dataset = TestDatasets.mixed("partition", 300);
        List<CheckSelection> selections = List.of(
                CheckSelection.active("QC_PAT_01"),
                CheckSelection.active("QC_PAT_03"),
                CheckSelection.active("QC_BEH_03"),
                CheckSelection.active("QC_CON_07"),
                CheckSelection.active("QC_CON_08"),
                CheckSelection.active("QC_DUP_01"));

        List<Issue> whole;
        engine = new EngineFixture();
        try {
            whole = normalized(engine.scheduler.run("whole", dataset, selections,
                    engine.modelRegistry.pinCurrent(), CancellationToken.create(), null));
        } finally {
            engine.close();
        }

        EngineProperties partitioned = new EngineProperties();
        partitioned.getScheduler().setPartitionThreshold(50);
        partitioned.getScheduler().setPartitionSize(37);
        engine = new EngineFixture(partitioned);
        RunResult result = engine.scheduler.run("parts", dataset, selections,
                engine.modelRegistry.pinCurrent(), CancellationToken.create(), null);

        assertTrue(execution(result, "QC_PAT_01").getPartitions() > 1);
        assertEquals(1, execution(result, "QC_DUP_01").getPartitions());
        assertFalse(whole.isEmpty());
        assertEquals(whole, normalized(result));
    }

    @Test
    void shouldGenerateDeterministicIssueIds() {
        String a = DetectionScheduler.issueId("ds", "QC_DUP_01", "QC_DUP_01@v1", null, 47, "duplicate");
        String b = DetectionScheduler.issueId("ds", "QC_DUP_01", "QC_DUP_01@v1", null, 47, "duplicate");
        String otherVersion = DetectionScheduler.issueId("ds", "QC_DUP_01", "QC_DUP_01@v2", null, 47, "duplicate");
        String otherModel = DetectionScheduler.issueId("ds", "QC_DUP_01", "QC_DUP_01@v1", "bot@v2", 47, "duplicate");

        assertEquals(a, b);
        assertNotEquals(a, otherVersion);
        assertNotEquals(a, otherModel);
    }

    private static List<Issue> normalized(RunResult result) {
        return result.getIssues().stream()
                .map(i -> i.toBuilder().detectedAt(null).build())
                .toList();
    }

    private void registerCustom(String checkId, String checkerName, Map<String, Object> params) {
        engine.ruleRegistry.register(QualityCheck.builder()
                .id(checkId)
                .checkerName(checkerName)
                .severity(Severity.LOW)
                .defaultParameters(params)
                .build());
    }

    private static CheckExecution execution(RunResult result, String checkId) {
        return result.getCheckStatuses().stream()
                .filter(e -> e.getCheckId().equals(checkId))
                .findFirst()
                .orElseThrow();
    }

    private static CheckStatus status(RunResult result, String checkId) {
        return execution(result, checkId).getStatus();
    }

    static class FailingChecker implements QualityChecker {

        @Override
        public String name() {
            return "TEST_FAILING";
        }

        @Override
        public CheckCategory category() {
            return CheckCategory.CONTENT_QUALITY;
        }

        @Override
        public CheckOutcome check(CheckContext context) {
            throw new IllegalStateException("boom");
        }
    }

    static class SleepingChecker implements QualityChecker {

        final AtomicInteger calls = new AtomicInteger();

        @Override
        public String name() {
            return "TEST_SLEEPING";
        }

        @Override
        public CheckCategory category() {
            return CheckCategory.BEHAVIORAL;
        }

        @Override
        public CheckOutcome check(CheckContext context) {
            calls.incrementAndGet();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return CheckOutcome.of(List.of(Finding.of(0, "slow", 1.0, "never", null)));
        }
    }

    static class NappingChecker implements QualityChecker {

        @Override
        public String name() {
            return "TEST_NAPPING";
        }

        @Override
        public CheckCategory category() {
            return CheckCategory.BEHAVIORAL;
        }

        @Override
        public CheckOutcome check(CheckContext context) {
            long sleep = context.parameters().getLong("sleepMillis", 0);
            if (sleep > 0) {
                try {
                    Thread.sleep(sleep);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", e);
                }
            }
            return CheckOutcome.of(List.of(Finding.of(0, "nap", 1.0, "napped " + sleep + " ms", null)));
        }
    }

    /**
     * 逐条产生发现并轮询取消令牌，直到运行被取消
     */
    static class BlockingChecker implements QualityChecker {

        final CountDownLatch started = new CountDownLatch(1);
        final AtomicInteger emitted = new AtomicInteger();

        @Override
        public String name() {
            return "TEST_BLOCKING";
        }

        @Override
        public CheckCategory category() {
            return CheckCategory.BEHAVIORAL;
        }

        @Override
        public CheckOutcome check(CheckContext context) {
            List<Finding> findings = new ArrayList<>();
            long deadline = System.currentTimeMillis() + 10_000;
            while (System.currentTimeMillis() < deadline) {
                findings.add(Finding.of(0, "block-" + findings.size(), 1.0, "partial", null));
                emitted.incrementAndGet();
                started.countDown();
                context.checkCancelled();
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    context.checkCancelled();
                }
            }
            return CheckOutcome.of(findings);
        }
    }
}
