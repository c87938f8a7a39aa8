package com.surveyaudit;

import com.surveyaudit.ml.ModelRegistry;
import com.surveyaudit.model.ModelFamily;
import com.surveyaudit.service.RuleRegistry;
import com.surveyaudit.service.RuleVersionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SurveyAuditApplicationTest {

    @Autowired
    private RuleRegistry ruleRegistry;

    @Autowired
    private RuleVersionService ruleVersionService;

    @Autowired
    private ModelRegistry modelRegistry;

    @Test
    void shouldWireAllBuiltInChecks() {
        assertTrue(ruleRegistry.all().size() >= 31);
        assertEquals(31, ruleRegistry.checkerNames().size());
        assertNotNull(ruleVersionService.active("QC_PAT_01"));
    }

    @Test
    void shouldBootstrapGenesisModels() {
        for (ModelFamily family : ModelFamily.values()) {
            assertTrue(modelRegistry.current(family).isPresent(), "缺少模型族 " + family);
        }
    }
}
