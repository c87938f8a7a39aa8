package com.surveyaudit.ml;

import com.surveyaudit.config.EngineProperties;
import com.surveyaudit.model.ModelFamily;
import com.surveyaudit.model.ModelVersion;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldStampVersionsWithInjectedClock() {
        ModelRegistry registry = new ModelRegistry(new InMemoryModelArtifactStore(), new EngineProperties(), CLOCK);
        registry.bootstrapDefaults();

        ModelVersion genesis = registry.current(ModelFamily.BOT).orElseThrow();
        ModelVersion adapted = registry.publish(ModelFamily.BOT, DefaultModels.bot(), Map.of("f1", 0.8), genesis.id());

        assertEquals("bot@v1", genesis.id());
        assertEquals(CLOCK.instant(), genesis.createdAt());
        assertEquals("bot@v2", adapted.id());
        assertEquals(CLOCK.instant(), adapted.createdAt());
        assertEquals(genesis.id(), adapted.parentVersionId());
    }

    @Test
    void shouldRejectParentFromAnotherLineage() {
        ModelRegistry registry = new ModelRegistry(new InMemoryModelArtifactStore(), new EngineProperties(), CLOCK);
        registry.bootstrapDefaults();

        assertThrows(IllegalArgumentException.class,
                () -> registry.publish(ModelFamily.BOT, DefaultModels.bot(), Map.of(), "pattern@v1"));
        assertEquals(1, registry.history(ModelFamily.BOT).size());
    }
}
