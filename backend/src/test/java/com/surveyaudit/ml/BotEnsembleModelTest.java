package com.surveyaudit.ml;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BotEnsembleModelTest {

    private final BotEnsembleModel model = DefaultModels.bot();

    @Test
    void shouldSeparateHumanAndBotLikeFeatures() {
        BotScore human = model.score(new double[BotFeatureExtractor.DIMENSION]);
        double[] botLike = new double[BotFeatureExtractor.DIMENSION];
        Arrays.fill(botLike, 1.0);
        BotScore bot = model.score(botLike);

        assertTrue(human.probability() < 0.1);
        assertTrue(bot.probability() > 0.9);
        assertEquals(3, bot.members().size());
        double contributions = bot.members().values().stream().mapToDouble(BotScore.MemberScore::contribution).sum();
        assertEquals(bot.rawScore(), contributions, 1e-9);
    }

    @Test
    void shouldNormalizeMemberWeights() {
        double total = model.weights().values().stream().mapToDouble(Double::doubleValue).sum();

        assertEquals(1.0, total, 1e-9);
        assertEquals(0.4, model.weights().get(BotEnsembleModel.LOGISTIC), 1e-9);
    }

    @Test
    void shouldReturnNewModelOnUpdate() {
        List<LabeledSample> samples = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            double[] x = new double[BotFeatureExtractor.DIMENSION];
            Arrays.fill(x, i % 2 == 0 ? 0.9 : 0.05);
            samples.add(new LabeledSample(i, x, i % 2 == 0));
        }

        BotEnsembleModel updated = model.withUpdate(samples, 0.1, 5);

        assertNotSame(model, updated);
        assertEquals(1.0, updated.weights().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
        assertEquals(-4.0, model.logistic().bias(), 0.0);
        assertNotEquals(model.logistic().bias(), updated.logistic().bias());
    }

    @Test
    void shouldRejectInvalidMembers() {
        LogisticModel wrongDimension = new LogisticModel(0.0, new double[2]);

        assertThrows(IllegalArgumentException.class, () -> new BotEnsembleModel(wrongDimension, model.forest(),
                model.timing(), model.weights(), 8.0, -4.0));
        assertThrows(IllegalArgumentException.class, () -> new BotEnsembleModel(model.logistic(), model.forest(),
                model.timing(), Map.of(BotEnsembleModel.LOGISTIC, 1.0), 8.0, -4.0));
    }
}
