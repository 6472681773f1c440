package com.herzen.recall.scoring;

import com.herzen.recall.scoring.ScoringModels.KeypointMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeypointMatchEvaluatorTest {
    private final KeypointMatchEvaluator evaluator = new KeypointMatchEvaluator();

    @Test
    void oneOfThreeTokensIsNotEnough() {
        KeypointMatch match = evaluator.evaluate(List.of("neuronios", "outro"), List.of("neuronios", "formam", "conexoes"));
        assertFalse(match.hit());
        assertEquals(1.0 / 3.0, match.coverageRatio(), 1e-9);
        assertEquals(List.of("neuronios"), match.matchedTokens());
    }

    @Test
    void twoOfThreeTokensHit() {
        KeypointMatch match = evaluator.evaluate(List.of("conexoes", "neuronios"), List.of("neuronios", "formam", "conexoes"));
        assertTrue(match.hit());
        assertEquals(List.of("neuronios", "conexoes"), match.matchedTokens());
    }

    @Test
    void twoDistinctAnchorsHitEvenWithLowRatio() {
        List<String> keypoint = List.of("telomeros", "encurtam", "cada", "divisao", "celular",
                "limitando", "numero", "replicacoes", "possiveis", "celulas");
        KeypointMatch match = evaluator.evaluate(List.of("telomeros", "celular", "idade"), keypoint);
        assertEquals(0.2, match.coverageRatio(), 1e-9);
        assertTrue(match.hit());
    }

    @Test
    void repeatedKeypointTokensCountTowardsRatio() {
        List<String> keypoint = List.of("memoria", "memoria", "sono", "prazo", "longo");
        KeypointMatch match = evaluator.evaluate(List.of("memoria"), keypoint);
        assertEquals(0.4, match.coverageRatio(), 1e-9);
        assertEquals(List.of("memoria"), match.matchedTokens());
        assertTrue(match.hit());
    }

    @Test
    void repeatedRecallTokensCountOnce() {
        KeypointMatch match = evaluator.evaluate(List.of("sono", "sono", "sono"), List.of("sono", "consolida", "memoria", "longo", "prazo", "noite"));
        assertEquals(1.0 / 6.0, match.coverageRatio(), 1e-9);
        assertFalse(match.hit());
    }

    @Test
    void singleTokenKeypointHitsWhenFound() {
        assertTrue(evaluator.evaluate(List.of("entropia"), List.of("entropia")).hit());
    }

    @Test
    void keypointWithoutTokensNeverHits() {
        KeypointMatch match = evaluator.evaluate(List.of("qualquer", "coisa"), List.of());
        assertFalse(match.hit());
        assertEquals(0.0, match.coverageRatio());
        assertTrue(match.matchedTokens().isEmpty());
    }

    @Test
    void emptyRecallMatchesNothing() {
        KeypointMatch match = evaluator.evaluate(List.of(), List.of("fusao", "nuclear"));
        assertFalse(match.hit());
        assertTrue(match.matchedTokens().isEmpty());
    }
}
