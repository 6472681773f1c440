package com.herzen.recall.scoring;

import com.herzen.recall.norms.NormativeModels.NormativeProfile;
import com.herzen.recall.norms.NormativeProfileRegistry;
import com.herzen.recall.norms.NormativeScorer;
import com.herzen.recall.norms.QualitativeLabel;
import com.herzen.recall.norms.ReliableChangeCalculator;
import com.herzen.recall.scoring.ScoringModels.Complexity;
import com.herzen.recall.scoring.ScoringModels.Keypoint;
import com.herzen.recall.scoring.ScoringModels.KeypointResult;
import com.herzen.recall.scoring.ScoringModels.Language;
import com.herzen.recall.scoring.ScoringModels.SessionResult;
import com.herzen.recall.scoring.ScoringModels.TestInstance;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RecallScoringEngineTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final String RECALL = "O cérebro forma novas conexões ao aprender. Dormir ajuda a memória de longo prazo. "
            + "Estresse prejudica o hipocampo.";

    private final AtomicInteger ids = new AtomicInteger();
    private final RecallTokenizer tokenizer = new RecallTokenizer();
    private final RecallScoringEngine engine = new RecallScoringEngine(
            tokenizer,
            new KeypointMatchEvaluator(),
            new CoverageAggregator(),
            new NormativeProfileRegistry(List.of(
                    new NormativeProfile("adult_pt_br_general", "Adulto Geral (pt-BR)", Language.PT_BR, 180, 30, 65.0, 15.0, 0.80)),
                    "adult_pt_br_general"),
            new NormativeScorer(),
            new ReliableChangeCalculator(),
            new SessionResultAssembler(() -> "session-" + ids.incrementAndGet(), Clock.fixed(NOW, ZoneOffset.UTC)));

    @Test
    void scoresKeypointsAndStandardizesAgainstProfile() {
        TestInstance test = test("adult_pt_br_general");

        SessionResult result = engine.scoreSession(test, RECALL, 30);

        assertEquals("session-1", result.sessionId());
        assertEquals(NOW, result.createdAt());
        assertEquals(test.id(), result.testId());
        assertEquals(RECALL, result.recallText());

        List<KeypointResult> kps = result.keypointResults();
        assertEquals(6, kps.size());
        assertEquals(List.of(0, 1, 2, 3, 4, 5), kps.stream().map(KeypointResult::keypointId).toList());
        assertEquals(List.of(true, true, false, true, false, false), kps.stream().map(KeypointResult::hit).toList());
        assertEquals(List.of("novas", "conexoes"), kps.get(0).matchedTokens());
        assertEquals(List.of("memoria", "longo", "prazo"), kps.get(1).matchedTokens());
        kps.forEach(kp -> assertTrue(test.keypoints().get(kp.keypointId()).tokens().containsAll(kp.matchedTokens())));

        assertEquals(50.0, result.coveragePct());
        assertEquals(180, result.wpmEffective());
        assertEquals(-1.0, result.zCoverage());
        assertEquals(OptionalDouble.of(0.0), result.zWpm());
        assertEquals(QualitativeLabel.WITHIN_EXPECTED_RANGE, result.qualitativeLabel());
        assertTrue(result.rciCoverage().isEmpty());
    }

    @Test
    void reportsReliableChangeAgainstPreviousSession() {
        TestInstance test = test("adult_pt_br_general");
        SessionResult previous = engine.scoreSession(test, "neurônios formam novas conexões; sono consolida memória; "
                + "prática repetida fortalece; estresse prejudica hipocampo; exercício aumenta fator", 30);
        assertEquals(500.0 / 6.0, previous.coveragePct(), 1e-9);

        SessionResult current = engine.scoreSession(test, RECALL, 30, previous);

        // (50 - 83.33) / (15 * sqrt(0.4)) = -3.5136...
        assertEquals(OptionalDouble.of(-3.51), current.rciCoverage());
        assertNotEquals(previous.sessionId(), current.sessionId());
    }

    @Test
    void unresolvedProfileLeavesStandardScoresOut() {
        TestInstance test = test("custom_ad_hoc");
        SessionResult previous = engine.scoreSession(test, RECALL, 30);

        SessionResult result = engine.scoreSession(test, RECALL, 30, previous);

        assertEquals(50.0, result.coveragePct());
        assertEquals(0.0, result.zCoverage());
        assertTrue(result.zWpm().isEmpty());
        assertTrue(result.rciCoverage().isEmpty());
        assertEquals(QualitativeLabel.NORMATIVE_DATA_UNAVAILABLE, result.qualitativeLabel());
        assertEquals("custom_ad_hoc", result.normativeProfileId());
    }

    @Test
    void emptyRecallScoresZeroWithoutSpecialCasing() {
        SessionResult result = engine.scoreSession(test("adult_pt_br_general"), "", 30);

        assertEquals(0.0, result.coveragePct());
        assertTrue(result.keypointResults().stream().noneMatch(KeypointResult::hit));
        assertEquals(-4.33, result.zCoverage());
        assertEquals(QualitativeLabel.BELOW_EXPECTED_RANGE, result.qualitativeLabel());
    }

    @Test
    void degenerateTestDoesNotDivideByZero() {
        TestInstance empty = new TestInstance("t-empty", Language.PT_BR, "vazio", Complexity.NEUTRAL, "",
                List.of(), 0, 60, "adult_pt_br_general", NOW);

        SessionResult result = engine.scoreSession(empty, RECALL, 0);

        assertEquals(0.0, result.coveragePct());
        assertEquals(0, result.wpmEffective());
        assertTrue(result.keypointResults().isEmpty());
        assertTrue(Double.isFinite(result.zCoverage()));
        assertTrue(Double.isFinite(result.zWpm().orElseThrow()));
    }

    @Test
    void exposesKeypointTokenization() {
        assertEquals(List.of("sono", "consolida", "memoria", "longo", "prazo"),
                engine.tokenizeKeypoint("O sono consolida a memória de longo prazo.", Language.PT_BR));
    }

    private TestInstance test(String profileId) {
        List<String> texts = List.of(
                "Os neurônios formam novas conexões durante o aprendizado.",
                "O sono consolida a memória de longo prazo.",
                "A prática repetida fortalece sinapses.",
                "O estresse crônico prejudica o hipocampo.",
                "Exercício físico aumenta o fator neurotrófico.",
                "A idade reduz a velocidade de processamento.");
        List<Keypoint> keypoints = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            keypoints.add(new Keypoint(i, texts.get(i), tokenizer.tokenize(texts.get(i), Language.PT_BR)));
        }
        String passage = String.join(" ", Collections.nCopies(90, "texto"));
        return new TestInstance("test-1", Language.PT_BR, "Neuroplasticidade", Complexity.NEUTRAL, passage,
                keypoints, 270, 90, profileId, NOW);
    }
}
