package com.herzen.recall.scoring;

import com.herzen.recall.norms.NormativeModels.NormativeScore;
import com.herzen.recall.norms.NormativeModels.ProfileResolution;
import com.herzen.recall.norms.NormativeProfileRegistry;
import com.herzen.recall.norms.NormativeScorer;
import com.herzen.recall.norms.ReliableChangeCalculator;
import com.herzen.recall.scoring.ScoringModels.KeypointMatch;
import com.herzen.recall.scoring.ScoringModels.KeypointResult;
import com.herzen.recall.scoring.ScoringModels.Language;
import com.herzen.recall.scoring.ScoringModels.SessionResult;
import com.herzen.recall.scoring.ScoringModels.TestInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Scores one recall attempt. Holds no state between calls; every input arrives as an argument and
 * the result is a new immutable record, so concurrent callers need no coordination.
 */
@Service
public class RecallScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(RecallScoringEngine.class);

    private final RecallTokenizer tokenizer;
    private final KeypointMatchEvaluator matchEvaluator;
    private final CoverageAggregator coverageAggregator;
    private final NormativeProfileRegistry profileRegistry;
    private final NormativeScorer normativeScorer;
    private final ReliableChangeCalculator reliableChangeCalculator;
    private final SessionResultAssembler assembler;

    public RecallScoringEngine(RecallTokenizer tokenizer,
                               KeypointMatchEvaluator matchEvaluator,
                               CoverageAggregator coverageAggregator,
                               NormativeProfileRegistry profileRegistry,
                               NormativeScorer normativeScorer,
                               ReliableChangeCalculator reliableChangeCalculator,
                               SessionResultAssembler assembler) {
        this.tokenizer = tokenizer;
        this.matchEvaluator = matchEvaluator;
        this.coverageAggregator = coverageAggregator;
        this.profileRegistry = profileRegistry;
        this.normativeScorer = normativeScorer;
        this.reliableChangeCalculator = reliableChangeCalculator;
        this.assembler = assembler;
    }

    public SessionResult scoreSession(TestInstance test, String recallText, double elapsedTimeSec) {
        return scoreSession(test, recallText, elapsedTimeSec, null);
    }

    public SessionResult scoreSession(TestInstance test,
                                      String recallText,
                                      double elapsedTimeSec,
                                      @Nullable SessionResult previousSession) {
        List<String> recallTokens = tokenizer.tokenize(recallText, test.language());

        List<KeypointResult> keypointResults = test.keypoints().stream()
                .map(kp -> {
                    KeypointMatch match = matchEvaluator.evaluate(recallTokens, kp.tokens());
                    log.debug("Keypoint {} hit={} ratio={} matched={}", kp.id(), match.hit(), match.coverageRatio(), match.matchedTokens());
                    return new KeypointResult(kp.id(), kp.text(), match.hit(), match.matchedTokens());
                })
                .toList();

        double coveragePct = coverageAggregator.coveragePct(keypointResults);
        int wpmEffective = coverageAggregator.effectiveWpm(test.passage(), elapsedTimeSec);

        ProfileResolution resolution = profileRegistry.resolve(test.normativeProfileId());
        NormativeScore normativeScore = normativeScorer.score(resolution, coveragePct, wpmEffective);
        OptionalDouble rci = reliableChangeCalculator.rciCoverage(resolution, coveragePct, previousSession);

        SessionResult result = assembler.assemble(test, recallText, keypointResults, coveragePct, wpmEffective, normativeScore, rci);
        log.debug("Scored test {}: coverage={} wpm={} label={}", test.id(), coveragePct, wpmEffective, result.qualitativeLabel());
        return result;
    }

    /** Canonical tokens for a keypoint, computed once when a test is built. */
    public List<String> tokenizeKeypoint(String text, Language language) {
        return tokenizer.tokenize(text, language);
    }
}
