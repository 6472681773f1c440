package com.herzen.recall.scoring;

import com.herzen.recall.scoring.ScoringModels.KeypointMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a keypoint was recalled.
 *
 * <p>A keypoint hits when at least {@value #MIN_COVERAGE_RATIO} of its tokens (counted with
 * repeats on the keypoint side) appear anywhere in the recall, or when at least
 * {@value #MIN_DISTINCT_MATCHES} distinct keypoint tokens appear. Both cut points are policy
 * constants without a calibration study behind them.</p>
 */
@Component
public class KeypointMatchEvaluator {
    public static final double MIN_COVERAGE_RATIO = 0.35;
    public static final int MIN_DISTINCT_MATCHES = 2;

    private static final Logger log = LoggerFactory.getLogger(KeypointMatchEvaluator.class);

    public KeypointMatch evaluate(List<String> recallTokens, List<String> keypointTokens) {
        if (keypointTokens == null || keypointTokens.isEmpty()) {
            log.debug("Keypoint has no significant tokens, it can never be recalled");
            return new KeypointMatch(false, List.of(), 0.0);
        }

        Set<String> recall = recallTokens == null ? Set.of() : new HashSet<>(recallTokens);
        List<String> found = keypointTokens.stream().filter(recall::contains).toList();
        Set<String> distinct = new LinkedHashSet<>(found);

        double ratio = (double) found.size() / keypointTokens.size();
        boolean hit = ratio >= MIN_COVERAGE_RATIO || distinct.size() >= MIN_DISTINCT_MATCHES;
        return new KeypointMatch(hit, List.copyOf(distinct), ratio);
    }
}
