package com.herzen.recall.scoring;

import com.herzen.recall.scoring.ScoringModels.KeypointResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

@Component
public class CoverageAggregator {
    /** Elapsed times below this floor are treated as the floor when computing reading speed. */
    public static final double MIN_READ_TIME_SEC = 5.0;

    private static final Logger log = LoggerFactory.getLogger(CoverageAggregator.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public double coveragePct(List<KeypointResult> results) {
        if (results == null || results.isEmpty()) {
            log.warn("Coverage requested for a test without keypoints, reporting 0");
            return 0.0;
        }
        long hits = results.stream().filter(KeypointResult::hit).count();
        return 100.0 * hits / results.size();
    }

    /** Raw whitespace-delimited word count, no normalization. */
    public int wordCount(String passage) {
        if (passage == null || passage.isBlank()) {
            return 0;
        }
        return (int) WHITESPACE.splitAsStream(passage.strip()).filter(w -> !w.isEmpty()).count();
    }

    public int effectiveWpm(String passage, double elapsedTimeSec) {
        double safeTime = Double.isFinite(elapsedTimeSec) ? Math.max(elapsedTimeSec, MIN_READ_TIME_SEC) : MIN_READ_TIME_SEC;
        return (int) Math.round(wordCount(passage) / safeTime * 60.0);
    }
}
