package com.herzen.recall.session;

import com.herzen.recall.scoring.ScoringModels.SessionResult;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

public class SessionModels {
    public record RecallSubmission(String testId, String recallText, double elapsedTimeSec) {}

    /** A scored session plus the narrative feedback, when the feedback service produced one. */
    public record ScoredSession(SessionResult result, String feedback) {}

    /** Transcript text to submit; {@code refined} is false when the raw text is returned as is. */
    public record RefinedTranscript(String text, boolean refined) {}

    public record TrendPoint(Instant createdAt, double coveragePct, double zCoverage, OptionalDouble rciCoverage) {}

    public record SessionTrend(List<TrendPoint> points) {}
}
