package com.herzen.recall.session;

import com.herzen.recall.repository.SessionJdbcRepository;
import com.herzen.recall.scoring.RecallScoringEngine;
import com.herzen.recall.scoring.ScoringModels.Keypoint;
import com.herzen.recall.scoring.ScoringModels.SessionResult;
import com.herzen.recall.scoring.ScoringModels.TestInstance;
import com.herzen.recall.session.SessionModels.RecallSubmission;
import com.herzen.recall.session.SessionModels.RefinedTranscript;
import com.herzen.recall.session.SessionModels.ScoredSession;
import com.herzen.recall.session.SessionModels.SessionTrend;
import com.herzen.recall.session.SessionModels.TrendPoint;
import com.herzen.recall.testdef.TestDefinitionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
public class SessionService {
    private static final Logger log = LoggerFactory.getLogger(SessionService.class);
    private static final String CSV_HEADER = "created_at,coverage_pct,z_coverage,wpm_effective,test_id";

    private final TestDefinitionService testDefinitions;
    private final RecallScoringEngine engine;
    private final SessionJdbcRepository repository;
    private final ObjectProvider<NarrativeFeedbackClient> feedbackClient;
    private final ObjectProvider<TranscriptRefiner> transcriptRefiner;
    // guards the read of the latest session together with the append that follows it
    private final Object historyLock = new Object();

    public SessionService(TestDefinitionService testDefinitions,
                          RecallScoringEngine engine,
                          SessionJdbcRepository repository,
                          ObjectProvider<NarrativeFeedbackClient> feedbackClient,
                          ObjectProvider<TranscriptRefiner> transcriptRefiner) {
        this.testDefinitions = testDefinitions;
        this.engine = engine;
        this.repository = repository;
        this.feedbackClient = feedbackClient;
        this.transcriptRefiner = transcriptRefiner;
    }

    /**
     * Scores a recall against the stored test, using the most recent saved session as the
     * baseline for reliable change, and appends the result to the history. Submissions are
     * serialized so that each one is compared with the session saved just before it.
     */
    public ScoredSession submitRecall(RecallSubmission submission) {
        TestInstance test = testDefinitions.find(submission.testId());

        SessionResult result;
        synchronized (historyLock) {
            SessionResult previous = repository.latest().orElse(null);
            result = engine.scoreSession(test, submission.recallText(), submission.elapsedTimeSec(), previous);
            repository.save(result);
        }
        log.info("Saved session {} for test {}: coverage={} label={}",
                result.sessionId(), test.id(), result.coveragePct(), result.qualitativeLabel());

        String feedback = narrativeFeedback(test, submission.recallText()).orElse(null);
        if (feedback != null) {
            repository.saveFeedback(result.sessionId(), feedback);
        }
        return new ScoredSession(result, feedback);
    }

    /** Cleans up a raw transcript, falling back to the raw text when no refiner is available or it fails. */
    public RefinedTranscript refineTranscript(String rawText) {
        String raw = rawText == null ? "" : rawText;
        TranscriptRefiner refiner = transcriptRefiner.getIfAvailable();
        if (refiner == null || raw.isBlank()) {
            return new RefinedTranscript(raw, false);
        }
        try {
            String refined = refiner.refine(raw);
            if (refined == null || refined.isBlank()) {
                log.warn("Transcript refiner returned no text, keeping the raw transcript");
                return new RefinedTranscript(raw, false);
            }
            return new RefinedTranscript(refined, true);
        } catch (RuntimeException e) {
            log.warn("Transcript refinement failed, keeping the raw transcript: {}", e.getMessage());
            return new RefinedTranscript(raw, false);
        }
    }

    public List<SessionResult> history() {
        return repository.listAll();
    }

    public Optional<SessionResult> latest() {
        return repository.latest();
    }

    public Optional<String> feedback(String sessionId) {
        return repository.loadFeedback(sessionId);
    }

    /** History oldest-first, for plotting progress. */
    public SessionTrend trend() {
        List<TrendPoint> points = new ArrayList<>(repository.listAll().stream()
                .map(s -> new TrendPoint(s.createdAt(), s.coveragePct(), s.zCoverage(), s.rciCoverage()))
                .toList());
        Collections.reverse(points);
        return new SessionTrend(points);
    }

    public String exportCsv() {
        StringBuilder csv = new StringBuilder(CSV_HEADER).append('\n');
        for (SessionResult s : repository.listAll()) {
            csv.append(s.createdAt()).append(',')
                    .append(format(s.coveragePct())).append(',')
                    .append(format(s.zCoverage())).append(',')
                    .append(s.wpmEffective()).append(',')
                    .append(s.testId()).append('\n');
        }
        return csv.toString();
    }

    public void clearHistory() {
        synchronized (historyLock) {
            repository.clear();
        }
        log.info("Session history cleared");
    }

    private Optional<String> narrativeFeedback(TestInstance test, String recallText) {
        NarrativeFeedbackClient client = feedbackClient.getIfAvailable();
        if (client == null) {
            return Optional.empty();
        }
        try {
            return client.analyze(test.passage(), recallText, test.keypoints().stream().map(Keypoint::text).toList());
        } catch (RuntimeException e) {
            log.warn("Narrative feedback failed for test {}, returning scores only: {}", test.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
