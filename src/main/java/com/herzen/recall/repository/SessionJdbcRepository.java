package com.herzen.recall.repository;

import com.herzen.recall.norms.QualitativeLabel;
import com.herzen.recall.scoring.ScoringModels.KeypointResult;
import com.herzen.recall.scoring.ScoringModels.SessionResult;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Append-only session history. Insertion order defines recency, so the most recently saved
 * session is always first regardless of clock resolution.
 */
@Repository
public class SessionJdbcRepository {
    private static final String SESSION_COLUMNS =
            "session_id, test_id, normative_profile_id, recall_text, coverage_pct, z_coverage, wpm_effective, z_wpm, rci_coverage, created_at, qualitative_label";

    private final JdbcTemplate jdbcTemplate;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void save(SessionResult result) {
        jdbcTemplate.update(
                "INSERT INTO session_results(" + SESSION_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)",
                result.sessionId(), result.testId(), result.normativeProfileId(), result.recallText(),
                result.coveragePct(), result.zCoverage(), result.wpmEffective(),
                nullable(result.zWpm()), nullable(result.rciCoverage()),
                result.createdAt().toString(), result.qualitativeLabel().name());
        List<KeypointResult> keypoints = result.keypointResults();
        for (int i = 0; i < keypoints.size(); i++) {
            KeypointResult kp = keypoints.get(i);
            jdbcTemplate.update(
                    "INSERT INTO keypoint_results(session_id, keypoint_id, ordinal_pos, keypoint_text, hit, matched_tokens) VALUES (?,?,?,?,?,?)",
                    result.sessionId(), kp.keypointId(), i, kp.text(), kp.hit(), TokenColumns.join(kp.matchedTokens()));
        }
    }

    public List<SessionResult> listAll() {
        Map<String, List<KeypointResult>> keypoints = new HashMap<>();
        jdbcTemplate.query(
                "SELECT session_id, keypoint_id, keypoint_text, hit, matched_tokens FROM keypoint_results ORDER BY session_id, ordinal_pos",
                (RowCallbackHandler) rs -> keypoints.computeIfAbsent(rs.getString(1), k -> new ArrayList<>())
                        .add(new KeypointResult(rs.getInt(2), rs.getString(3), rs.getBoolean(4), TokenColumns.split(rs.getString(5)))));
        return jdbcTemplate.query(
                "SELECT " + SESSION_COLUMNS + " FROM session_results ORDER BY seq DESC",
                sessionMapper(keypoints));
    }

    public Optional<SessionResult> latest() {
        List<String> ids = jdbcTemplate.queryForList(
                "SELECT session_id FROM session_results ORDER BY seq DESC LIMIT 1", String.class);
        if (ids.isEmpty()) {
            return Optional.empty();
        }
        String sessionId = ids.get(0);
        List<KeypointResult> keypoints = jdbcTemplate.query(
                "SELECT keypoint_id, keypoint_text, hit, matched_tokens FROM keypoint_results WHERE session_id=? ORDER BY ordinal_pos",
                (rs, n) -> new KeypointResult(rs.getInt(1), rs.getString(2), rs.getBoolean(3), TokenColumns.split(rs.getString(4))),
                sessionId);
        return jdbcTemplate.query(
                "SELECT " + SESSION_COLUMNS + " FROM session_results WHERE session_id=?",
                sessionMapper(Map.of(sessionId, keypoints)),
                sessionId).stream().findFirst();
    }

    @Transactional
    public void clear() {
        jdbcTemplate.update("DELETE FROM keypoint_results");
        jdbcTemplate.update("DELETE FROM session_results");
    }

    public void saveFeedback(String sessionId, String feedback) {
        jdbcTemplate.update("UPDATE session_results SET narrative_feedback=? WHERE session_id=?", feedback, sessionId);
    }

    public Optional<String> loadFeedback(String sessionId) {
        List<String> rows = jdbcTemplate.query(
                "SELECT narrative_feedback FROM session_results WHERE session_id=?",
                (rs, n) -> rs.getString(1),
                sessionId);
        return rows.stream().filter(Objects::nonNull).findFirst();
    }

    private RowMapper<SessionResult> sessionMapper(Map<String, List<KeypointResult>> keypoints) {
        return (rs, n) -> new SessionResult(
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                rs.getDouble(5), rs.getDouble(6), rs.getInt(7),
                optional((Double) rs.getObject(8)), optional((Double) rs.getObject(9)),
                Instant.parse(rs.getString(10)),
                keypoints.getOrDefault(rs.getString(1), List.of()),
                QualitativeLabel.valueOf(rs.getString(11)));
    }

    private static Double nullable(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static OptionalDouble optional(Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
