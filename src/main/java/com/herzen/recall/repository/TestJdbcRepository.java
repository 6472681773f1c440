package com.herzen.recall.repository;

import com.herzen.recall.scoring.ScoringModels.Complexity;
import com.herzen.recall.scoring.ScoringModels.Keypoint;
import com.herzen.recall.scoring.ScoringModels.Language;
import com.herzen.recall.scoring.ScoringModels.TestInstance;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class TestJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public TestJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void save(TestInstance test) {
        jdbcTemplate.update(
                "INSERT INTO test_instances(test_id, language, topic, complexity, passage, target_words, allowed_time_sec, normative_profile_id, created_at) VALUES (?,?,?,?,?,?,?,?,?)",
                test.id(), test.language().tag(), test.topic(), test.complexity().code(), test.passage(),
                test.targetWords(), test.allowedTimeSec(), test.normativeProfileId(), test.createdAt().toString());
        for (int i = 0; i < test.keypoints().size(); i++) {
            Keypoint kp = test.keypoints().get(i);
            jdbcTemplate.update(
                    "INSERT INTO test_keypoints(test_id, keypoint_id, ordinal_pos, keypoint_text, tokens) VALUES (?,?,?,?,?)",
                    test.id(), kp.id(), i, kp.text(), TokenColumns.join(kp.tokens()));
        }
    }

    public Optional<TestInstance> findById(String testId) {
        List<Keypoint> keypoints = jdbcTemplate.query(
                "SELECT keypoint_id, keypoint_text, tokens FROM test_keypoints WHERE test_id=? ORDER BY ordinal_pos",
                (rs, n) -> new Keypoint(rs.getInt(1), rs.getString(2), TokenColumns.split(rs.getString(3))),
                testId);

        List<TestInstance> rows = jdbcTemplate.query(
                "SELECT test_id, language, topic, complexity, passage, target_words, allowed_time_sec, normative_profile_id, created_at FROM test_instances WHERE test_id=?",
                (rs, n) -> new TestInstance(
                        rs.getString(1), Language.fromTag(rs.getString(2)), rs.getString(3),
                        Complexity.fromCode(rs.getString(4)), rs.getString(5), keypoints,
                        rs.getInt(6), rs.getInt(7), rs.getString(8), Instant.parse(rs.getString(9))),
                testId);
        return rows.stream().findFirst();
    }
}
