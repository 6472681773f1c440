package com.herzen.recall.testdef;

import com.herzen.recall.norms.NormativeModels.NormativeProfile;
import com.herzen.recall.norms.NormativeModels.ProfileResolution;
import com.herzen.recall.norms.NormativeProfileRegistry;
import com.herzen.recall.scoring.ScoringModels.Complexity;
import com.herzen.recall.scoring.ScoringModels.Language;
import com.herzen.recall.testdef.TestDefinitionModels.TestPlan;
import com.herzen.recall.testdef.TestDefinitionModels.TestRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Fills in the parameters of a test request: profile, language, topic, duration and the passage
 * length a reader at the base speed can cover in the allotted time.
 */
@Component
public class TestPlanner {
    public static final int MAX_DURATION_SEC = 3600;

    private final NormativeProfileRegistry profileRegistry;
    private final TestPlanningProperties properties;

    public TestPlanner(NormativeProfileRegistry profileRegistry, TestPlanningProperties properties) {
        this.profileRegistry = profileRegistry;
        this.properties = properties;
    }

    public TestPlan plan(TestRequest request) {
        String profileId = isBlank(request.normativeProfileId()) ? profileRegistry.defaultProfileId() : request.normativeProfileId();
        ProfileResolution resolution = profileRegistry.resolve(profileId);

        Language language = request.language() != null
                ? request.language()
                : resolution.fold(NormativeProfile::language, id -> Language.PT_BR);
        Complexity complexity = request.complexity() == null ? Complexity.NEUTRAL : request.complexity();

        int durationSec = request.durationSec() == null ? properties.getDefaultDurationSec() : request.durationSec();
        if (durationSec <= 0 || durationSec > MAX_DURATION_SEC) {
            throw new InvalidTestDefinitionException(
                    "Reading time must be between 1 and " + MAX_DURATION_SEC + " seconds, got " + durationSec);
        }

        int baseWpm = baseWpm(request.calibratedWpm(), resolution);
        return new TestPlan(topic(request.topic()), language, complexity, durationSec, baseWpm,
                targetWords(durationSec, complexity, baseWpm), properties.getKeypointCount(), profileId);
    }

    public int targetWords(int durationSec, Complexity complexity, int baseWpm) {
        long adjustedWpm = complexity == Complexity.DENSE ? Math.round(baseWpm * properties.getDenseWpmFactor()) : baseWpm;
        long words = Math.round(durationSec / 60.0 * adjustedWpm);
        if (words > Integer.MAX_VALUE) {
            throw new InvalidTestDefinitionException("Target length of " + words + " words is out of range");
        }
        return (int) words;
    }

    private int baseWpm(Integer calibratedWpm, ProfileResolution resolution) {
        if (calibratedWpm != null && calibratedWpm > 0) {
            return calibratedWpm;
        }
        return resolution.fold(p -> (int) Math.round(p.meanWpm()), id -> properties.getFallbackWpm());
    }

    private String topic(String requested) {
        if (!isBlank(requested)) {
            return requested.trim();
        }
        List<String> topics = properties.getTopics();
        if (topics.isEmpty()) {
            throw new InvalidTestDefinitionException("No topic given and no default topics configured");
        }
        return topics.get(ThreadLocalRandom.current().nextInt(topics.size()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
