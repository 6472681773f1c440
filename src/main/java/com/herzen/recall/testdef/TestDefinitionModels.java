package com.herzen.recall.testdef;

import com.herzen.recall.scoring.ScoringModels.Complexity;
import com.herzen.recall.scoring.ScoringModels.Language;

import java.util.List;

public class TestDefinitionModels {
    /**
     * A request to build a test. {@code passage} and {@code keypoints} carry content produced
     * elsewhere; they are ignored when the content is generated.
     */
    public record TestRequest(String topic,
                              Language language,
                              Complexity complexity,
                              Integer durationSec,
                              Integer calibratedWpm,
                              String normativeProfileId,
                              String passage,
                              List<String> keypoints) {}

    public record TestPlan(String topic,
                           Language language,
                           Complexity complexity,
                           int durationSec,
                           int baseWpm,
                           int targetWords,
                           int keypointCount,
                           String normativeProfileId) {}

    public record GeneratedContent(String passage, List<String> keypoints) {}
}
