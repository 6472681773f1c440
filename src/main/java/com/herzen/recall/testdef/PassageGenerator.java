package com.herzen.recall.testdef;

import com.herzen.recall.scoring.ScoringModels.Complexity;
import com.herzen.recall.scoring.ScoringModels.Language;
import com.herzen.recall.testdef.TestDefinitionModels.GeneratedContent;

/**
 * External text-generation service. Implementations return a passage of roughly
 * {@code targetWords} words and exactly {@code keypointCount} keypoint sentences.
 */
public interface PassageGenerator {
    GeneratedContent generate(String topic, Language language, Complexity complexity, int targetWords, int keypointCount);
}
