package com.herzen.recall.session;

import java.util.List;
import java.util.Optional;

/**
 * External analysis service writing a short narrative about a recall attempt. The narrative is
 * advisory and never affects scores.
 */
public interface NarrativeFeedbackClient {
    Optional<String> analyze(String passage, String recallText, List<String> keypointTexts);
}
