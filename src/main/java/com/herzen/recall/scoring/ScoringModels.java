package com.herzen.recall.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.herzen.recall.norms.QualitativeLabel;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

public class ScoringModels {
    public enum Language {
        PT_BR("pt-BR"),
        EN_US("en-US"),
        ES_ES("es-ES");

        private final String tag;

        Language(String tag) {
            this.tag = tag;
        }

        @JsonValue
        public String tag() {
            return tag;
        }

        /**
         * Unknown or missing tags resolve to {@link #PT_BR}, the base language of the stopword defaults.
         */
        @JsonCreator
        public static Language fromTag(String tag) {
            if (tag == null) return PT_BR;
            for (Language language : values()) {
                if (language.tag.equalsIgnoreCase(tag.trim()) || language.name().equalsIgnoreCase(tag.trim())) {
                    return language;
                }
            }
            return PT_BR;
        }
    }

    public enum Complexity {
        NEUTRAL, DENSE;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Complexity fromCode(String code) {
            return code == null ? NEUTRAL : valueOf(code.trim().toUpperCase(Locale.ROOT));
        }
    }

    public record Keypoint(int id, String text, List<String> tokens) {
        public Keypoint {
            tokens = tokens == null ? List.of() : List.copyOf(tokens);
        }
    }

    public record TestInstance(String id,
                               Language language,
                               String topic,
                               Complexity complexity,
                               String passage,
                               List<Keypoint> keypoints,
                               int targetWords,
                               int allowedTimeSec,
                               String normativeProfileId,
                               Instant createdAt) {
        public TestInstance {
            keypoints = keypoints == null ? List.of() : List.copyOf(keypoints);
        }
    }

    public record KeypointMatch(boolean hit, List<String> matchedTokens, double coverageRatio) {}

    public record KeypointResult(int keypointId, String text, boolean hit, List<String> matchedTokens) {
        public KeypointResult {
            matchedTokens = List.copyOf(matchedTokens);
        }
    }

    public record SessionResult(String sessionId,
                                String testId,
                                String normativeProfileId,
                                String recallText,
                                double coveragePct,
                                double zCoverage,
                                int wpmEffective,
                                OptionalDouble zWpm,
                                OptionalDouble rciCoverage,
                                Instant createdAt,
                                List<KeypointResult> keypointResults,
                                QualitativeLabel qualitativeLabel) {
        public SessionResult {
            keypointResults = List.copyOf(keypointResults);
        }
    }
}
