package com.herzen.recall.norms;

import com.herzen.recall.scoring.ScoringModels.Language;

import java.util.OptionalDouble;
import java.util.function.Function;

public class NormativeModels {
    /**
     * Reference population. Coverage statistics are in percentage points. Construction rejects
     * non-positive standard deviations and reliabilities outside (0, 1).
     */
    public record NormativeProfile(String id,
                                   String label,
                                   Language language,
                                   double meanWpm,
                                   double sdWpm,
                                   double meanCoverage,
                                   double sdCoverage,
                                   double reliabilityCoverage) {
        public NormativeProfile {
            if (id == null || id.isBlank()) {
                throw new InvalidProfileException("Normative profile id must not be blank");
            }
            requireFinite(id, "mean_wpm", meanWpm);
            requireFinite(id, "mean_coverage", meanCoverage);
            requirePositive(id, "sd_wpm", sdWpm);
            requirePositive(id, "sd_coverage", sdCoverage);
            if (!(reliabilityCoverage > 0.0 && reliabilityCoverage < 1.0)) {
                throw new InvalidProfileException("Profile " + id + ": reliability_coverage must be in (0,1), got " + reliabilityCoverage);
            }
        }

        private static void requireFinite(String id, String field, double value) {
            if (!Double.isFinite(value)) {
                throw new InvalidProfileException("Profile " + id + ": " + field + " must be finite, got " + value);
            }
        }

        private static void requirePositive(String id, String field, double value) {
            if (!(Double.isFinite(value) && value > 0.0)) {
                throw new InvalidProfileException("Profile " + id + ": " + field + " must be > 0, got " + value);
            }
        }
    }

    /**
     * Outcome of looking a profile up by id. Exactly one of the two variants exists.
     */
    public interface ProfileResolution {
        String profileId();

        <T> T fold(Function<NormativeProfile, T> onResolved, Function<String, T> onMissing);

        default boolean isResolved() {
            return fold(p -> true, id -> false);
        }

        static ProfileResolution resolved(NormativeProfile profile) {
            return new Resolved(profile);
        }

        static ProfileResolution missing(String profileId) {
            return new Missing(profileId);
        }
    }

    public record Resolved(NormativeProfile profile) implements ProfileResolution {
        @Override
        public String profileId() {
            return profile.id();
        }

        @Override
        public <T> T fold(Function<NormativeProfile, T> onResolved, Function<String, T> onMissing) {
            return onResolved.apply(profile);
        }
    }

    public record Missing(String profileId) implements ProfileResolution {
        @Override
        public <T> T fold(Function<NormativeProfile, T> onResolved, Function<String, T> onMissing) {
            return onMissing.apply(profileId);
        }
    }

    /** Full-precision standardized scores; rounding happens when the session result is assembled. */
    public record NormativeScore(double zCoverage, OptionalDouble zWpm, QualitativeLabel label) {}
}
