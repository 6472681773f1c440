package com.herzen.recall.norms;

import com.herzen.recall.norms.NormativeModels.NormativeProfile;
import com.herzen.recall.norms.NormativeModels.ProfileResolution;
import com.herzen.recall.scoring.ScoringModels.SessionResult;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Reliable Change Index of coverage against the previous session, using the standard error of
 * the difference {@code sd * sqrt(2 * (1 - r))}. |RCI| above 1.96 reads as a reliable change at
 * roughly 95% confidence; that interpretation is left to consumers.
 */
@Component
public class ReliableChangeCalculator {

    public double standardErrorOfDifference(NormativeProfile profile) {
        return profile.sdCoverage() * Math.sqrt(2.0 * (1.0 - profile.reliabilityCoverage()));
    }

    public OptionalDouble rciCoverage(ProfileResolution resolution, double coveragePct, @Nullable SessionResult previous) {
        if (previous == null) {
            return OptionalDouble.empty();
        }
        return resolution.fold(
                profile -> OptionalDouble.of((coveragePct - previous.coveragePct()) / standardErrorOfDifference(profile)),
                missingId -> OptionalDouble.empty());
    }
}
