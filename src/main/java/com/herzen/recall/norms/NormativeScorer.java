package com.herzen.recall.norms;

import com.herzen.recall.norms.NormativeModels.NormativeProfile;
import com.herzen.recall.norms.NormativeModels.NormativeScore;
import com.herzen.recall.norms.NormativeModels.ProfileResolution;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Standardizes coverage and reading speed against a profile. The label cut points on
 * {@code z_coverage} are policy constants, evaluated top-down.
 */
@Component
public class NormativeScorer {
    public static final double WITHIN_RANGE_MIN_Z = -1.0;
    public static final double MILDLY_REDUCED_MIN_Z = -2.0;

    public NormativeScore score(ProfileResolution resolution, double coveragePct, int wpmEffective) {
        return resolution.fold(
                profile -> standardize(profile, coveragePct, wpmEffective),
                missingId -> new NormativeScore(0.0, OptionalDouble.empty(), QualitativeLabel.NORMATIVE_DATA_UNAVAILABLE));
    }

    private NormativeScore standardize(NormativeProfile profile, double coveragePct, int wpmEffective) {
        double zCoverage = (coveragePct - profile.meanCoverage()) / profile.sdCoverage();
        double zWpm = (wpmEffective - profile.meanWpm()) / profile.sdWpm();
        return new NormativeScore(zCoverage, OptionalDouble.of(zWpm), label(zCoverage));
    }

    static QualitativeLabel label(double zCoverage) {
        if (zCoverage >= WITHIN_RANGE_MIN_Z) return QualitativeLabel.WITHIN_EXPECTED_RANGE;
        if (zCoverage >= MILDLY_REDUCED_MIN_Z) return QualitativeLabel.MILDLY_REDUCED;
        return QualitativeLabel.BELOW_EXPECTED_RANGE;
    }
}
