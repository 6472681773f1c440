package com.herzen.recall.scoring;

import com.herzen.recall.norms.NormativeModels.NormativeScore;
import com.herzen.recall.scoring.ScoringModels.KeypointResult;
import com.herzen.recall.scoring.ScoringModels.SessionResult;
import com.herzen.recall.scoring.ScoringModels.TestInstance;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Packages the scoring outputs into an immutable {@link SessionResult}. Identifier and timestamp
 * come from the injected generator and clock. Standardized scores are rounded to two decimals here;
 * coverage keeps full precision since it feeds the next session's RCI.
 */
@Component
public class SessionResultAssembler {
    private final SessionIdGenerator idGenerator;
    private final Clock clock;

    public SessionResultAssembler(SessionIdGenerator idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public SessionResult assemble(TestInstance test,
                                  String recallText,
                                  List<KeypointResult> keypointResults,
                                  double coveragePct,
                                  int wpmEffective,
                                  NormativeScore normativeScore,
                                  OptionalDouble rciCoverage) {
        return new SessionResult(
                idGenerator.nextId(),
                test.id(),
                test.normativeProfileId(),
                recallText,
                coveragePct,
                round2(normativeScore.zCoverage()),
                wpmEffective,
                round2(normativeScore.zWpm()),
                round2(rciCoverage),
                clock.instant(),
                keypointResults,
                normativeScore.label());
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static OptionalDouble round2(OptionalDouble value) {
        return value.isPresent() ? OptionalDouble.of(round2(value.getAsDouble())) : value;
    }
}
