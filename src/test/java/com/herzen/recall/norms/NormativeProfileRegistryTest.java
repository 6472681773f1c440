package com.herzen.recall.norms;

import com.herzen.recall.norms.NormativeModels.NormativeProfile;
import com.herzen.recall.norms.NormativeModels.ProfileResolution;
import com.herzen.recall.scoring.ScoringModels.Language;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormativeProfileRegistryTest {

    private static NormativeProfile profile(String id, double sdCoverage, double reliability) {
        return new NormativeProfile(id, id, Language.PT_BR, 180, 30, 65.0, sdCoverage, reliability);
    }

    @Test
    void resolvesKnownProfileAndReportsMissingOnes() {
        NormativeProfileRegistry registry = new NormativeProfileRegistry(
                List.of(profile("a", 15, 0.8), profile("b", 12, 0.75)), "a");

        ProfileResolution found = registry.resolve("b");
        assertTrue(found.isResolved());
        assertEquals(12.0, found.fold(NormativeProfile::sdCoverage, id -> -1.0));

        ProfileResolution missing = registry.resolve("nope");
        assertFalse(missing.isResolved());
        assertEquals("nope", missing.profileId());
        assertFalse(registry.resolve(null).isResolved());

        assertEquals(List.of("a", "b"), registry.all().stream().map(NormativeProfile::id).toList());
        assertEquals("a", registry.defaultProfileId());
    }

    @Test
    void rejectsDuplicateIds() {
        assertThrows(InvalidProfileException.class,
                () -> new NormativeProfileRegistry(List.of(profile("a", 15, 0.8), profile("a", 10, 0.7)), "a"));
    }

    @Test
    void rejectsProfilesThatWouldYieldNonFiniteScores() {
        assertThrows(InvalidProfileException.class, () -> profile("sd-zero", 0.0, 0.8));
        assertThrows(InvalidProfileException.class, () -> profile("sd-negative", -1.0, 0.8));
        assertThrows(InvalidProfileException.class, () -> profile("r-one", 15.0, 1.0));
        assertThrows(InvalidProfileException.class, () -> profile("r-zero", 15.0, 0.0));
        assertThrows(InvalidProfileException.class, () -> profile("r-above", 15.0, 1.2));
        assertThrows(InvalidProfileException.class,
                () -> new NormativeProfile("wpm", "wpm", Language.PT_BR, 180, 0, 65.0, 15.0, 0.8));
        assertThrows(InvalidProfileException.class,
                () -> new NormativeProfile("nan", "nan", Language.PT_BR, 180, 30, Double.NaN, 15.0, 0.8));
        assertThrows(InvalidProfileException.class,
                () -> new NormativeProfile(" ", "blank", Language.PT_BR, 180, 30, 65.0, 15.0, 0.8));
    }

    @Test
    void buildsFromBoundProperties() {
        NormativeProfileProperties.Profile p = new NormativeProfileProperties.Profile();
        p.setId("adult_en_us_general");
        p.setLabel("General Adult (en-US) - Pilot");
        p.setLanguage("en-US");
        p.setMeanWpm(230);
        p.setSdWpm(40);
        p.setMeanCoverage(65.0);
        p.setSdCoverage(15.0);
        p.setReliabilityCoverage(0.80);

        NormativeProfileProperties properties = new NormativeProfileProperties();
        properties.setDefaultProfileId("adult_en_us_general");
        properties.setProfiles(List.of(p));

        NormativeProfileRegistry registry = new NormativeProfileRegistry(properties);
        NormativeProfile loaded = registry.all().get(0);
        assertEquals(Language.EN_US, loaded.language());
        assertEquals(230.0, loaded.meanWpm());
    }

    @Test
    void invalidBoundProfileFailsAtLoadTime() {
        NormativeProfileProperties.Profile p = new NormativeProfileProperties.Profile();
        p.setId("broken");
        p.setSdWpm(30);
        p.setSdCoverage(15);
        p.setReliabilityCoverage(1.0);
        NormativeProfileProperties properties = new NormativeProfileProperties();
        properties.setProfiles(List.of(p));

        assertThrows(InvalidProfileException.class, () -> new NormativeProfileRegistry(properties));
    }
}
