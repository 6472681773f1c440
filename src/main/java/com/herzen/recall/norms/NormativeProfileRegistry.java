package com.herzen.recall.norms;

import com.herzen.recall.norms.NormativeModels.NormativeProfile;
import com.herzen.recall.norms.NormativeModels.ProfileResolution;
import com.herzen.recall.scoring.ScoringModels.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normative profiles keyed by id. Every profile is validated when the registry is built, so an
 * invalid configuration stops the application from starting instead of producing NaN scores.
 */
@Component
public class NormativeProfileRegistry {
    private static final Logger log = LoggerFactory.getLogger(NormativeProfileRegistry.class);

    private final Map<String, NormativeProfile> profiles;
    private final List<NormativeProfile> ordered;
    private final String defaultProfileId;

    @Autowired
    public NormativeProfileRegistry(NormativeProfileProperties properties) {
        this(properties.getProfiles().stream().map(NormativeProfileRegistry::toProfile).toList(),
                properties.getDefaultProfileId());
    }

    public NormativeProfileRegistry(Collection<NormativeProfile> profiles, String defaultProfileId) {
        Map<String, NormativeProfile> byId = new LinkedHashMap<>();
        for (NormativeProfile profile : profiles) {
            if (byId.putIfAbsent(profile.id(), profile) != null) {
                throw new InvalidProfileException("Duplicate normative profile id: " + profile.id());
            }
        }
        this.profiles = Map.copyOf(byId);
        this.ordered = List.copyOf(byId.values());
        this.defaultProfileId = defaultProfileId;
        if (defaultProfileId != null && !byId.containsKey(defaultProfileId)) {
            log.warn("Default normative profile '{}' is not among the {} configured profiles", defaultProfileId, byId.size());
        }
        log.info("Loaded {} normative profiles: {}", byId.size(), byId.keySet());
    }

    public ProfileResolution resolve(String profileId) {
        NormativeProfile profile = profileId == null ? null : profiles.get(profileId);
        if (profile == null) {
            log.debug("Normative profile '{}' not found", profileId);
            return ProfileResolution.missing(profileId);
        }
        return ProfileResolution.resolved(profile);
    }

    public List<NormativeProfile> all() {
        return ordered;
    }

    public String defaultProfileId() {
        return defaultProfileId;
    }

    private static NormativeProfile toProfile(NormativeProfileProperties.Profile p) {
        return new NormativeProfile(p.getId(), p.getLabel(), Language.fromTag(p.getLanguage()),
                p.getMeanWpm(), p.getSdWpm(), p.getMeanCoverage(), p.getSdCoverage(), p.getReliabilityCoverage());
    }
}
