package com.herzen.recall.norms;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "recall.norms")
public class NormativeProfileProperties {

    /** Profile used when a test request does not name one. */
    private String defaultProfileId = "adult_pt_br_general";

    @Valid
    private List<Profile> profiles = new ArrayList<>();

    public String getDefaultProfileId() {
        return defaultProfileId;
    }

    public void setDefaultProfileId(String defaultProfileId) {
        this.defaultProfileId = defaultProfileId;
    }

    public List<Profile> getProfiles() {
        return profiles;
    }

    public void setProfiles(List<Profile> profiles) {
        this.profiles = profiles;
    }

    public static class Profile {
        @NotBlank
        private String id;
        private String label;
        private String language = "pt-BR";
        private double meanWpm;
        private double sdWpm;
        private double meanCoverage;
        private double sdCoverage;
        private double reliabilityCoverage;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public double getMeanWpm() {
            return meanWpm;
        }

        public void setMeanWpm(double meanWpm) {
            this.meanWpm = meanWpm;
        }

        public double getSdWpm() {
            return sdWpm;
        }

        public void setSdWpm(double sdWpm) {
            this.sdWpm = sdWpm;
        }

        public double getMeanCoverage() {
            return meanCoverage;
        }

        public void setMeanCoverage(double meanCoverage) {
            this.meanCoverage = meanCoverage;
        }

        public double getSdCoverage() {
            return sdCoverage;
        }

        public void setSdCoverage(double sdCoverage) {
            this.sdCoverage = sdCoverage;
        }

        public double getReliabilityCoverage() {
            return reliabilityCoverage;
        }

        public void setReliabilityCoverage(double reliabilityCoverage) {
            this.reliabilityCoverage = reliabilityCoverage;
        }
    }
}
