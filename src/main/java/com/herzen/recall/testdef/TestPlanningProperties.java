package com.herzen.recall.testdef;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "recall.tests")
public class TestPlanningProperties {

    @Min(1)
    private int defaultDurationSec = 90;

    @Min(1)
    private int keypointCount = 6;

    /** Reading speed assumed when neither a calibrated speed nor a profile is available. */
    @Min(1)
    private int fallbackWpm = 180;

    /** Dense passages are planned at this fraction of the base reading speed. */
    @DecimalMin("0.1")
    @DecimalMax("1.0")
    private double denseWpmFactor = 0.85;

    private List<String> topics = new ArrayList<>();

    public int getDefaultDurationSec() {
        return defaultDurationSec;
    }

    public void setDefaultDurationSec(int defaultDurationSec) {
        this.defaultDurationSec = defaultDurationSec;
    }

    public int getKeypointCount() {
        return keypointCount;
    }

    public void setKeypointCount(int keypointCount) {
        this.keypointCount = keypointCount;
    }

    public int getFallbackWpm() {
        return fallbackWpm;
    }

    public void setFallbackWpm(int fallbackWpm) {
        this.fallbackWpm = fallbackWpm;
    }

    public double getDenseWpmFactor() {
        return denseWpmFactor;
    }

    public void setDenseWpmFactor(double denseWpmFactor) {
        this.denseWpmFactor = denseWpmFactor;
    }

    public List<String> getTopics() {
        return topics;
    }

    public void setTopics(List<String> topics) {
        this.topics = topics;
    }
}
