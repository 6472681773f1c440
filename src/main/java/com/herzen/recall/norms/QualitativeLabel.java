package com.herzen.recall.norms;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QualitativeLabel {
    WITHIN_EXPECTED_RANGE("within expected range"),
    MILDLY_REDUCED("mildly reduced"),
    BELOW_EXPECTED_RANGE("below expected range"),
    NORMATIVE_DATA_UNAVAILABLE("normative data unavailable");

    private final String text;

    QualitativeLabel(String text) {
        this.text = text;
    }

    @JsonValue
    public String text() {
        return text;
    }
}
