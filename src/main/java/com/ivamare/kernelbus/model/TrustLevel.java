package com.ivamare.kernelbus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of the actor behind an audited action.
 */
public enum TrustLevel {
    SYSTEM("system"),
    OPERATOR("operator"),
    VERIFIED("verified"),
    STANDARD("standard");

    private final String value;

    TrustLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TrustLevel fromValue(String value) {
        for (TrustLevel level : values()) {
            if (level.value.equals(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown TrustLevel: " + value);
    }
}
