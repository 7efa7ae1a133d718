package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FeedbackCategory {
    GENERAL("general"),
    TECHNICAL("technical"),
    FEATURE("feature"),
    SERVICE("service"),
    OTHER("other");

    private final String value;

    FeedbackCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FeedbackCategory fromValue(String value) {
        for (FeedbackCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown feedback category: " + value);
    }
}
