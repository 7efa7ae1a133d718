package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FeedbackStatus {
    PENDING("pending"),
    VIEWED("viewed"),
    ADDRESSED("addressed");

    private final String value;

    FeedbackStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FeedbackStatus fromValue(String value) {
        for (FeedbackStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown feedback status: " + value);
    }
}
