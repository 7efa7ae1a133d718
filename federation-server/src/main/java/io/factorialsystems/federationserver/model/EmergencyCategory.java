package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EmergencyCategory {
    FIRE("Fire"),
    POLICE("Police"),
    AMBULANCE("Ambulance"),
    ELECTRICIAN("Electrician"),
    PLUMBER("Plumber"),
    OTHER("Other");

    private final String value;

    EmergencyCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EmergencyCategory fromValue(String value) {
        for (EmergencyCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown emergency category: " + value);
    }
}
