package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UserStatus {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    UserStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public UserStatus toggle() {
        return this == ACTIVE ? INACTIVE : ACTIVE;
    }
}
