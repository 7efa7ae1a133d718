package io.factorialsystems.federationserver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UpdateType {
    NEWS("news", false),
    ANNOUNCEMENT("announcement", false),
    BLOGS("blogs", true),
    GALLERY("gallery", false),
    NOTICES("notices", false),
    WORKSHOP("workshop", false);

    private final String value;
    private final boolean redirectUrlRequired;

    UpdateType(String value, boolean redirectUrlRequired) {
        this.value = value;
        this.redirectUrlRequired = redirectUrlRequired;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Only blog posts link out; every other type must not carry a redirect URL.
     */
    public boolean requiresRedirectUrl() {
        return redirectUrlRequired;
    }

    @JsonCreator
    public static UpdateType fromValue(String value) {
        for (UpdateType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown update type: " + value);
    }
}
