package io.github.chirino.social.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HushRole {
    OWNER,
    MEMBER;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HushRole fromString(String value) {
        if (value == null) {
            return null;
        }
        return HushRole.valueOf(value.toUpperCase());
    }
}
