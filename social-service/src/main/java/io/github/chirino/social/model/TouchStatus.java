package io.github.chirino.social.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Status of a keep-in-touch relation between two users. */
public enum TouchStatus {
    PENDING,
    ACCEPTED,
    DECLINED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TouchStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        return TouchStatus.valueOf(value.toUpperCase());
    }
}
