package io.github.chirino.social.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HushChatStatus {
    OPEN,
    CLOSED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HushChatStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        return HushChatStatus.valueOf(value.toUpperCase());
    }
}
